package com.nisfix.compliance.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nisfix.compliance.application.TemplateService;
import com.nisfix.compliance.config.AuthenticatedUser;
import com.nisfix.compliance.domain.Organization;
import com.nisfix.compliance.domain.OrganizationType;
import com.nisfix.compliance.domain.UserRole;
import com.nisfix.compliance.domain.ports.OrganizationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.time.OffsetDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.authentication;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * System catalogue, company templates and questionnaires started from templates.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TemplateFlowIntegrationTest {

    @Autowired private MockMvc mvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private OrganizationRepository organizations;
    @Autowired private TemplateService templateService;

    private RequestPostProcessor owner;
    private RequestPostProcessor rival;

    @BeforeEach
    void seedCompanies() {
        owner = companyAdmin("Acme");
        rival = companyAdmin("Rival");
    }

    private RequestPostProcessor companyAdmin(String name) {
        Organization company = organizations.save(Organization.create(OrganizationType.COMPANY,
                name + " " + UUID.randomUUID(), null, "security@" + name.toLowerCase() + ".test",
                OffsetDateTime.now()));
        AuthenticatedUser admin = new AuthenticatedUser(UUID.randomUUID(), company.getId(),
                "admin@" + name.toLowerCase() + ".test", UserRole.ADMIN, OrganizationType.COMPANY);
        return authentication(new UsernamePasswordAuthenticationToken(admin, null,
                AuthorityUtils.createAuthorityList("ROLE_ADMIN", "ROLE_COMPANY")));
    }

    private ResultActions call(MockHttpServletRequestBuilder request, RequestPostProcessor as, String body)
            throws Exception {
        request.with(as);
        if (body != null) {
            request.contentType(MediaType.APPLICATION_JSON).content(body);
        }
        return mvc.perform(request);
    }

    private JsonNode json(ResultActions result) throws Exception {
        return objectMapper.readTree(result.andReturn().getResponse().getContentAsString());
    }

    private String systemTemplateId(String category, String name) throws Exception {
        JsonNode items = json(call(get("/api/v1/templates").param("category", category).param("limit", "100"),
                owner, null).andExpect(status().isOk())).get("items");
        for (JsonNode item : items) {
            if (item.get("name").asText().equals(name)) {
                return item.get("id").asText();
            }
        }
        throw new AssertionError("no system template named " + name);
    }

    @Test
    void shouldSeedSystemCatalogueOnce() throws Exception {
        call(get("/api/v1/templates").param("category", "NIS2"), owner, null)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount").value(2))
                .andExpect(jsonPath("$.items[*].isSystem", everyItem(is(true))))
                .andExpect(jsonPath("$.items[*].name", hasItem("NIS2 Security Assessment")));
        call(get("/api/v1/templates").param("category", "ISO27001"), owner, null)
                .andExpect(jsonPath("$.items[*].name", hasItem("ISO 27001 Basic Assessment")));

        assertThat(templateService.seedSystemTemplates()).isZero();
    }

    @Test
    void shouldStartQuestionnaireFromSystemTemplate() throws Exception {
        String templateId = systemTemplateId("GDPR", "GDPR Compliance Checklist");
        int usageBefore = json(call(get("/api/v1/templates/" + templateId), owner, null)).get("usageCount").asInt();

        call(post("/api/v1/questionnaires/from-template"), owner,
                "{\"templateId\":\"" + templateId + "\",\"name\":\"Processor review\"}")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Processor review"))
                .andExpect(jsonPath("$.templateId").value(templateId))
                .andExpect(jsonPath("$.status").value("DRAFT"))
                .andExpect(jsonPath("$.passingScore").value(80))
                .andExpect(jsonPath("$.topics[0].id").value("lawful-basis"))
                .andExpect(jsonPath("$.topics.length()").value(11));

        call(get("/api/v1/templates/" + templateId), owner, null)
                .andExpect(jsonPath("$.usageCount").value(usageBefore + 1));

        call(post("/api/v1/questionnaires/from-template"), owner,
                "{\"templateId\":\"" + UUID.randomUUID() + "\"}")
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldShareCompanyTemplateOnlyOncePublishedGlobally() throws Exception {
        String templateId = json(call(post("/api/v1/templates"), owner, """
                {"name": "Cloud vendor baseline", "category": "custom", "defaultPassingScore": 85,
                 "topics": [{"id": "hosting", "name": "Hosting"}, {"id": "backups", "name": "Backups"}]}
                """)
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.visibility").value("DRAFT"))
                .andExpect(jsonPath("$.category").value("CUSTOM")))
                .get("id").asText();

        call(get("/api/v1/templates/" + templateId), rival, null).andExpect(status().isNotFound());

        call(post("/api/v1/templates/" + templateId + "/publish"), owner, "{\"visibility\":\"LOCAL\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.visibility").value("LOCAL"));
        call(post("/api/v1/questionnaires/from-template"), rival, "{\"templateId\":\"" + templateId + "\"}")
                .andExpect(status().isNotFound());

        call(post("/api/v1/templates/" + templateId + "/unpublish"), owner, null)
                .andExpect(jsonPath("$.visibility").value("DRAFT"));
        call(post("/api/v1/templates/" + templateId + "/publish"), owner, "{\"visibility\":\"GLOBAL\"}")
                .andExpect(status().isOk());

        call(post("/api/v1/questionnaires/from-template"), rival, "{\"templateId\":\"" + templateId + "\"}")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Cloud vendor baseline"))
                .andExpect(jsonPath("$.passingScore").value(85));

        call(patch("/api/v1/templates/" + templateId), rival, "{\"name\":\"Hijacked\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("CANNOT_MODIFY"));
        call(delete("/api/v1/templates/" + templateId), owner, null)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("CANNOT_MODIFY"));
        call(post("/api/v1/templates/" + templateId + "/unpublish"), owner, null)
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldImportTemplateDocument() throws Exception {
        call(post("/api/v1/templates/import"), owner, """
                {"name": "Imported checklist", "category": "CUSTOM", "version": "2.1",
                 "topics": [{"name": "Logging"}], "tags": ["imported"]}
                """)
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.version").value("2.1"))
                .andExpect(jsonPath("$.topics[0].order").value(1))
                .andExpect(jsonPath("$.tags[0]").value("imported"));

        call(get("/api/v1/templates/mine"), owner, null)
                .andExpect(jsonPath("$.items[*].name", hasItem("Imported checklist")));

        call(post("/api/v1/templates/import"), owner, "{not json")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));
        call(post("/api/v1/templates/import"), owner, "{\"name\":\"No category\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("category is required"));
    }

    @Test
    void shouldNotDeleteSystemTemplates() throws Exception {
        String templateId = systemTemplateId("NIS2", "NIS2 Quick Readiness Check");

        call(delete("/api/v1/templates/" + templateId), owner, null)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("CANNOT_MODIFY"));
    }
}
