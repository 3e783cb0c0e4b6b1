package com.nisfix.compliance.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nisfix.compliance.application.TokenIssuer;
import com.nisfix.compliance.config.AuthenticatedUser;
import com.nisfix.compliance.config.JwtService;
import com.nisfix.compliance.domain.Organization;
import com.nisfix.compliance.domain.OrganizationType;
import com.nisfix.compliance.domain.SecureLink;
import com.nisfix.compliance.domain.User;
import com.nisfix.compliance.domain.UserRole;
import com.nisfix.compliance.domain.ports.OrganizationRepository;
import com.nisfix.compliance.domain.ports.UserRepository;
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

import java.time.OffsetDateTime;
import java.util.UUID;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.authentication;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Walks a requirement from invitation to approval through the HTTP API.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ComplianceFlowIntegrationTest {

    @Autowired private MockMvc mvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private OrganizationRepository organizations;
    @Autowired private UserRepository users;
    @Autowired private JwtService jwtService;
    @Autowired private TokenIssuer tokenIssuer;

    private String companyAdmin;
    private String companyViewer;
    private String supplierEmail;

    @BeforeEach
    void seedCompany() {
        OffsetDateTime now = OffsetDateTime.now();
        Organization company = organizations.save(Organization.create(OrganizationType.COMPANY,
                "Acme " + UUID.randomUUID(), "acme.test", "security@acme.test", now));
        User admin = users.save(User.create("admin-" + UUID.randomUUID() + "@acme.test", "Admin",
                UserRole.ADMIN, company.getId(), now));
        User viewer = users.save(User.create("viewer-" + UUID.randomUUID() + "@acme.test", "Viewer",
                UserRole.VIEWER, company.getId(), now));
        companyAdmin = jwtService.issuePair(admin, company).accessToken();
        companyViewer = jwtService.issuePair(viewer, company).accessToken();
        supplierEmail = "vendor-" + UUID.randomUUID() + "@supplier.test";
    }

    private ResultActions call(MockHttpServletRequestBuilder request, String token, Object body) throws Exception {
        request.header("Authorization", "Bearer " + token);
        if (body != null) {
            request.contentType(MediaType.APPLICATION_JSON).content(objectMapper.writeValueAsString(body));
        }
        return mvc.perform(request);
    }

    private JsonNode json(ResultActions result) throws Exception {
        return objectMapper.readTree(result.andReturn().getResponse().getContentAsString());
    }

    private String publishedQuestionnaire() throws Exception {
        String questionnaireId = json(call(post("/api/v1/questionnaires"), companyAdmin, objectMapper.readTree("""
                {"name": "Security baseline", "passingScore": 70,
                 "topics": [{"id": "access", "name": "Access control"}]}
                """)).andExpect(status().isCreated())).get("id").asText();

        call(post("/api/v1/questionnaires/" + questionnaireId + "/questions"), companyAdmin, objectMapper.readTree("""
                {"topicId": "access", "text": "Is MFA enforced for all staff?", "type": "YES_NO", "mustPass": true,
                 "options": [{"id": "yes", "text": "Yes", "points": 10, "correct": true},
                             {"id": "no", "text": "No", "points": 0, "correct": false}]}
                """)).andExpect(status().isCreated());

        call(post("/api/v1/questionnaires/" + questionnaireId + "/publish"), companyAdmin, null)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PUBLISHED"))
                .andExpect(jsonPath("$.questionCount").value(1));
        return questionnaireId;
    }

    private String onboardSupplier(String relationshipId) throws Exception {
        SecureLink invitation = tokenIssuer.issueInvitationLink(supplierEmail, UUID.fromString(relationshipId));
        String supplierToken = json(mvc.perform(post("/api/v1/auth/invitations/redeem")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"token\":\"" + invitation.getIdentifier() + "\",\"organizationName\":\"Vendor Co\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.organization.type").value("SUPPLIER")))
                .get("accessToken").asText();

        call(get("/api/v1/supplier/invitations"), supplierToken, null)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[*].id", hasItem(relationshipId)));
        call(post("/api/v1/supplier/invitations/" + relationshipId + "/accept"), supplierToken, null)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACTIVE"));
        return supplierToken;
    }

    @Test
    void shouldCarryRequirementFromInvitationToApproval() throws Exception {
        String questionnaireId = publishedQuestionnaire();

        String relationshipId = json(call(post("/api/v1/suppliers"), companyAdmin, objectMapper.readTree(
                "{\"email\":\"" + supplierEmail + "\",\"classification\":\"CRITICAL\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("PENDING")))
                .get("id").asText();

        call(post("/api/v1/suppliers"), companyAdmin, objectMapper.readTree(
                "{\"email\":\"" + supplierEmail + "\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("ALREADY_EXISTS"));

        String supplierToken = onboardSupplier(relationshipId);

        String requirementId = json(call(post("/api/v1/requirements"), companyAdmin, objectMapper.readTree(
                "{\"relationshipId\":\"" + relationshipId + "\",\"type\":\"QUESTIONNAIRE\"," +
                        "\"title\":\"Annual security review\",\"questionnaireId\":\"" + questionnaireId + "\"," +
                        "\"dueDate\":\"2099-01-01T00:00:00Z\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.overdue").value(false)))
                .get("id").asText();

        JsonNode response = json(call(post("/api/v1/supplier/requirements/" + requirementId + "/start"),
                supplierToken, null).andExpect(status().isCreated()));
        String responseId = response.get("id").asText();

        String questionId = json(call(get("/api/v1/questionnaires/" + questionnaireId), companyAdmin, null)
                .andExpect(status().isOk())).get("questions").get(0).get("id").asText();

        call(post("/api/v1/supplier/responses/" + responseId + "/submit"), supplierToken, objectMapper.readTree(
                "{\"answers\":[{\"questionId\":\"" + questionId + "\",\"selectedOptions\":[\"yes\"]}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requirement.status").value("SUBMITTED"))
                .andExpect(jsonPath("$.submission.passed").value(true))
                .andExpect(jsonPath("$.submission.percentageScore").value(100.0));

        call(get("/api/v1/requirements/" + requirementId + "/review"), companyAdmin, null)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.submission.totalScore").value(10));

        call(post("/api/v1/requirements/" + requirementId + "/approve"), companyViewer,
                objectMapper.readTree("{\"notes\":\"Looks good\"}"))
                .andExpect(status().isForbidden());

        call(post("/api/v1/requirements/" + requirementId + "/approve"), companyAdmin,
                objectMapper.readTree("{\"notes\":\"Looks good\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"))
                .andExpect(jsonPath("$.statusHistory[*].toStatus",
                        contains("PENDING", "IN_PROGRESS", "SUBMITTED", "APPROVED")))
                .andExpect(jsonPath("$.statusHistory[3].reason").value("Looks good"));

        call(post("/api/v1/requirements/" + requirementId + "/approve"), companyAdmin, null)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("CANNOT_REVIEW"));
    }

    @Test
    void shouldNotAssignToPendingSupplier() throws Exception {
        String questionnaireId = publishedQuestionnaire();
        String relationshipId = json(call(post("/api/v1/suppliers"), companyAdmin, objectMapper.readTree(
                "{\"email\":\"" + supplierEmail + "\"}")).andExpect(status().isCreated())).get("id").asText();

        call(post("/api/v1/requirements"), companyAdmin, objectMapper.readTree(
                "{\"relationshipId\":\"" + relationshipId + "\",\"type\":\"QUESTIONNAIRE\"," +
                        "\"title\":\"Too early\",\"questionnaireId\":\"" + questionnaireId + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("CANNOT_ASSIGN"));

        call(post("/api/v1/suppliers/" + relationshipId + "/terminate"), companyAdmin, null)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_TRANSITION"));
    }

    @Test
    void shouldKeepOrganizationsApart() throws Exception {
        String relationshipId = json(call(post("/api/v1/suppliers"), companyAdmin, objectMapper.readTree(
                "{\"email\":\"" + supplierEmail + "\"}")).andExpect(status().isCreated())).get("id").asText();
        String supplierToken = onboardSupplier(relationshipId);

        call(get("/api/v1/suppliers"), supplierToken, null)
                .andExpect(status().isForbidden());

        OffsetDateTime now = OffsetDateTime.now();
        Organization rival = organizations.save(Organization.create(OrganizationType.COMPANY, "Rival", null,
                "rival@rival.test", now));
        AuthenticatedUser rivalAdmin = new AuthenticatedUser(UUID.randomUUID(), rival.getId(),
                "admin@rival.test", UserRole.ADMIN, OrganizationType.COMPANY);

        mvc.perform(get("/api/v1/suppliers/" + relationshipId).with(authentication(
                        new UsernamePasswordAuthenticationToken(rivalAdmin, null,
                                AuthorityUtils.createAuthorityList("ROLE_ADMIN", "ROLE_COMPANY")))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
        call(get("/api/v1/suppliers"), companyAdmin, null)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount").value(1))
                .andExpect(jsonPath("$.items[0].status").value("ACTIVE"));
    }
}
