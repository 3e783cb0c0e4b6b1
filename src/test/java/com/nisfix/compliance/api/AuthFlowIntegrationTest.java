package com.nisfix.compliance.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nisfix.compliance.config.RequestLoggingFilter;
import com.nisfix.compliance.domain.Organization;
import com.nisfix.compliance.domain.OrganizationType;
import com.nisfix.compliance.domain.User;
import com.nisfix.compliance.domain.UserRole;
import com.nisfix.compliance.domain.ports.OrganizationRepository;
import com.nisfix.compliance.domain.ports.UserRepository;
import com.nisfix.compliance.infrastructure.adapters.OutboxPublisherAdapter;
import com.nisfix.compliance.infrastructure.jpa.OutboxEventEntity;
import com.nisfix.compliance.infrastructure.jpa.SpringOutboxRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AuthFlowIntegrationTest {

    @Autowired private MockMvc mvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private OrganizationRepository organizations;
    @Autowired private UserRepository users;
    @Autowired private SpringOutboxRepository outbox;

    private User seedCompanyAdmin(String email) {
        OffsetDateTime now = OffsetDateTime.now();
        Organization company = organizations.save(Organization.create(OrganizationType.COMPANY,
                "Acme " + UUID.randomUUID(), null, email, now));
        return users.save(User.create(email, "Ada", UserRole.ADMIN, company.getId(), now));
    }

    private static String requestLink(String email) {
        return "{\"email\":\"" + email + "\"}";
    }

    private String latestLinkIdentifier(String email) throws Exception {
        OutboxEventEntity event = outbox.findAll().stream()
                .filter(e -> e.getType().equals(OutboxPublisherAdapter.MAGIC_LINK))
                .filter(e -> e.getRecipient().equals(email))
                .max(Comparator.comparing(OutboxEventEntity::getOccurredAt))
                .orElseThrow();
        String url = objectMapper.readTree(event.getPayloadJson()).get("url").asText();
        return url.substring(url.lastIndexOf('/') + 1);
    }

    @Test
    void shouldSignInWithMagicLinkExactlyOnce() throws Exception {
        String email = "ada-" + UUID.randomUUID() + "@acme.test";
        seedCompanyAdmin(email);

        mvc.perform(post("/api/v1/auth/magic-link").contentType(MediaType.APPLICATION_JSON)
                        .content(requestLink(email)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value(AuthController.MAGIC_LINK_SENT));

        String identifier = latestLinkIdentifier(email);
        assertThat(identifier).hasSize(64);

        String body = mvc.perform(post("/api/v1/auth/verify").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\":\"" + identifier + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tokenType").value("Bearer"))
                .andExpect(jsonPath("$.user.email").value(email))
                .andExpect(jsonPath("$.organization.type").value("COMPANY"))
                .andReturn().getResponse().getContentAsString();
        JsonNode tokens = objectMapper.readTree(body);

        mvc.perform(post("/api/v1/auth/verify").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\":\"" + identifier + "\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("ALREADY_USED"));

        mvc.perform(get("/api/v1/auth/me")
                        .header("Authorization", "Bearer " + tokens.get("accessToken").asText()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.email").value(email))
                .andExpect(header().exists(RequestLoggingFilter.REQUEST_ID_HEADER))
                .andExpect(request().attribute(RequestLoggingFilter.ORGANIZATION_ATTRIBUTE, notNullValue()));

        mvc.perform(post("/api/v1/auth/refresh").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"refreshToken\":\"" + tokens.get("refreshToken").asText() + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accessToken").isNotEmpty());
    }

    @Test
    void shouldAnswerUnknownEmailLikeKnownOne() throws Exception {
        mvc.perform(post("/api/v1/auth/magic-link").contentType(MediaType.APPLICATION_JSON)
                        .content(requestLink("nobody-" + UUID.randomUUID() + "@acme.test")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value(AuthController.MAGIC_LINK_SENT));
    }

    @Test
    void shouldRateLimitFourthRequestInWindow() throws Exception {
        String email = "busy-" + UUID.randomUUID() + "@acme.test";
        seedCompanyAdmin(email);

        for (int i = 0; i < 3; i++) {
            mvc.perform(post("/api/v1/auth/magic-link").contentType(MediaType.APPLICATION_JSON)
                            .content(requestLink(email)))
                    .andExpect(status().isOk());
        }
        mvc.perform(post("/api/v1/auth/magic-link").contentType(MediaType.APPLICATION_JSON)
                        .content(requestLink(email)))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists("Retry-After"))
                .andExpect(jsonPath("$.error").value("RATE_LIMIT_EXCEEDED"));
    }

    @Test
    void shouldRejectMalformedEmail() throws Exception {
        mvc.perform(post("/api/v1/auth/magic-link").contentType(MediaType.APPLICATION_JSON)
                        .content(requestLink("not-an-email")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));
    }

    @Test
    void shouldRejectUnknownToken() throws Exception {
        mvc.perform(post("/api/v1/auth/verify").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\":\"deadbeef\"}"))
                .andExpect(status().isNotFound());
        mvc.perform(post("/api/v1/auth/refresh").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"refreshToken\":\"garbage\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("INVALID_TOKEN"));
    }

    @Test
    void shouldRequireBearerTokenForProtectedEndpoints() throws Exception {
        mvc.perform(get("/api/v1/auth/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
    }
}
