package com.nisfix.compliance.config;

import com.nisfix.compliance.application.TokenIssuer;
import com.nisfix.compliance.domain.Organization;
import com.nisfix.compliance.domain.OrganizationType;
import com.nisfix.compliance.domain.SecureLink;
import com.nisfix.compliance.domain.SecureLinkType;
import com.nisfix.compliance.domain.User;
import com.nisfix.compliance.domain.UserRole;
import com.nisfix.compliance.domain.ports.OrganizationRepository;
import com.nisfix.compliance.domain.ports.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ConfigurableApplicationContext;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MagicLinkCliRunnerTest {

    @Mock private TokenIssuer tokenIssuer;
    @Mock private UserRepository users;
    @Mock private OrganizationRepository organizations;
    @Mock private ConfigurableApplicationContext context;

    private MagicLinkCliRunner runner;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    private final OffsetDateTime now = OffsetDateTime.parse("2026-03-01T09:00:00Z");

    @BeforeEach
    void setUp() {
        runner = new MagicLinkCliRunner(tokenIssuer, users, organizations, new AppProperties(), context);
    }

    @Test
    void shouldPrintSignInLinkForActiveUser() {
        Organization company = Organization.create(OrganizationType.COMPANY, "Acme", null, "admin@acme.test", now);
        User admin = User.create("admin@acme.test", "Admin", UserRole.ADMIN, company.getId(), now);
        SecureLink link = new SecureLink(UUID.randomUUID(), "f00d", SecureLinkType.AUTH, admin.getEmail(),
                admin.getId(), null, now.plusMinutes(15), true, null, now);
        when(users.findByEmail("admin@acme.test")).thenReturn(Optional.of(admin));
        when(organizations.findById(company.getId())).thenReturn(Optional.of(company));
        when(tokenIssuer.issueSignInLink(admin)).thenReturn(link);

        int code = runner.issue(" Admin@Acme.test ", "https://app.example.test/", out);

        assertThat(code).isZero();
        assertThat(buffer.toString(StandardCharsets.UTF_8))
                .contains("Magic link: https://app.example.test/auth/verify/f00d")
                .contains("Expires at: " + link.getExpiresAt());
    }

    @Test
    void shouldFailForUnknownUser() {
        when(users.findByEmail("ghost@acme.test")).thenReturn(Optional.empty());

        assertThat(runner.issue("ghost@acme.test", "http://localhost:3000", out)).isEqualTo(1);
        verify(tokenIssuer, never()).issueSignInLink(any());
        assertThat(buffer.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    void shouldRequireEmail() {
        assertThat(runner.issue(" ", "http://localhost:3000", out)).isEqualTo(2);
    }
}
