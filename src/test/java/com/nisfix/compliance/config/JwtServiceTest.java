package com.nisfix.compliance.config;

import com.nisfix.compliance.domain.Organization;
import com.nisfix.compliance.domain.OrganizationType;
import com.nisfix.compliance.domain.User;
import com.nisfix.compliance.domain.UserRole;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class JwtServiceTest {

    @Autowired
    private JwtService jwtService;

    private final OffsetDateTime now = OffsetDateTime.now();
    private final Organization supplier = Organization.create(OrganizationType.SUPPLIER, "Vendor Co", null,
            "owner@vendor.test", now);
    private final User user = User.create("Owner@Vendor.test", "Owner", UserRole.ADMIN, supplier.getId(), now);

    @Test
    void shouldCarryUserAndOrganizationClaims() {
        JwtService.TokenPair pair = jwtService.issuePair(user, supplier);

        assertThat(pair.tokenType()).isEqualTo("Bearer");
        assertThat(pair.expiresIn()).isEqualTo(jwtService.getAccessTtlSeconds());
        assertThat(jwtService.authenticate(pair.accessToken())).hasValueSatisfying(principal -> {
            assertThat(principal.userId()).isEqualTo(user.getId());
            assertThat(principal.organizationId()).isEqualTo(supplier.getId());
            assertThat(principal.email()).isEqualTo("owner@vendor.test");
            assertThat(principal.role()).isEqualTo(UserRole.ADMIN);
            assertThat(principal.organizationType()).isEqualTo(OrganizationType.SUPPLIER);
            assertThat(principal.isCompany()).isFalse();
        });
    }

    @Test
    void shouldKeepAccessAndRefreshTokensApart() {
        JwtService.TokenPair pair = jwtService.issuePair(user, supplier);

        assertThat(jwtService.authenticate(pair.refreshToken())).isEmpty();
        assertThat(jwtService.readRefreshToken(pair.accessToken())).isEmpty();
        assertThat(jwtService.readRefreshToken(pair.refreshToken())).isPresent();
    }

    @Test
    void shouldRejectInvalidToken() {
        assertThat(jwtService.authenticate("invalid-token")).isEmpty();
    }

    @Test
    void shouldRejectExpiredToken() {
        Clock past = Clock.fixed(Instant.parse("2020-01-01T00:00:00Z"), ZoneOffset.UTC);
        JwtService issuedLongAgo = new JwtService("test-secret-key-that-is-long-enough-for-hs256-signing",
                60, 120, past);

        String token = issuedLongAgo.issuePair(user, supplier).accessToken();

        assertThat(jwtService.authenticate(token)).isEmpty();
    }
}
