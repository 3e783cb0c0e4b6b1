package com.nisfix.compliance.application;

import com.nisfix.compliance.config.AppProperties;
import com.nisfix.compliance.domain.SecureLink;
import com.nisfix.compliance.domain.SecureLinkType;
import com.nisfix.compliance.exception.RateLimitExceededException;
import com.nisfix.compliance.infrastructure.adapters.JpaSecureLinkRepositoryAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Sign-in link rate limit over real persisted links, with a clock the test moves forward.
 */
@DataJpaTest
@ActiveProfiles("test")
@Import(JpaSecureLinkRepositoryAdapter.class)
class SignInRateLimitTest {

    private static final String EMAIL = "limit@acme.test";

    @Autowired
    private JpaSecureLinkRepositoryAdapter links;

    private final MovableClock clock = new MovableClock(Instant.parse("2026-03-01T09:00:00Z"));
    private TokenIssuer issuer;

    @BeforeEach
    void setUp() {
        issuer = new TokenIssuer(links, new AppProperties(), clock);
    }

    private SecureLink requestLink() {
        issuer.checkRateLimit(EMAIL);
        return issuer.issue(EMAIL, SecureLinkType.AUTH, UUID.randomUUID(), null, Duration.ofMinutes(15));
    }

    @Test
    void shouldAllowIssuingAgainOnceWindowHasPassed() {
        requestLink();
        clock.advance(Duration.ofMinutes(10));
        requestLink();
        clock.advance(Duration.ofMinutes(10));
        requestLink();

        assertThatThrownBy(this::requestLink).isInstanceOf(RateLimitExceededException.class);

        // the first link leaves the trailing hour
        clock.advance(Duration.ofMinutes(41));
        SecureLink fourth = requestLink();

        assertThat(fourth.getCreatedAt()).isEqualTo(clock.instant().atOffset(ZoneOffset.UTC));
        assertThat(links.findByIdentifier(fourth.getIdentifier())).isPresent();
        assertThatThrownBy(this::requestLink).isInstanceOf(RateLimitExceededException.class);
    }

    @Test
    void shouldCountLimitPerEmail() {
        requestLink();
        requestLink();
        requestLink();

        issuer.checkRateLimit("someone-else@acme.test");
        assertThatThrownBy(() -> issuer.checkRateLimit(" Limit@ACME.test "))
                .isInstanceOf(RateLimitExceededException.class);
    }

    private static final class MovableClock extends Clock {

        private Instant now;

        MovableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration step) {
            now = now.plus(step);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return Clock.fixed(now, zone);
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
