package com.nisfix.compliance.application;

import com.nisfix.compliance.config.AppProperties;
import com.nisfix.compliance.domain.StatusChange;
import com.nisfix.compliance.domain.ports.NotifierPort;
import com.nisfix.compliance.domain.ports.RelationshipRepository;
import com.nisfix.compliance.domain.ports.RequirementRepository;
import com.nisfix.compliance.domain.requirement.Requirement;
import com.nisfix.compliance.domain.requirement.RequirementStatus;
import com.nisfix.compliance.domain.requirement.RequirementType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the expiry sweep against the database. The clock sits years before any other test data so only
 * the requirement created here is overdue.
 */
@SpringBootTest
@ActiveProfiles("test")
class RequirementExpiryIntegrationTest {

    private static final Instant SWEEP_TIME = Instant.parse("2001-01-01T06:00:00Z");

    @Autowired private RequirementRepository requirements;
    @Autowired private RelationshipRepository relationships;
    @Autowired private NotifierPort notifier;
    @Autowired private AppProperties props;
    @Autowired private TransactionTemplate tx;

    private RequirementSweepService sweeps;

    @BeforeEach
    void setUp() {
        sweeps = new RequirementSweepService(requirements, relationships, notifier, props, tx,
                Clock.fixed(SWEEP_TIME, ZoneOffset.UTC));
    }

    @Test
    void shouldExpireOnceAndRecordSingleHistoryEntry() {
        OffsetDateTime sweepTime = SWEEP_TIME.atOffset(ZoneOffset.UTC);
        Requirement overdue = requirements.save(Requirement.assign(UUID.randomUUID(), UUID.randomUUID(),
                UUID.randomUUID(), RequirementType.DOCUMENT, "Penetration test report", null, null,
                sweepTime.minusDays(1), null, null, null, null, UUID.randomUUID(), sweepTime.minusDays(30)));

        assertThat(sweeps.expireOverdue()).isEqualTo(1);
        assertThat(sweeps.expireOverdue()).isZero();

        Requirement reloaded = requirements.findById(overdue.getId()).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(RequirementStatus.EXPIRED);
        assertThat(reloaded.getStatusHistory()).hasSize(2);
        StatusChange<RequirementStatus> expiry = reloaded.getStatusHistory().get(1);
        assertThat(expiry.getFromStatus()).isEqualTo(RequirementStatus.PENDING);
        assertThat(expiry.getToStatus()).isEqualTo(RequirementStatus.EXPIRED);
        assertThat(expiry.getChangedBy()).isNull();
        assertThat(expiry.getReason()).isEqualTo(Requirement.EXPIRY_REASON);
    }
}
