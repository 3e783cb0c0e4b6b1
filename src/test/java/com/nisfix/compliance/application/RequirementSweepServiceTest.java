package com.nisfix.compliance.application;

import com.nisfix.compliance.config.AppProperties;
import com.nisfix.compliance.domain.ports.NotifierPort;
import com.nisfix.compliance.domain.ports.RelationshipRepository;
import com.nisfix.compliance.domain.ports.RequirementRepository;
import com.nisfix.compliance.domain.relationship.Relationship;
import com.nisfix.compliance.domain.requirement.Requirement;
import com.nisfix.compliance.domain.requirement.RequirementStatus;
import com.nisfix.compliance.domain.requirement.RequirementType;
import com.nisfix.compliance.exception.ConcurrentUpdateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RequirementSweepServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Mock private RequirementRepository requirements;
    @Mock private RelationshipRepository relationships;
    @Mock private NotifierPort notifier;
    @Mock private PlatformTransactionManager txManager;

    private RequirementSweepService sweeps;

    @BeforeEach
    void setUp() {
        sweeps = new RequirementSweepService(requirements, relationships, notifier, new AppProperties(),
                new TransactionTemplate(txManager), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static OffsetDateTime now() {
        return NOW.atOffset(ZoneOffset.UTC);
    }

    private static Requirement requirement(UUID relationshipId, OffsetDateTime dueDate) {
        return Requirement.assign(relationshipId, UUID.randomUUID(), UUID.randomUUID(), RequirementType.DOCUMENT,
                "SOC 2 report", null, null, dueDate, null, null, null, null, UUID.randomUUID(),
                now().minusDays(30));
    }

    @Test
    void shouldExpireOverdueRequirementsWithSystemHistoryEntry() {
        Requirement overdue = requirement(UUID.randomUUID(), now().minusDays(1));
        when(requirements.findOverdue(eq(now()), anyInt())).thenReturn(List.of(overdue));

        assertThat(sweeps.expireOverdue()).isEqualTo(1);

        assertThat(overdue.getStatus()).isEqualTo(RequirementStatus.EXPIRED);
        assertThat(overdue.getStatusHistory().get(1).getChangedBy()).isNull();
        assertThat(overdue.getStatusHistory().get(1).getReason()).isEqualTo(Requirement.EXPIRY_REASON);
        verify(requirements).save(overdue);
    }

    @Test
    void shouldLeaveAlreadyExpiredRequirementUntouched() {
        Requirement overdue = requirement(UUID.randomUUID(), now().minusDays(1));
        overdue.expire(now().minusHours(1));
        when(requirements.findOverdue(any(), anyInt())).thenReturn(List.of(overdue));

        assertThat(sweeps.expireOverdue()).isZero();

        assertThat(overdue.getStatus()).isEqualTo(RequirementStatus.EXPIRED);
        assertThat(overdue.getStatusHistory()).hasSize(2);
        verify(requirements, never()).save(any());
    }

    @Test
    void shouldSkipRequirementChangedConcurrently() {
        Requirement first = requirement(UUID.randomUUID(), now().minusDays(1));
        Requirement second = requirement(UUID.randomUUID(), now().minusDays(2));
        when(requirements.findOverdue(any(), anyInt())).thenReturn(List.of(first, second));
        when(requirements.save(any())).thenAnswer(inv -> {
            if (inv.getArgument(0) == first) {
                throw new ConcurrentUpdateException("requirement was modified concurrently");
            }
            return inv.getArgument(0);
        });

        assertThat(sweeps.expireOverdue()).isEqualTo(1);
        verify(requirements).save(second);
    }

    @Test
    void shouldQueueReminderOnlyOnce() {
        UUID relationshipId = UUID.randomUUID();
        Requirement dueSoon = requirement(relationshipId, now().plusDays(3));
        Relationship relationship = Relationship.invite(dueSoon.getCompanyId(), "vendor@acme.test",
                UUID.randomUUID(), null, null, null, null, now().minusDays(40));
        SimpleTransactionStatus firstRun = new SimpleTransactionStatus();
        SimpleTransactionStatus secondRun = new SimpleTransactionStatus();
        when(txManager.getTransaction(any())).thenReturn(firstRun, secondRun);
        when(requirements.findReminderCandidates(eq(now()), eq(now().plusDays(7)), anyInt()))
                .thenReturn(List.of(dueSoon));
        when(relationships.findById(relationshipId)).thenReturn(Optional.of(relationship));
        when(requirements.markReminderSent(dueSoon.getId(), now())).thenReturn(true, false);

        assertThat(sweeps.sendReminders()).isEqualTo(1);
        assertThat(sweeps.sendReminders()).isZero();

        verify(notifier, times(2)).sendRequirementReminder("vendor@acme.test", dueSoon.getId(),
                "SOC 2 report", dueSoon.getDueDate());
        assertThat(firstRun.isRollbackOnly()).isFalse();
        assertThat(secondRun.isRollbackOnly()).isTrue();
    }
}
