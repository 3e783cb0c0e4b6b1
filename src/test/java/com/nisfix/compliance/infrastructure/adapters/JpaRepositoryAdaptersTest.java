package com.nisfix.compliance.infrastructure.adapters;

import com.nisfix.compliance.domain.SecureLink;
import com.nisfix.compliance.domain.SecureLinkType;
import com.nisfix.compliance.domain.requirement.Requirement;
import com.nisfix.compliance.domain.requirement.RequirementType;
import com.nisfix.compliance.exception.ConcurrentUpdateException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@Import({JpaSecureLinkRepositoryAdapter.class, JpaRequirementRepositoryAdapter.class})
class JpaRepositoryAdaptersTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 3, 1, 9, 0, 0, 0, ZoneOffset.UTC);

    @Autowired
    private JpaSecureLinkRepositoryAdapter links;

    @Autowired
    private JpaRequirementRepositoryAdapter requirements;

    private SecureLink link(String identifier, String email, OffsetDateTime createdAt, OffsetDateTime expiresAt) {
        return new SecureLink(UUID.randomUUID(), identifier, SecureLinkType.AUTH, email, UUID.randomUUID(), null,
                expiresAt, true, null, createdAt);
    }

    private Requirement requirement(OffsetDateTime dueDate) {
        return Requirement.assign(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), RequirementType.DOCUMENT,
                "ISO 27001 certificate", null, null, dueDate, null, null, null, null, UUID.randomUUID(),
                NOW.minusDays(20));
    }

    @Test
    void shouldConsumeLinkOnlyOnce() {
        links.save(link("once", "a@acme.test", NOW, NOW.plusMinutes(15)));

        assertThat(links.consume("once", NOW.plusMinutes(1))).isTrue();
        assertThat(links.consume("once", NOW.plusMinutes(2))).isFalse();
        assertThat(links.consume("unknown", NOW)).isFalse();
    }

    @Test
    void shouldCountLinksCreatedInWindow() {
        links.save(link("l1", "b@acme.test", NOW.minusMinutes(90), NOW.minusMinutes(75)));
        links.save(link("l2", "b@acme.test", NOW.minusMinutes(30), NOW.minusMinutes(15)));
        links.save(link("l3", "b@acme.test", NOW.minusMinutes(5), NOW.plusMinutes(10)));

        assertThat(links.countCreatedSince("b@acme.test", SecureLinkType.AUTH, NOW.minusMinutes(60))).isEqualTo(2);
        assertThat(links.countCreatedSince("b@acme.test", SecureLinkType.INVITATION, NOW.minusMinutes(60))).isZero();
    }

    @Test
    void shouldDeleteExpiredLinks() {
        links.save(link("old", "c@acme.test", NOW.minusDays(2), NOW.minusDays(1)));
        links.save(link("fresh", "c@acme.test", NOW, NOW.plusMinutes(15)));

        assertThat(links.deleteExpiredBefore(NOW)).isEqualTo(1);
        assertThat(links.findByIdentifier("fresh")).isPresent();
    }

    @Test
    void shouldMarkReminderSentOnce() {
        Requirement saved = requirements.save(requirement(NOW.plusDays(3)));

        assertThat(requirements.markReminderSent(saved.getId(), NOW)).isTrue();
        assertThat(requirements.markReminderSent(saved.getId(), NOW.plusMinutes(1))).isFalse();
    }

    @Test
    void shouldSelectOverdueAndReminderCandidates() {
        Requirement overdue = requirements.save(requirement(NOW.minusDays(1)));
        Requirement dueSoon = requirements.save(requirement(NOW.plusDays(2)));
        requirements.save(requirement(NOW.plusDays(30)));
        requirements.save(requirement(null));

        List<Requirement> expired = requirements.findOverdue(NOW, 10);
        List<Requirement> remind = requirements.findReminderCandidates(NOW, NOW.plusDays(7), 10);

        assertThat(expired).extracting(Requirement::getId).containsExactly(overdue.getId());
        assertThat(remind).extracting(Requirement::getId).containsExactly(dueSoon.getId());
    }

    @Test
    void shouldRejectStaleRequirementVersion() {
        Requirement saved = requirements.save(requirement(null));
        Requirement stale = requirements.findById(saved.getId()).orElseThrow();

        saved.updateTerms("First edit", null, null, null, null, null, null, NOW);
        requirements.save(saved);
        stale.updateTerms("Second edit", null, null, null, null, null, null, NOW);

        assertThatThrownBy(() -> requirements.save(stale)).isInstanceOf(ConcurrentUpdateException.class);
    }
}
