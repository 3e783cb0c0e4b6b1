package com.nisfix.compliance.domain.relationship;

import com.nisfix.compliance.exception.CannotModifyException;
import com.nisfix.compliance.exception.InvalidTransitionException;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelationshipTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 3, 1, 9, 0, 0, 0, ZoneOffset.UTC);

    private final UUID companyId = UUID.randomUUID();
    private final UUID adminId = UUID.randomUUID();

    private Relationship invite() {
        return Relationship.invite(companyId, "vendor@acme.test", adminId, null, "notes",
                List.of("hosting"), "C-1", NOW);
    }

    @Test
    void shouldStartPendingWithStandardClassification() {
        Relationship r = invite();

        assertThat(r.getStatus()).isEqualTo(RelationshipStatus.PENDING);
        assertThat(r.getClassification()).isEqualTo(SupplierClassification.STANDARD);
        assertThat(r.getSupplierId()).isNull();
        assertThat(r.getStatusHistory()).hasSize(1);
        assertThat(r.getStatusHistory().get(0).getFromStatus()).isNull();
        assertThat(r.canReceiveRequirements()).isFalse();
    }

    @Test
    void shouldBindSupplierOnAccept() {
        Relationship r = invite();
        UUID supplierId = UUID.randomUUID();

        r.accept(supplierId, UUID.randomUUID(), NOW.plusHours(1));

        assertThat(r.getStatus()).isEqualTo(RelationshipStatus.ACTIVE);
        assertThat(r.getSupplierId()).isEqualTo(supplierId);
        assertThat(r.getAcceptedAt()).isEqualTo(NOW.plusHours(1));
        assertThat(r.canReceiveRequirements()).isTrue();
        assertThat(r.getStatusHistory()).extracting(c -> c.getToStatus())
                .containsExactly(RelationshipStatus.PENDING, RelationshipStatus.ACTIVE);
    }

    @Test
    void shouldNotTerminatePendingRelationship() {
        Relationship r = invite();

        assertThatThrownBy(() -> r.terminate(adminId, "done", NOW))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(r.getStatus()).isEqualTo(RelationshipStatus.PENDING);
        assertThat(r.getStatusHistory()).hasSize(1);
    }

    @Test
    void shouldSuspendAndReactivate() {
        Relationship r = invite();
        r.accept(UUID.randomUUID(), UUID.randomUUID(), NOW);

        r.suspend(adminId, "audit", NOW.plusDays(1));
        assertThat(r.canReceiveRequirements()).isFalse();

        r.reactivate(adminId, "audit closed", NOW.plusDays(2));
        assertThat(r.getStatus()).isEqualTo(RelationshipStatus.ACTIVE);
        assertThat(r.getStatusHistory().get(2).getReason()).isEqualTo("audit");
    }

    @Test
    void shouldRejectChangesAfterTermination() {
        Relationship r = invite();
        r.accept(UUID.randomUUID(), UUID.randomUUID(), NOW);
        r.terminate(adminId, "contract ended", NOW.plusDays(1));

        assertThat(r.getTerminatedAt()).isEqualTo(NOW.plusDays(1));
        assertThatThrownBy(() -> r.updateClassification(SupplierClassification.CRITICAL, NOW))
                .isInstanceOf(CannotModifyException.class);
        assertThatThrownBy(() -> r.reactivate(adminId, null, NOW))
                .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> r.updateDetails("late note", List.of("storage"), "C-2", NOW.plusDays(2)))
                .isInstanceOf(CannotModifyException.class);
        assertThatThrownBy(() -> r.terminate(adminId, "again", NOW.plusDays(2)))
                .isInstanceOf(InvalidTransitionException.class);

        assertThat(r.getStatus()).isEqualTo(RelationshipStatus.TERMINATED);
        assertThat(r.getNotes()).isEqualTo("notes");
        assertThat(r.getContractRef()).isEqualTo("C-1");
        assertThat(r.getStatusHistory()).hasSize(3);
    }

    @Test
    void shouldRejectTransitionsOutsideLifecycle() {
        Relationship r = invite();

        assertThatThrownBy(() -> r.suspend(adminId, "too early", NOW))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessage("cannot suspend this relationship");

        r.accept(UUID.randomUUID(), UUID.randomUUID(), NOW);
        assertThatThrownBy(() -> r.reactivate(adminId, "already active", NOW.plusHours(1)))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessage("cannot reactivate this relationship");

        assertThat(r.getStatus()).isEqualTo(RelationshipStatus.ACTIVE);
        assertThat(r.getStatusHistory()).hasSize(2);
    }

    @Test
    void shouldUpdateDetailsWhileOpen() {
        Relationship r = invite();

        r.updateDetails(null, List.of("hosting", "backups"), "C-9", NOW.plusHours(2));

        assertThat(r.getNotes()).isEqualTo("notes");
        assertThat(r.getServicesProvided()).containsExactly("hosting", "backups");
        assertThat(r.getContractRef()).isEqualTo("C-9");
        assertThat(r.getUpdatedAt()).isEqualTo(NOW.plusHours(2));
    }

    @Test
    void shouldTreatDeclineAsTerminal() {
        Relationship r = invite();
        r.decline(UUID.randomUUID(), "not interested", NOW);

        assertThat(r.getStatus()).isEqualTo(RelationshipStatus.DECLINED);
        assertThatThrownBy(() -> r.accept(UUID.randomUUID(), UUID.randomUUID(), NOW))
                .isInstanceOf(InvalidTransitionException.class);
    }
}
