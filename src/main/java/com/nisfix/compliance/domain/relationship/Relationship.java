package com.nisfix.compliance.domain.relationship;

import com.nisfix.compliance.domain.StatusChange;
import com.nisfix.compliance.exception.CannotModifyException;
import com.nisfix.compliance.exception.InvalidTransitionException;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Commercial link between a company and a supplier, from invitation to termination.
 * All status changes go through {@link #transitionTo} so every change is recorded in the
 * append-only status history.
 */
public class Relationship {
    private final UUID id;
    private final UUID companyId;
    private UUID supplierId;
    private final String invitedEmail;
    private final UUID invitedByUserId;
    private RelationshipStatus status;
    private SupplierClassification classification;
    private String notes;
    private List<String> servicesProvided;
    private String contractRef;
    private final OffsetDateTime invitedAt;
    private OffsetDateTime acceptedAt;
    private OffsetDateTime declinedAt;
    private OffsetDateTime terminatedAt;
    private final List<StatusChange<RelationshipStatus>> statusHistory;
    private final OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    private final long version;

    public Relationship(UUID id, UUID companyId, UUID supplierId, String invitedEmail, UUID invitedByUserId,
                        RelationshipStatus status, SupplierClassification classification, String notes,
                        List<String> servicesProvided, String contractRef, OffsetDateTime invitedAt,
                        OffsetDateTime acceptedAt, OffsetDateTime declinedAt, OffsetDateTime terminatedAt,
                        List<StatusChange<RelationshipStatus>> statusHistory, OffsetDateTime createdAt,
                        OffsetDateTime updatedAt, long version) {
        this.id = id;
        this.companyId = companyId;
        this.supplierId = supplierId;
        this.invitedEmail = invitedEmail;
        this.invitedByUserId = invitedByUserId;
        this.status = status;
        this.classification = classification;
        this.notes = notes;
        this.servicesProvided = servicesProvided == null ? new ArrayList<>() : new ArrayList<>(servicesProvided);
        this.contractRef = contractRef;
        this.invitedAt = invitedAt;
        this.acceptedAt = acceptedAt;
        this.declinedAt = declinedAt;
        this.terminatedAt = terminatedAt;
        this.statusHistory = statusHistory == null ? new ArrayList<>() : new ArrayList<>(statusHistory);
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.version = version;
    }

    public static Relationship invite(UUID companyId, String invitedEmail, UUID invitedByUserId,
                                      SupplierClassification classification, String notes,
                                      List<String> servicesProvided, String contractRef, OffsetDateTime now) {
        Relationship relationship = new Relationship(UUID.randomUUID(), companyId, null, invitedEmail,
                invitedByUserId, RelationshipStatus.PENDING,
                classification == null ? SupplierClassification.STANDARD : classification,
                notes, servicesProvided, contractRef, now, null, null, null, null, now, now, 0L);
        relationship.statusHistory.add(new StatusChange<>(null, RelationshipStatus.PENDING, invitedByUserId,
                "Invitation sent", now));
        return relationship;
    }

    public void accept(UUID supplierId, UUID userId, OffsetDateTime now) {
        transitionTo(RelationshipStatus.ACTIVE, userId, "Invitation accepted", "accept", now);
        this.supplierId = supplierId;
        this.acceptedAt = now;
    }

    public void decline(UUID userId, String reason, OffsetDateTime now) {
        transitionTo(RelationshipStatus.DECLINED, userId, reason, "decline", now);
        this.declinedAt = now;
    }

    public void suspend(UUID userId, String reason, OffsetDateTime now) {
        transitionTo(RelationshipStatus.SUSPENDED, userId, reason, "suspend", now);
    }

    public void reactivate(UUID userId, String reason, OffsetDateTime now) {
        transitionTo(RelationshipStatus.ACTIVE, userId, reason, "reactivate", now);
    }

    public void terminate(UUID userId, String reason, OffsetDateTime now) {
        transitionTo(RelationshipStatus.TERMINATED, userId, reason, "terminate", now);
        this.terminatedAt = now;
    }

    public void updateClassification(SupplierClassification classification, OffsetDateTime now) {
        requireModifiable();
        this.classification = classification;
        this.updatedAt = now;
    }

    /** Null arguments leave the corresponding field untouched. */
    public void updateDetails(String notes, List<String> servicesProvided, String contractRef, OffsetDateTime now) {
        requireModifiable();
        if (notes != null) this.notes = notes;
        if (servicesProvided != null) this.servicesProvided = new ArrayList<>(servicesProvided);
        if (contractRef != null) this.contractRef = contractRef;
        this.updatedAt = now;
    }

    private void requireModifiable() {
        if (status.isTerminal()) {
            throw new CannotModifyException("cannot modify this relationship");
        }
    }

    private void transitionTo(RelationshipStatus target, UUID changedBy, String reason, String action,
                              OffsetDateTime now) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException("cannot " + action + " this relationship");
        }
        statusHistory.add(new StatusChange<>(status, target, changedBy, reason, now));
        this.status = target;
        this.updatedAt = now;
    }

    public boolean canReceiveRequirements() {
        return status == RelationshipStatus.ACTIVE && supplierId != null;
    }

    public UUID getId() { return id; }
    public UUID getCompanyId() { return companyId; }
    public UUID getSupplierId() { return supplierId; }
    public String getInvitedEmail() { return invitedEmail; }
    public UUID getInvitedByUserId() { return invitedByUserId; }
    public RelationshipStatus getStatus() { return status; }
    public SupplierClassification getClassification() { return classification; }
    public String getNotes() { return notes; }
    public List<String> getServicesProvided() { return Collections.unmodifiableList(servicesProvided); }
    public String getContractRef() { return contractRef; }
    public OffsetDateTime getInvitedAt() { return invitedAt; }
    public OffsetDateTime getAcceptedAt() { return acceptedAt; }
    public OffsetDateTime getDeclinedAt() { return declinedAt; }
    public OffsetDateTime getTerminatedAt() { return terminatedAt; }
    public List<StatusChange<RelationshipStatus>> getStatusHistory() { return Collections.unmodifiableList(statusHistory); }
    public OffsetDateTime getCreatedAt() { return createdAt; }
    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public long getVersion() { return version; }
}
