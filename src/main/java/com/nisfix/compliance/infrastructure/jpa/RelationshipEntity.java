package com.nisfix.compliance.infrastructure.jpa;

import jakarta.persistence.*;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "relationships", indexes = {
        @Index(name = "idx_relationships_company_email", columnList = "company_id, invited_email"),
        @Index(name = "idx_relationships_supplier", columnList = "supplier_id")
})
public class RelationshipEntity {
    @Id
    private UUID id;

    @Column(name = "company_id", nullable = false)
    private UUID companyId;

    @Column(name = "supplier_id")
    private UUID supplierId;

    @Column(name = "invited_email", nullable = false, length = 320)
    private String invitedEmail;

    @Column(name = "invited_by_user_id")
    private UUID invitedByUserId;

    @Column(nullable = false, length = 16)
    private String status;

    @Column(nullable = false, length = 16)
    private String classification;

    @Column(length = 2000)
    private String notes;

    @Convert(converter = StringListConverter.class)
    @Column(name = "services_provided", length = 2000)
    private List<String> servicesProvided = new ArrayList<>();

    @Column(name = "contract_ref")
    private String contractRef;

    @Column(name = "invited_at", nullable = false)
    private OffsetDateTime invitedAt;

    @Column(name = "accepted_at")
    private OffsetDateTime acceptedAt;

    @Column(name = "declined_at")
    private OffsetDateTime declinedAt;

    @Column(name = "terminated_at")
    private OffsetDateTime terminatedAt;

    @ElementCollection
    @CollectionTable(name = "relationship_status_history", joinColumns = @JoinColumn(name = "relationship_id"))
    @OrderColumn(name = "seq")
    private List<StatusChangeEmbeddable> statusHistory = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Version
    private Long version;

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getCompanyId() { return companyId; }
    public void setCompanyId(UUID companyId) { this.companyId = companyId; }

    public UUID getSupplierId() { return supplierId; }
    public void setSupplierId(UUID supplierId) { this.supplierId = supplierId; }

    public String getInvitedEmail() { return invitedEmail; }
    public void setInvitedEmail(String invitedEmail) { this.invitedEmail = invitedEmail; }

    public UUID getInvitedByUserId() { return invitedByUserId; }
    public void setInvitedByUserId(UUID invitedByUserId) { this.invitedByUserId = invitedByUserId; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getClassification() { return classification; }
    public void setClassification(String classification) { this.classification = classification; }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }

    public List<String> getServicesProvided() { return servicesProvided; }
    public void setServicesProvided(List<String> servicesProvided) { this.servicesProvided = servicesProvided; }

    public String getContractRef() { return contractRef; }
    public void setContractRef(String contractRef) { this.contractRef = contractRef; }

    public OffsetDateTime getInvitedAt() { return invitedAt; }
    public void setInvitedAt(OffsetDateTime invitedAt) { this.invitedAt = invitedAt; }

    public OffsetDateTime getAcceptedAt() { return acceptedAt; }
    public void setAcceptedAt(OffsetDateTime acceptedAt) { this.acceptedAt = acceptedAt; }

    public OffsetDateTime getDeclinedAt() { return declinedAt; }
    public void setDeclinedAt(OffsetDateTime declinedAt) { this.declinedAt = declinedAt; }

    public OffsetDateTime getTerminatedAt() { return terminatedAt; }
    public void setTerminatedAt(OffsetDateTime terminatedAt) { this.terminatedAt = terminatedAt; }

    public List<StatusChangeEmbeddable> getStatusHistory() { return statusHistory; }
    public void setStatusHistory(List<StatusChangeEmbeddable> statusHistory) { this.statusHistory = statusHistory; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }

    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(OffsetDateTime updatedAt) { this.updatedAt = updatedAt; }

    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
}
