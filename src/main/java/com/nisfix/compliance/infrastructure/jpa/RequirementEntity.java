package com.nisfix.compliance.infrastructure.jpa;

import jakarta.persistence.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@DynamicUpdate
@Table(name = "requirements", indexes = {
        @Index(name = "idx_requirements_company_status", columnList = "company_id, status"),
        @Index(name = "idx_requirements_supplier_status", columnList = "supplier_id, status"),
        @Index(name = "idx_requirements_due", columnList = "status, due_date")
})
public class RequirementEntity {
    @Id
    private UUID id;

    @Column(name = "relationship_id", nullable = false)
    private UUID relationshipId;

    @Column(name = "company_id", nullable = false)
    private UUID companyId;

    @Column(name = "supplier_id", nullable = false)
    private UUID supplierId;

    @Column(nullable = false, length = 16)
    private String type;

    @Column(nullable = false)
    private String title;

    @Column(length = 4000)
    private String description;

    @Column(nullable = false, length = 16)
    private String priority;

    @Column(name = "questionnaire_id")
    private UUID questionnaireId;

    @Column(name = "passing_score")
    private Integer passingScore;

    @Column(name = "minimum_grade", length = 1)
    private String minimumGrade;

    @Column(name = "max_report_age_days")
    private Integer maxReportAgeDays;

    @Column(name = "due_date")
    private OffsetDateTime dueDate;

    @Column(name = "reminder_sent_at")
    private OffsetDateTime reminderSentAt;

    @Column(nullable = false, length = 32)
    private String status;

    @ElementCollection
    @CollectionTable(name = "requirement_status_history", joinColumns = @JoinColumn(name = "requirement_id"))
    @OrderColumn(name = "seq")
    private List<StatusChangeEmbeddable> statusHistory = new ArrayList<>();

    @Column(name = "assigned_by_user_id")
    private UUID assignedByUserId;

    @Column(name = "assigned_at", nullable = false)
    private OffsetDateTime assignedAt;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Version
    private Long version;

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getRelationshipId() { return relationshipId; }
    public void setRelationshipId(UUID relationshipId) { this.relationshipId = relationshipId; }

    public UUID getCompanyId() { return companyId; }
    public void setCompanyId(UUID companyId) { this.companyId = companyId; }

    public UUID getSupplierId() { return supplierId; }
    public void setSupplierId(UUID supplierId) { this.supplierId = supplierId; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getPriority() { return priority; }
    public void setPriority(String priority) { this.priority = priority; }

    public UUID getQuestionnaireId() { return questionnaireId; }
    public void setQuestionnaireId(UUID questionnaireId) { this.questionnaireId = questionnaireId; }

    public Integer getPassingScore() { return passingScore; }
    public void setPassingScore(Integer passingScore) { this.passingScore = passingScore; }

    public String getMinimumGrade() { return minimumGrade; }
    public void setMinimumGrade(String minimumGrade) { this.minimumGrade = minimumGrade; }

    public Integer getMaxReportAgeDays() { return maxReportAgeDays; }
    public void setMaxReportAgeDays(Integer maxReportAgeDays) { this.maxReportAgeDays = maxReportAgeDays; }

    public OffsetDateTime getDueDate() { return dueDate; }
    public void setDueDate(OffsetDateTime dueDate) { this.dueDate = dueDate; }

    public OffsetDateTime getReminderSentAt() { return reminderSentAt; }
    public void setReminderSentAt(OffsetDateTime reminderSentAt) { this.reminderSentAt = reminderSentAt; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public List<StatusChangeEmbeddable> getStatusHistory() { return statusHistory; }
    public void setStatusHistory(List<StatusChangeEmbeddable> statusHistory) { this.statusHistory = statusHistory; }

    public UUID getAssignedByUserId() { return assignedByUserId; }
    public void setAssignedByUserId(UUID assignedByUserId) { this.assignedByUserId = assignedByUserId; }

    public OffsetDateTime getAssignedAt() { return assignedAt; }
    public void setAssignedAt(OffsetDateTime assignedAt) { this.assignedAt = assignedAt; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }

    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(OffsetDateTime updatedAt) { this.updatedAt = updatedAt; }

    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
}
