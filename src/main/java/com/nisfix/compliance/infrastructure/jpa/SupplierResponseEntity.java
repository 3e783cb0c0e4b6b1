package com.nisfix.compliance.infrastructure.jpa;

import jakarta.persistence.*;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "supplier_responses", indexes = {
        @Index(name = "idx_responses_requirement", columnList = "requirement_id, started_at")
})
public class SupplierResponseEntity {
    @Id
    private UUID id;

    @Column(name = "requirement_id", nullable = false)
    private UUID requirementId;

    @Column(name = "supplier_id", nullable = false)
    private UUID supplierId;

    @Column(name = "submission_id")
    private UUID submissionId;

    @Column(name = "report_grade", length = 1)
    private String reportGrade;

    @Column(name = "report_date")
    private LocalDate reportDate;

    @Column(name = "report_reference")
    private String reportReference;

    private Integer score;

    @Column(name = "max_score")
    private Integer maxScore;

    private Boolean passed;

    @Column(length = 1)
    private String grade;

    @ElementCollection
    @CollectionTable(name = "response_draft_answers", joinColumns = @JoinColumn(name = "response_id"))
    @OrderColumn(name = "seq")
    private List<AnswerEmbeddable> draftAnswers = new ArrayList<>();

    @Column(name = "reviewed_by_user_id")
    private UUID reviewedByUserId;

    @Column(name = "reviewed_at")
    private OffsetDateTime reviewedAt;

    @Column(name = "review_notes", length = 4000)
    private String reviewNotes;

    @Column(name = "override_score")
    private Integer overrideScore;

    @Column(name = "override_grade", length = 1)
    private String overrideGrade;

    @Column(name = "started_at", nullable = false)
    private OffsetDateTime startedAt;

    @Column(name = "submitted_at")
    private OffsetDateTime submittedAt;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Version
    private Long version;

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getRequirementId() { return requirementId; }
    public void setRequirementId(UUID requirementId) { this.requirementId = requirementId; }

    public UUID getSupplierId() { return supplierId; }
    public void setSupplierId(UUID supplierId) { this.supplierId = supplierId; }

    public UUID getSubmissionId() { return submissionId; }
    public void setSubmissionId(UUID submissionId) { this.submissionId = submissionId; }

    public String getReportGrade() { return reportGrade; }
    public void setReportGrade(String reportGrade) { this.reportGrade = reportGrade; }

    public LocalDate getReportDate() { return reportDate; }
    public void setReportDate(LocalDate reportDate) { this.reportDate = reportDate; }

    public String getReportReference() { return reportReference; }
    public void setReportReference(String reportReference) { this.reportReference = reportReference; }

    public Integer getScore() { return score; }
    public void setScore(Integer score) { this.score = score; }

    public Integer getMaxScore() { return maxScore; }
    public void setMaxScore(Integer maxScore) { this.maxScore = maxScore; }

    public Boolean getPassed() { return passed; }
    public void setPassed(Boolean passed) { this.passed = passed; }

    public String getGrade() { return grade; }
    public void setGrade(String grade) { this.grade = grade; }

    public List<AnswerEmbeddable> getDraftAnswers() { return draftAnswers; }
    public void setDraftAnswers(List<AnswerEmbeddable> draftAnswers) { this.draftAnswers = draftAnswers; }

    public UUID getReviewedByUserId() { return reviewedByUserId; }
    public void setReviewedByUserId(UUID reviewedByUserId) { this.reviewedByUserId = reviewedByUserId; }

    public OffsetDateTime getReviewedAt() { return reviewedAt; }
    public void setReviewedAt(OffsetDateTime reviewedAt) { this.reviewedAt = reviewedAt; }

    public String getReviewNotes() { return reviewNotes; }
    public void setReviewNotes(String reviewNotes) { this.reviewNotes = reviewNotes; }

    public Integer getOverrideScore() { return overrideScore; }
    public void setOverrideScore(Integer overrideScore) { this.overrideScore = overrideScore; }

    public String getOverrideGrade() { return overrideGrade; }
    public void setOverrideGrade(String overrideGrade) { this.overrideGrade = overrideGrade; }

    public OffsetDateTime getStartedAt() { return startedAt; }
    public void setStartedAt(OffsetDateTime startedAt) { this.startedAt = startedAt; }

    public OffsetDateTime getSubmittedAt() { return submittedAt; }
    public void setSubmittedAt(OffsetDateTime submittedAt) { this.submittedAt = submittedAt; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }

    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(OffsetDateTime updatedAt) { this.updatedAt = updatedAt; }

    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
}
