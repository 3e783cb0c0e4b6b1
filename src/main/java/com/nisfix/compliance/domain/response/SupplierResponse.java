package com.nisfix.compliance.domain.response;

import com.nisfix.compliance.domain.requirement.ReportGrade;
import com.nisfix.compliance.exception.CannotModifyException;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * A supplier's answer to one requirement. Open while drafts are saved, frozen after submission
 * except for the reviewer's notes and advisory overrides.
 */
public class SupplierResponse {
    private final UUID id;
    private final UUID requirementId;
    private final UUID supplierId;
    private UUID submissionId;
    private DocumentReport documentReport;
    private Integer score;
    private Integer maxScore;
    private Boolean passed;
    private ReportGrade grade;
    private List<DraftAnswer> draftAnswers;
    private UUID reviewedByUserId;
    private OffsetDateTime reviewedAt;
    private String reviewNotes;
    private Integer overrideScore;
    private ReportGrade overrideGrade;
    private final OffsetDateTime startedAt;
    private OffsetDateTime submittedAt;
    private final OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    private final long version;

    public SupplierResponse(UUID id, UUID requirementId, UUID supplierId, UUID submissionId,
                            DocumentReport documentReport, Integer score, Integer maxScore, Boolean passed,
                            ReportGrade grade, List<DraftAnswer> draftAnswers, UUID reviewedByUserId,
                            OffsetDateTime reviewedAt, String reviewNotes, Integer overrideScore,
                            ReportGrade overrideGrade, OffsetDateTime startedAt, OffsetDateTime submittedAt,
                            OffsetDateTime createdAt, OffsetDateTime updatedAt, long version) {
        this.id = id;
        this.requirementId = requirementId;
        this.supplierId = supplierId;
        this.submissionId = submissionId;
        this.documentReport = documentReport;
        this.score = score;
        this.maxScore = maxScore;
        this.passed = passed;
        this.grade = grade;
        this.draftAnswers = draftAnswers == null ? new ArrayList<>() : new ArrayList<>(draftAnswers);
        this.reviewedByUserId = reviewedByUserId;
        this.reviewedAt = reviewedAt;
        this.reviewNotes = reviewNotes;
        this.overrideScore = overrideScore;
        this.overrideGrade = overrideGrade;
        this.startedAt = startedAt;
        this.submittedAt = submittedAt;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.version = version;
    }

    public static SupplierResponse open(UUID requirementId, UUID supplierId, OffsetDateTime now) {
        return new SupplierResponse(UUID.randomUUID(), requirementId, supplierId, null, null, null, null, null,
                null, null, null, null, null, null, null, now, null, now, now, 0L);
    }

    /** Upserts the draft for the answer's question. */
    public void saveDraft(DraftAnswer answer) {
        requireOpen();
        draftAnswers.removeIf(a -> a.questionId().equals(answer.questionId()));
        draftAnswers.add(answer);
        this.updatedAt = answer.savedAt();
    }

    public void recordSubmission(QuestionnaireSubmission submission, OffsetDateTime now) {
        requireOpen();
        this.submissionId = submission.getId();
        this.score = submission.getTotalScore();
        this.maxScore = submission.getMaxPossibleScore();
        this.passed = submission.isPassed();
        this.draftAnswers = new ArrayList<>();
        this.submittedAt = now;
        this.updatedAt = now;
    }

    public void recordDocumentReport(DocumentReport report, boolean reportPassed, OffsetDateTime now) {
        requireOpen();
        this.documentReport = report;
        this.grade = report.grade();
        this.passed = reportPassed;
        this.draftAnswers = new ArrayList<>();
        this.submittedAt = now;
        this.updatedAt = now;
    }

    /** Stores the reviewer's decision notes. Overrides are advisory and never change {@code passed}. */
    public void markReviewed(UUID reviewerId, String notes, Integer overrideScore, ReportGrade overrideGrade,
                             OffsetDateTime now) {
        this.reviewedByUserId = reviewerId;
        this.reviewedAt = now;
        this.reviewNotes = notes;
        if (overrideScore != null) this.overrideScore = overrideScore;
        if (overrideGrade != null) this.overrideGrade = overrideGrade;
        this.updatedAt = now;
    }

    private void requireOpen() {
        if (isSubmitted()) {
            throw new CannotModifyException("cannot modify a submitted response");
        }
    }

    public boolean isSubmitted() {
        return submittedAt != null;
    }

    public int completionTimeMinutes(OffsetDateTime now) {
        return (int) Duration.between(startedAt, now).toMinutes();
    }

    public UUID getId() { return id; }
    public UUID getRequirementId() { return requirementId; }
    public UUID getSupplierId() { return supplierId; }
    public UUID getSubmissionId() { return submissionId; }
    public DocumentReport getDocumentReport() { return documentReport; }
    public Integer getScore() { return score; }
    public Integer getMaxScore() { return maxScore; }
    public Boolean getPassed() { return passed; }
    public ReportGrade getGrade() { return grade; }
    public List<DraftAnswer> getDraftAnswers() { return Collections.unmodifiableList(draftAnswers); }
    public UUID getReviewedByUserId() { return reviewedByUserId; }
    public OffsetDateTime getReviewedAt() { return reviewedAt; }
    public String getReviewNotes() { return reviewNotes; }
    public Integer getOverrideScore() { return overrideScore; }
    public ReportGrade getOverrideGrade() { return overrideGrade; }
    public OffsetDateTime getStartedAt() { return startedAt; }
    public OffsetDateTime getSubmittedAt() { return submittedAt; }
    public OffsetDateTime getCreatedAt() { return createdAt; }
    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public long getVersion() { return version; }
}
