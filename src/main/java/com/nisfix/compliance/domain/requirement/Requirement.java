package com.nisfix.compliance.domain.requirement;

import com.nisfix.compliance.domain.StatusChange;
import com.nisfix.compliance.exception.CannotReviewException;
import com.nisfix.compliance.exception.InvalidTransitionException;
import com.nisfix.compliance.exception.NotEditableException;
import com.nisfix.compliance.exception.ValidationFailedException;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * A single compliance obligation a company assigns to one of its active suppliers.
 *
 * <p>The terms (title, description, priority, due date and scoring constraints) can only be
 * changed while the requirement is {@link RequirementStatus#PENDING}. Once the supplier starts
 * working on it they are frozen, so every response is judged against the terms it was written for.
 */
public class Requirement {

    public static final String EXPIRY_REASON = "Expired due to passing due date";
    public static final ReportGrade DEFAULT_MINIMUM_GRADE = ReportGrade.C;
    public static final int DEFAULT_MAX_REPORT_AGE_DAYS = 90;

    private final UUID id;
    private final UUID relationshipId;
    private final UUID companyId;
    private final UUID supplierId;
    private final RequirementType type;
    private String title;
    private String description;
    private Priority priority;
    private final UUID questionnaireId;
    private Integer passingScore;
    private ReportGrade minimumGrade;
    private Integer maxReportAgeDays;
    private OffsetDateTime dueDate;
    private final OffsetDateTime reminderSentAt;
    private RequirementStatus status;
    private final List<StatusChange<RequirementStatus>> statusHistory;
    private final UUID assignedByUserId;
    private final OffsetDateTime assignedAt;
    private final OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    private final long version;

    public Requirement(UUID id, UUID relationshipId, UUID companyId, UUID supplierId, RequirementType type,
                       String title, String description, Priority priority, UUID questionnaireId,
                       Integer passingScore, ReportGrade minimumGrade, Integer maxReportAgeDays,
                       OffsetDateTime dueDate, OffsetDateTime reminderSentAt, RequirementStatus status,
                       List<StatusChange<RequirementStatus>> statusHistory, UUID assignedByUserId,
                       OffsetDateTime assignedAt, OffsetDateTime createdAt, OffsetDateTime updatedAt,
                       long version) {
        this.id = id;
        this.relationshipId = relationshipId;
        this.companyId = companyId;
        this.supplierId = supplierId;
        this.type = type;
        this.title = title;
        this.description = description;
        this.priority = priority;
        this.questionnaireId = questionnaireId;
        this.passingScore = passingScore;
        this.minimumGrade = minimumGrade;
        this.maxReportAgeDays = maxReportAgeDays;
        this.dueDate = dueDate;
        this.reminderSentAt = reminderSentAt;
        this.status = status;
        this.statusHistory = statusHistory == null ? new ArrayList<>() : new ArrayList<>(statusHistory);
        this.assignedByUserId = assignedByUserId;
        this.assignedAt = assignedAt;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.version = version;
    }

    public static Requirement assign(UUID relationshipId, UUID companyId, UUID supplierId, RequirementType type,
                                     String title, String description, Priority priority, OffsetDateTime dueDate,
                                     UUID questionnaireId, Integer passingScore, ReportGrade minimumGrade,
                                     Integer maxReportAgeDays, UUID assignedByUserId, OffsetDateTime now) {
        if (type == RequirementType.DOCUMENT) {
            if (minimumGrade == null) minimumGrade = DEFAULT_MINIMUM_GRADE;
            if (maxReportAgeDays == null) maxReportAgeDays = DEFAULT_MAX_REPORT_AGE_DAYS;
        }
        Requirement requirement = new Requirement(UUID.randomUUID(), relationshipId, companyId, supplierId, type,
                title, description, priority == null ? Priority.MEDIUM : priority, questionnaireId, passingScore,
                minimumGrade, maxReportAgeDays, dueDate, null, RequirementStatus.PENDING, null,
                assignedByUserId, now, now, now, 0L);
        requirement.statusHistory.add(new StatusChange<>(null, RequirementStatus.PENDING, assignedByUserId,
                "Requirement assigned", now));
        return requirement;
    }

    /**
     * Replaces the terms of a pending requirement. Null arguments keep the current value.
     *
     * @throws NotEditableException if the supplier already started working on it
     */
    public void updateTerms(String title, String description, Priority priority, OffsetDateTime dueDate,
                            Integer passingScore, ReportGrade minimumGrade, Integer maxReportAgeDays,
                            OffsetDateTime now) {
        if (status != RequirementStatus.PENDING) {
            throw new NotEditableException("cannot edit this requirement");
        }
        if (title != null && !title.isBlank()) this.title = title.trim();
        if (description != null) this.description = description;
        if (priority != null) this.priority = priority;
        if (dueDate != null) this.dueDate = dueDate;
        if (passingScore != null) this.passingScore = passingScore;
        if (minimumGrade != null) this.minimumGrade = minimumGrade;
        if (maxReportAgeDays != null) this.maxReportAgeDays = maxReportAgeDays;
        this.updatedAt = now;
    }

    public void start(UUID supplierUserId, OffsetDateTime now) {
        String reason = status == RequirementStatus.REVISION_REQUESTED ? "Revision started" : "Response started";
        transitionTo(RequirementStatus.IN_PROGRESS, supplierUserId, reason, now,
                () -> new InvalidTransitionException("cannot start this requirement"));
    }

    public void submit(UUID supplierUserId, OffsetDateTime now) {
        transitionTo(RequirementStatus.SUBMITTED, supplierUserId, "Response submitted", now,
                () -> new InvalidTransitionException("cannot submit this requirement"));
    }

    public void approve(UUID reviewerId, String notes, OffsetDateTime now) {
        requireSubmitted("approve");
        transitionTo(RequirementStatus.APPROVED, reviewerId, blankToNull(notes), now,
                () -> new CannotReviewException("cannot approve this requirement"));
    }

    public void reject(UUID reviewerId, String reason, OffsetDateTime now) {
        requireSubmitted("reject");
        requireReason(reason, "reject");
        transitionTo(RequirementStatus.REJECTED, reviewerId, reason.trim(), now,
                () -> new CannotReviewException("cannot reject this requirement"));
    }

    public void requestRevision(UUID reviewerId, String reason, OffsetDateTime now) {
        requireSubmitted("request revision for");
        requireReason(reason, "request revision for");
        transitionTo(RequirementStatus.REVISION_REQUESTED, reviewerId, reason.trim(), now,
                () -> new CannotReviewException("cannot request revision for this requirement"));
    }

    /** System transition used by the expiry sweep. */
    public void expire(OffsetDateTime now) {
        if (!RequirementStatus.OPEN.contains(status)) {
            throw new InvalidTransitionException("cannot expire this requirement");
        }
        transitionTo(RequirementStatus.EXPIRED, null, EXPIRY_REASON, now,
                () -> new InvalidTransitionException("cannot expire this requirement"));
    }

    private void requireSubmitted(String action) {
        if (status != RequirementStatus.SUBMITTED) {
            throw new CannotReviewException("cannot " + action + " this requirement");
        }
    }

    private static void requireReason(String reason, String action) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationFailedException("a reason is required to " + action + " this requirement");
        }
    }

    private void transitionTo(RequirementStatus target, UUID changedBy, String reason, OffsetDateTime now,
                              java.util.function.Supplier<RuntimeException> failure) {
        if (!status.canTransitionTo(target)) {
            throw failure.get();
        }
        statusHistory.add(new StatusChange<>(status, target, changedBy, reason, now));
        this.status = target;
        this.updatedAt = now;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    // Derived values, computed against the caller's clock

    public boolean isOverdue(OffsetDateTime now) {
        return dueDate != null && now.isAfter(dueDate) && RequirementStatus.OPEN.contains(status);
    }

    /**
     * Whole days until the due date, negative once it has passed.
     *
     * @return null when the requirement has no due date
     */
    public Integer daysUntilDue(OffsetDateTime now) {
        if (dueDate == null) {
            return null;
        }
        return (int) (Duration.between(now, dueDate).toHours() / 24);
    }

    public boolean isQuestionnaire() {
        return type == RequirementType.QUESTIONNAIRE;
    }

    public UUID getId() { return id; }
    public UUID getRelationshipId() { return relationshipId; }
    public UUID getCompanyId() { return companyId; }
    public UUID getSupplierId() { return supplierId; }
    public RequirementType getType() { return type; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public Priority getPriority() { return priority; }
    public UUID getQuestionnaireId() { return questionnaireId; }
    public Integer getPassingScore() { return passingScore; }
    public ReportGrade getMinimumGrade() { return minimumGrade; }
    public Integer getMaxReportAgeDays() { return maxReportAgeDays; }
    public OffsetDateTime getDueDate() { return dueDate; }
    public OffsetDateTime getReminderSentAt() { return reminderSentAt; }
    public RequirementStatus getStatus() { return status; }
    public List<StatusChange<RequirementStatus>> getStatusHistory() { return Collections.unmodifiableList(statusHistory); }
    public UUID getAssignedByUserId() { return assignedByUserId; }
    public OffsetDateTime getAssignedAt() { return assignedAt; }
    public OffsetDateTime getCreatedAt() { return createdAt; }
    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public long getVersion() { return version; }
}
