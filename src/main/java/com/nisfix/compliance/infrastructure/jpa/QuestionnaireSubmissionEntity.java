package com.nisfix.compliance.infrastructure.jpa;

import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Immutable
@Table(name = "questionnaire_submissions")
public class QuestionnaireSubmissionEntity {
    @Id
    private UUID id;

    @Column(name = "response_id", nullable = false, unique = true)
    private UUID responseId;

    @Column(name = "requirement_id", nullable = false)
    private UUID requirementId;

    @Column(name = "questionnaire_id", nullable = false)
    private UUID questionnaireId;

    @Column(name = "supplier_id", nullable = false)
    private UUID supplierId;

    @ElementCollection
    @CollectionTable(name = "submission_answers", joinColumns = @JoinColumn(name = "submission_id"))
    @OrderColumn(name = "seq")
    private List<AnswerEmbeddable> answers = new ArrayList<>();

    @Column(name = "total_score", nullable = false)
    private int totalScore;

    @Column(name = "max_possible_score", nullable = false)
    private int maxPossibleScore;

    @Column(name = "percentage_score", nullable = false)
    private double percentageScore;

    @Column(name = "passing_score", nullable = false)
    private int passingScore;

    @Column(nullable = false)
    private boolean passed;

    @Column(name = "must_pass_failed", nullable = false)
    private boolean mustPassFailed;

    @ElementCollection
    @CollectionTable(name = "submission_topic_scores", joinColumns = @JoinColumn(name = "submission_id"))
    @OrderColumn(name = "seq")
    private List<TopicScoreEmbeddable> topicScores = new ArrayList<>();

    @Column(name = "completion_time_minutes", nullable = false)
    private int completionTimeMinutes;

    @Column(name = "started_at", nullable = false)
    private OffsetDateTime startedAt;

    @Column(name = "submitted_at", nullable = false)
    private OffsetDateTime submittedAt;

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getResponseId() { return responseId; }
    public void setResponseId(UUID responseId) { this.responseId = responseId; }

    public UUID getRequirementId() { return requirementId; }
    public void setRequirementId(UUID requirementId) { this.requirementId = requirementId; }

    public UUID getQuestionnaireId() { return questionnaireId; }
    public void setQuestionnaireId(UUID questionnaireId) { this.questionnaireId = questionnaireId; }

    public UUID getSupplierId() { return supplierId; }
    public void setSupplierId(UUID supplierId) { this.supplierId = supplierId; }

    public List<AnswerEmbeddable> getAnswers() { return answers; }
    public void setAnswers(List<AnswerEmbeddable> answers) { this.answers = answers; }

    public int getTotalScore() { return totalScore; }
    public void setTotalScore(int totalScore) { this.totalScore = totalScore; }

    public int getMaxPossibleScore() { return maxPossibleScore; }
    public void setMaxPossibleScore(int maxPossibleScore) { this.maxPossibleScore = maxPossibleScore; }

    public double getPercentageScore() { return percentageScore; }
    public void setPercentageScore(double percentageScore) { this.percentageScore = percentageScore; }

    public int getPassingScore() { return passingScore; }
    public void setPassingScore(int passingScore) { this.passingScore = passingScore; }

    public boolean isPassed() { return passed; }
    public void setPassed(boolean passed) { this.passed = passed; }

    public boolean isMustPassFailed() { return mustPassFailed; }
    public void setMustPassFailed(boolean mustPassFailed) { this.mustPassFailed = mustPassFailed; }

    public List<TopicScoreEmbeddable> getTopicScores() { return topicScores; }
    public void setTopicScores(List<TopicScoreEmbeddable> topicScores) { this.topicScores = topicScores; }

    public int getCompletionTimeMinutes() { return completionTimeMinutes; }
    public void setCompletionTimeMinutes(int completionTimeMinutes) { this.completionTimeMinutes = completionTimeMinutes; }

    public OffsetDateTime getStartedAt() { return startedAt; }
    public void setStartedAt(OffsetDateTime startedAt) { this.startedAt = startedAt; }

    public OffsetDateTime getSubmittedAt() { return submittedAt; }
    public void setSubmittedAt(OffsetDateTime submittedAt) { this.submittedAt = submittedAt; }
}
