package com.nisfix.compliance.domain.response;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Scored, immutable record of one questionnaire submission.
 */
public class QuestionnaireSubmission {
    private final UUID id;
    private final UUID responseId;
    private final UUID requirementId;
    private final UUID questionnaireId;
    private final UUID supplierId;
    private final List<SubmissionAnswer> answers;
    private final int totalScore;
    private final int maxPossibleScore;
    private final double percentageScore;
    private final int passingScore;
    private final boolean passed;
    private final boolean mustPassFailed;
    private final List<TopicScore> topicScores;
    private final int completionTimeMinutes;
    private final OffsetDateTime startedAt;
    private final OffsetDateTime submittedAt;

    public QuestionnaireSubmission(UUID id, UUID responseId, UUID requirementId, UUID questionnaireId,
                                   UUID supplierId, List<SubmissionAnswer> answers, int totalScore,
                                   int maxPossibleScore, double percentageScore, int passingScore, boolean passed,
                                   boolean mustPassFailed, List<TopicScore> topicScores, int completionTimeMinutes,
                                   OffsetDateTime startedAt, OffsetDateTime submittedAt) {
        this.id = id;
        this.responseId = responseId;
        this.requirementId = requirementId;
        this.questionnaireId = questionnaireId;
        this.supplierId = supplierId;
        this.answers = answers == null ? List.of() : List.copyOf(answers);
        this.totalScore = totalScore;
        this.maxPossibleScore = maxPossibleScore;
        this.percentageScore = percentageScore;
        this.passingScore = passingScore;
        this.passed = passed;
        this.mustPassFailed = mustPassFailed;
        this.topicScores = topicScores == null ? List.of() : List.copyOf(topicScores);
        this.completionTimeMinutes = completionTimeMinutes;
        this.startedAt = startedAt;
        this.submittedAt = submittedAt;
    }

    public UUID getId() { return id; }
    public UUID getResponseId() { return responseId; }
    public UUID getRequirementId() { return requirementId; }
    public UUID getQuestionnaireId() { return questionnaireId; }
    public UUID getSupplierId() { return supplierId; }
    public List<SubmissionAnswer> getAnswers() { return answers; }
    public int getTotalScore() { return totalScore; }
    public int getMaxPossibleScore() { return maxPossibleScore; }
    public double getPercentageScore() { return percentageScore; }
    public int getPassingScore() { return passingScore; }
    public boolean isPassed() { return passed; }
    public boolean isMustPassFailed() { return mustPassFailed; }
    public List<TopicScore> getTopicScores() { return topicScores; }
    public int getCompletionTimeMinutes() { return completionTimeMinutes; }
    public OffsetDateTime getStartedAt() { return startedAt; }
    public OffsetDateTime getSubmittedAt() { return submittedAt; }
}
