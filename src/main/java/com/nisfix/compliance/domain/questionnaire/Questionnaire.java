package com.nisfix.compliance.domain.questionnaire;

import com.nisfix.compliance.domain.template.QuestionnaireTemplate;
import com.nisfix.compliance.exception.InvalidTransitionException;
import com.nisfix.compliance.exception.NotEditableException;
import com.nisfix.compliance.exception.ValidationFailedException;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A company-owned set of scored questions that can be assigned to suppliers once published.
 */
public class Questionnaire {

    public static final int DEFAULT_PASSING_SCORE = 70;

    private final UUID id;
    private final UUID companyId;
    private final UUID templateId;
    private String name;
    private String description;
    private QuestionnaireStatus status;
    private int passingScore;
    private ScoringMode scoringMode;
    private List<Topic> topics;
    private int questionCount;
    private int maxPossibleScore;
    private final OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    private OffsetDateTime publishedAt;

    public Questionnaire(UUID id, UUID companyId, UUID templateId, String name, String description, QuestionnaireStatus status,
                         int passingScore, ScoringMode scoringMode, List<Topic> topics, int questionCount,
                         int maxPossibleScore, OffsetDateTime createdAt, OffsetDateTime updatedAt,
                         OffsetDateTime publishedAt) {
        this.id = id;
        this.companyId = companyId;
        this.templateId = templateId;
        this.name = name;
        this.description = description;
        this.status = status;
        this.passingScore = passingScore;
        this.scoringMode = scoringMode;
        this.topics = topics == null ? new ArrayList<>() : new ArrayList<>(topics);
        this.questionCount = questionCount;
        this.maxPossibleScore = maxPossibleScore;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.publishedAt = publishedAt;
    }

    public static Questionnaire create(UUID companyId, String name, String description, Integer passingScore,
                                       ScoringMode scoringMode, List<Topic> topics, OffsetDateTime now) {
        return new Questionnaire(UUID.randomUUID(), companyId, null, name, description, QuestionnaireStatus.DRAFT,
                passingScore == null || passingScore == 0 ? DEFAULT_PASSING_SCORE : passingScore,
                scoringMode == null ? ScoringMode.PERCENTAGE : scoringMode,
                numberTopics(topics), 0, 0, now, now, null);
    }

    /**
     * Starts a draft from a template: its topics, keeping their ids, and its default passing score
     * are copied. Questions are added afterwards as for any draft.
     */
    public static Questionnaire fromTemplate(UUID companyId, QuestionnaireTemplate template, String name,
                                             OffsetDateTime now) {
        String effectiveName = name == null || name.isBlank() ? template.getName() : name.trim();
        return new Questionnaire(UUID.randomUUID(), companyId, template.getId(), effectiveName,
                template.getDescription(), QuestionnaireStatus.DRAFT, template.getDefaultPassingScore(),
                ScoringMode.PERCENTAGE, numberTopics(template.getTopics()), 0, 0, now, now, null);
    }

    public void update(String name, String description, Integer passingScore, ScoringMode scoringMode,
                       List<Topic> topics, OffsetDateTime now) {
        requireEditable();
        if (name != null && !name.isBlank()) this.name = name.trim();
        if (description != null) this.description = description;
        if (passingScore != null) this.passingScore = passingScore;
        if (scoringMode != null) this.scoringMode = scoringMode;
        if (topics != null) this.topics = numberTopics(topics);
        this.updatedAt = now;
    }

    public void publish(OffsetDateTime now) {
        if (!status.canTransitionTo(QuestionnaireStatus.PUBLISHED)) {
            throw new InvalidTransitionException("cannot publish this questionnaire");
        }
        if (questionCount < 1) {
            throw new ValidationFailedException("a questionnaire needs at least one question to be published");
        }
        this.status = QuestionnaireStatus.PUBLISHED;
        this.publishedAt = now;
        this.updatedAt = now;
    }

    public void archive(OffsetDateTime now) {
        if (!status.canTransitionTo(QuestionnaireStatus.ARCHIVED)) {
            throw new InvalidTransitionException("cannot archive this questionnaire");
        }
        this.status = QuestionnaireStatus.ARCHIVED;
        this.updatedAt = now;
    }

    public void updateStatistics(int questionCount, int maxPossibleScore, OffsetDateTime now) {
        this.questionCount = questionCount;
        this.maxPossibleScore = maxPossibleScore;
        this.updatedAt = now;
    }

    /** Questions and the questionnaire itself can only change while it is a draft. */
    public void requireEditable() {
        if (status != QuestionnaireStatus.DRAFT) {
            throw new NotEditableException("cannot edit this questionnaire");
        }
    }

    public boolean canBeAssigned() {
        return status == QuestionnaireStatus.PUBLISHED;
    }

    public Optional<Topic> findTopic(String topicId) {
        return topics.stream().filter(t -> t.id().equals(topicId)).findFirst();
    }

    private static List<Topic> numberTopics(List<Topic> topics) {
        List<Topic> numbered = new ArrayList<>();
        if (topics == null) {
            return numbered;
        }
        for (Topic topic : topics) {
            String id = topic.id() == null || topic.id().isBlank() ? UUID.randomUUID().toString() : topic.id();
            int order = topic.order() == 0 ? numbered.size() + 1 : topic.order();
            numbered.add(new Topic(id, topic.name(), topic.description(), order));
        }
        return numbered;
    }

    public UUID getId() { return id; }
    public UUID getCompanyId() { return companyId; }
    public UUID getTemplateId() { return templateId; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public QuestionnaireStatus getStatus() { return status; }
    public int getPassingScore() { return passingScore; }
    public ScoringMode getScoringMode() { return scoringMode; }
    public List<Topic> getTopics() { return Collections.unmodifiableList(topics); }
    public int getQuestionCount() { return questionCount; }
    public int getMaxPossibleScore() { return maxPossibleScore; }
    public OffsetDateTime getCreatedAt() { return createdAt; }
    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public OffsetDateTime getPublishedAt() { return publishedAt; }
}
