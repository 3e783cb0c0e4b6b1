package com.nisfix.compliance.infrastructure.jpa;

import jakarta.persistence.*;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "questions", indexes = {
        @Index(name = "idx_questions_questionnaire", columnList = "questionnaire_id, sort_order")
})
public class QuestionEntity {
    @Id
    private UUID id;

    @Column(name = "questionnaire_id", nullable = false)
    private UUID questionnaireId;

    @Column(name = "topic_id", length = 64)
    private String topicId;

    @Column(nullable = false, length = 2000)
    private String text;

    @Column(length = 4000)
    private String description;

    @Column(name = "help_text", length = 2000)
    private String helpText;

    @Column(nullable = false, length = 32)
    private String type;

    @Column(name = "sort_order", nullable = false)
    private int sortOrder;

    @Column(nullable = false)
    private int weight;

    @Column(name = "max_points", nullable = false)
    private int maxPoints;

    @Column(name = "is_must_pass", nullable = false)
    private boolean mustPass;

    @ElementCollection
    @CollectionTable(name = "question_options", joinColumns = @JoinColumn(name = "question_id"))
    @OrderColumn(name = "seq")
    private List<QuestionOptionEmbeddable> options = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getQuestionnaireId() { return questionnaireId; }
    public void setQuestionnaireId(UUID questionnaireId) { this.questionnaireId = questionnaireId; }

    public String getTopicId() { return topicId; }
    public void setTopicId(String topicId) { this.topicId = topicId; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getHelpText() { return helpText; }
    public void setHelpText(String helpText) { this.helpText = helpText; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public int getSortOrder() { return sortOrder; }
    public void setSortOrder(int sortOrder) { this.sortOrder = sortOrder; }

    public int getWeight() { return weight; }
    public void setWeight(int weight) { this.weight = weight; }

    public int getMaxPoints() { return maxPoints; }
    public void setMaxPoints(int maxPoints) { this.maxPoints = maxPoints; }

    public boolean isMustPass() { return mustPass; }
    public void setMustPass(boolean mustPass) { this.mustPass = mustPass; }

    public List<QuestionOptionEmbeddable> getOptions() { return options; }
    public void setOptions(List<QuestionOptionEmbeddable> options) { this.options = options; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }

    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(OffsetDateTime updatedAt) { this.updatedAt = updatedAt; }
}
