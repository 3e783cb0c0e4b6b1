package com.nisfix.compliance.domain.questionnaire;

import com.nisfix.compliance.exception.ValidationFailedException;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * A scored question of a questionnaire.
 *
 * <p>{@code maxPoints} is derived from the options: the best option for single choice and
 * yes/no questions, the sum of positive correct options for multiple choice. Text questions
 * and questions whose options carry no points are worth one point.
 */
public class Question {
    private final UUID id;
    private final UUID questionnaireId;
    private String topicId;
    private String text;
    private String description;
    private String helpText;
    private QuestionType type;
    private int order;
    private int weight;
    private int maxPoints;
    private boolean mustPass;
    private List<QuestionOption> options;
    private final OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public Question(UUID id, UUID questionnaireId, String topicId, String text, String description,
                    String helpText, QuestionType type, int order, int weight, int maxPoints,
                    boolean mustPass, List<QuestionOption> options, OffsetDateTime createdAt,
                    OffsetDateTime updatedAt) {
        this.id = id;
        this.questionnaireId = questionnaireId;
        this.topicId = topicId;
        this.text = text;
        this.description = description;
        this.helpText = helpText;
        this.type = type;
        this.order = order;
        this.weight = weight;
        this.maxPoints = maxPoints;
        this.mustPass = mustPass;
        this.options = options == null ? new ArrayList<>() : new ArrayList<>(options);
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public static Question create(UUID questionnaireId, String topicId, String text, String description,
                                  String helpText, QuestionType type, int order, Integer weight,
                                  boolean mustPass, List<QuestionOption> options, OffsetDateTime now) {
        Question question = new Question(UUID.randomUUID(), questionnaireId, topicId, text, description, helpText,
                type, order, weight == null || weight <= 0 ? 1 : weight, 0, mustPass,
                numberOptions(options), now, now);
        question.validateDefinition();
        question.maxPoints = question.calculateMaxPoints();
        return question;
    }

    /** Null arguments keep the current value. Max points are recalculated. */
    public void update(String topicId, String text, String description, String helpText, QuestionType type,
                       Integer order, Integer weight, Boolean mustPass, List<QuestionOption> options,
                       OffsetDateTime now) {
        if (topicId != null) this.topicId = topicId;
        if (text != null && !text.isBlank()) this.text = text;
        if (description != null) this.description = description;
        if (helpText != null) this.helpText = helpText;
        if (type != null) this.type = type;
        if (order != null) this.order = order;
        if (weight != null && weight > 0) this.weight = weight;
        if (mustPass != null) this.mustPass = mustPass;
        if (options != null) this.options = numberOptions(options);
        validateDefinition();
        this.maxPoints = calculateMaxPoints();
        this.updatedAt = now;
    }

    private void validateDefinition() {
        if (type.requiresOptions() && options.isEmpty()) {
            throw new ValidationFailedException("question of type " + type + " needs at least one option");
        }
        Set<String> ids = new HashSet<>();
        for (QuestionOption option : options) {
            if (!ids.add(option.id())) {
                throw new ValidationFailedException("duplicate option id: " + option.id());
            }
        }
    }

    private static List<QuestionOption> numberOptions(List<QuestionOption> options) {
        List<QuestionOption> numbered = new ArrayList<>();
        if (options == null) {
            return numbered;
        }
        for (QuestionOption option : options) {
            String id = option.id() == null || option.id().isBlank() ? UUID.randomUUID().toString() : option.id();
            int order = option.order() == 0 ? numbered.size() + 1 : option.order();
            numbered.add(new QuestionOption(id, option.text(), option.points(), option.correct(), order));
        }
        return numbered;
    }

    int calculateMaxPoints() {
        int max = 0;
        switch (type) {
            case SINGLE_CHOICE, YES_NO -> {
                for (QuestionOption option : options) {
                    max = Math.max(max, option.points());
                }
            }
            case MULTIPLE_CHOICE -> {
                for (QuestionOption option : options) {
                    if (option.correct() && option.points() > 0) {
                        max += option.points();
                    }
                }
            }
            case TEXT -> { }
        }
        return max == 0 ? 1 : max;
    }

    /**
     * Points earned by a selection of options. Single choice and yes/no questions need exactly
     * one selection; multiple choice sums the selected correct options.
     */
    public int calculateScore(List<String> selectedOptionIds) {
        if (selectedOptionIds == null || selectedOptionIds.isEmpty()) {
            return 0;
        }
        switch (type) {
            case SINGLE_CHOICE, YES_NO -> {
                if (selectedOptionIds.size() != 1) {
                    return 0;
                }
                return findOption(selectedOptionIds.get(0)).map(QuestionOption::points).orElse(0);
            }
            case MULTIPLE_CHOICE -> {
                Set<String> selected = new HashSet<>(selectedOptionIds);
                int total = 0;
                for (QuestionOption option : options) {
                    if (selected.contains(option.id()) && option.correct()) {
                        total += option.points();
                    }
                }
                return total;
            }
            default -> {
                return 0;
            }
        }
    }

    /**
     * Points earned by a complete answer. Non-blank text answers earn the full points.
     */
    public int score(List<String> selectedOptionIds, String textAnswer) {
        if (type.isChoice()) {
            return calculateScore(selectedOptionIds);
        }
        return textAnswer != null && !textAnswer.isBlank() ? maxPoints : 0;
    }

    public void validateAnswer(List<String> selectedOptionIds, String textAnswer) {
        List<String> selected = selectedOptionIds == null ? List.of() : selectedOptionIds;
        switch (type) {
            case SINGLE_CHOICE, YES_NO -> {
                if (selected.size() != 1) {
                    throw new ValidationFailedException("question " + id + " expects exactly one option");
                }
                requireKnownOptions(selected);
            }
            case MULTIPLE_CHOICE -> {
                if (selected.isEmpty()) {
                    throw new ValidationFailedException("question " + id + " expects at least one option");
                }
                requireKnownOptions(selected);
            }
            case TEXT -> {
                if (textAnswer == null || textAnswer.isBlank()) {
                    throw new ValidationFailedException("question " + id + " expects a text answer");
                }
            }
        }
    }

    private void requireKnownOptions(List<String> selected) {
        for (String optionId : selected) {
            if (findOption(optionId).isEmpty()) {
                throw new ValidationFailedException("unknown option " + optionId + " for question " + id);
            }
        }
    }

    public Optional<QuestionOption> findOption(String optionId) {
        return options.stream().filter(o -> o.id().equals(optionId)).findFirst();
    }

    public UUID getId() { return id; }
    public UUID getQuestionnaireId() { return questionnaireId; }
    public String getTopicId() { return topicId; }
    public String getText() { return text; }
    public String getDescription() { return description; }
    public String getHelpText() { return helpText; }
    public QuestionType getType() { return type; }
    public int getOrder() { return order; }
    public int getWeight() { return weight; }
    public int getMaxPoints() { return maxPoints; }
    public boolean isMustPass() { return mustPass; }
    public List<QuestionOption> getOptions() { return Collections.unmodifiableList(options); }
    public OffsetDateTime getCreatedAt() { return createdAt; }
    public OffsetDateTime getUpdatedAt() { return updatedAt; }
}
