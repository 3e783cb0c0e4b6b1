package com.nisfix.compliance.infrastructure.jpa;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class QuestionOptionEmbeddable {

    @Column(name = "option_id", nullable = false, length = 64)
    private String optionId;

    @Column(nullable = false, length = 2000)
    private String text;

    @Column(nullable = false)
    private int points;

    @Column(name = "is_correct", nullable = false)
    private boolean correct;

    @Column(name = "sort_order", nullable = false)
    private int sortOrder;

    public QuestionOptionEmbeddable() {}

    public QuestionOptionEmbeddable(String optionId, String text, int points, boolean correct, int sortOrder) {
        this.optionId = optionId;
        this.text = text;
        this.points = points;
        this.correct = correct;
        this.sortOrder = sortOrder;
    }

    public String getOptionId() { return optionId; }
    public void setOptionId(String optionId) { this.optionId = optionId; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public int getPoints() { return points; }
    public void setPoints(int points) { this.points = points; }

    public boolean isCorrect() { return correct; }
    public void setCorrect(boolean correct) { this.correct = correct; }

    public int getSortOrder() { return sortOrder; }
    public void setSortOrder(int sortOrder) { this.sortOrder = sortOrder; }
}
