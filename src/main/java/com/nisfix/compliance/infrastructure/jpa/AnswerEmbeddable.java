package com.nisfix.compliance.infrastructure.jpa;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Answer row shared by draft answers and scored submission answers. Scoring columns stay
 * empty for drafts, {@code savedAt} stays empty for submissions.
 */
@Embeddable
public class AnswerEmbeddable {

    @Column(name = "question_id", nullable = false)
    private UUID questionId;

    @Convert(converter = StringListConverter.class)
    @Column(name = "selected_options", length = 2000)
    private List<String> selectedOptions = new ArrayList<>();

    @Column(name = "text_answer", length = 8000)
    private String textAnswer;

    @Column(name = "points_earned")
    private Integer pointsEarned;

    @Column(name = "max_points")
    private Integer maxPoints;

    @Column(name = "must_pass_met")
    private Boolean mustPassMet;

    @Column(name = "saved_at")
    private OffsetDateTime savedAt;

    public UUID getQuestionId() { return questionId; }
    public void setQuestionId(UUID questionId) { this.questionId = questionId; }

    public List<String> getSelectedOptions() { return selectedOptions; }
    public void setSelectedOptions(List<String> selectedOptions) { this.selectedOptions = selectedOptions; }

    public String getTextAnswer() { return textAnswer; }
    public void setTextAnswer(String textAnswer) { this.textAnswer = textAnswer; }

    public Integer getPointsEarned() { return pointsEarned; }
    public void setPointsEarned(Integer pointsEarned) { this.pointsEarned = pointsEarned; }

    public Integer getMaxPoints() { return maxPoints; }
    public void setMaxPoints(Integer maxPoints) { this.maxPoints = maxPoints; }

    public Boolean getMustPassMet() { return mustPassMet; }
    public void setMustPassMet(Boolean mustPassMet) { this.mustPassMet = mustPassMet; }

    public OffsetDateTime getSavedAt() { return savedAt; }
    public void setSavedAt(OffsetDateTime savedAt) { this.savedAt = savedAt; }
}
