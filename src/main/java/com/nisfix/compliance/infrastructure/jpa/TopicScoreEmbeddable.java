package com.nisfix.compliance.infrastructure.jpa;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class TopicScoreEmbeddable {

    @Column(name = "topic_id", nullable = false, length = 64)
    private String topicId;

    @Column(name = "topic_name")
    private String topicName;

    @Column(nullable = false)
    private int score;

    @Column(name = "max_score", nullable = false)
    private int maxScore;

    @Column(name = "percentage_score", nullable = false)
    private double percentageScore;

    public TopicScoreEmbeddable() {}

    public TopicScoreEmbeddable(String topicId, String topicName, int score, int maxScore, double percentageScore) {
        this.topicId = topicId;
        this.topicName = topicName;
        this.score = score;
        this.maxScore = maxScore;
        this.percentageScore = percentageScore;
    }

    public String getTopicId() { return topicId; }
    public void setTopicId(String topicId) { this.topicId = topicId; }

    public String getTopicName() { return topicName; }
    public void setTopicName(String topicName) { this.topicName = topicName; }

    public int getScore() { return score; }
    public void setScore(int score) { this.score = score; }

    public int getMaxScore() { return maxScore; }
    public void setMaxScore(int maxScore) { this.maxScore = maxScore; }

    public double getPercentageScore() { return percentageScore; }
    public void setPercentageScore(double percentageScore) { this.percentageScore = percentageScore; }
}
