package com.nisfix.compliance.domain.response;

public record TopicScore(String topicId, String topicName, int score, int maxScore, double percentageScore) {
}
