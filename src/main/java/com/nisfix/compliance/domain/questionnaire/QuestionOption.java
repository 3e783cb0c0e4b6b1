package com.nisfix.compliance.domain.questionnaire;

public record QuestionOption(String id, String text, int points, boolean correct, int order) {
}
