package com.nisfix.compliance.domain.questionnaire;

public enum ScoringMode {
    PERCENTAGE,
    POINTS
}
