package com.nisfix.compliance.domain.questionnaire;

public enum QuestionType {
    SINGLE_CHOICE,
    MULTIPLE_CHOICE,
    TEXT,
    YES_NO;

    public boolean requiresOptions() {
        return this == SINGLE_CHOICE || this == MULTIPLE_CHOICE;
    }

    public boolean isChoice() {
        return this != TEXT;
    }
}
