package com.nisfix.compliance.domain.questionnaire;

/**
 * DRAFT -> PUBLISHED -> ARCHIVED. Only drafts are editable, only published questionnaires
 * can be assigned.
 */
public enum QuestionnaireStatus {
    DRAFT,
    PUBLISHED,
    ARCHIVED;

    public boolean canTransitionTo(QuestionnaireStatus target) {
        return switch (this) {
            case DRAFT -> target == PUBLISHED;
            case PUBLISHED -> target == ARCHIVED;
            case ARCHIVED -> false;
        };
    }
}
