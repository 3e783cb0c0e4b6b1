package com.nisfix.compliance.domain.requirement;

public enum RequirementType {
    /** Answered by filling in a published questionnaire */
    QUESTIONNAIRE,
    /** Answered by submitting a graded security report */
    DOCUMENT
}
