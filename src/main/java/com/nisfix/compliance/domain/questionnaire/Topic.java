package com.nisfix.compliance.domain.questionnaire;

/**
 * Grouping of questions inside a questionnaire, used for per-topic score breakdowns.
 */
public record Topic(String id, String name, String description, int order) {
}
