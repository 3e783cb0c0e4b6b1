package com.nisfix.compliance.application;

import com.nisfix.compliance.domain.questionnaire.Topic;

import java.util.List;

/**
 * Template content as submitted by a company or read from an import file. On update null fields
 * are left unchanged and the category is ignored.
 */
public record TemplateDefinition(String name, String description, String category, String version,
                                 Integer defaultPassingScore, Integer estimatedMinutes, List<Topic> topics,
                                 List<String> tags) {
}
