package com.nisfix.compliance.domain.template;

/**
 * Framework a template is built around. Every category except CUSTOM is reserved for the templates
 * shipped with the application.
 */
public enum TemplateCategory {
    ISO27001,
    GDPR,
    NIS2,
    CUSTOM;

    public boolean isSystemCategory() {
        return this != CUSTOM;
    }
}
