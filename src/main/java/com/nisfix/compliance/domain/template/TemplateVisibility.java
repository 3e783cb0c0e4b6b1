package com.nisfix.compliance.domain.template;

/**
 * Who can see a company template. DRAFT and LOCAL templates stay inside the owning company,
 * GLOBAL ones are offered to every company.
 */
public enum TemplateVisibility {
    DRAFT,
    LOCAL,
    GLOBAL
}
