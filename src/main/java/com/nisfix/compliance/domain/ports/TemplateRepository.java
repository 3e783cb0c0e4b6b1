package com.nisfix.compliance.domain.ports;

import com.nisfix.compliance.domain.PageQuery;
import com.nisfix.compliance.domain.PageResult;
import com.nisfix.compliance.domain.template.QuestionnaireTemplate;
import com.nisfix.compliance.domain.template.TemplateCategory;

import java.util.Optional;
import java.util.UUID;

public interface TemplateRepository {
    QuestionnaireTemplate save(QuestionnaireTemplate template);

    Optional<QuestionnaireTemplate> findById(UUID id);

    /** System templates, globally published ones and everything owned by the organization. */
    PageResult<QuestionnaireTemplate> listAvailable(UUID organizationId, TemplateCategory category, PageQuery page);

    PageResult<QuestionnaireTemplate> listByOrganization(UUID organizationId, PageQuery page);

    PageResult<QuestionnaireTemplate> listByCreator(UUID userId, PageQuery page);

    long countSystemTemplates();

    /** Atomic increment, safe under concurrent use of the same template. */
    void incrementUsage(UUID id);

    void delete(UUID id);
}
