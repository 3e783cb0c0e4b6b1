package com.nisfix.compliance.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nisfix.compliance.config.AuthenticatedUser;
import com.nisfix.compliance.domain.PageQuery;
import com.nisfix.compliance.domain.PageResult;
import com.nisfix.compliance.domain.ports.TemplateRepository;
import com.nisfix.compliance.domain.template.QuestionnaireTemplate;
import com.nisfix.compliance.domain.template.TemplateCategory;
import com.nisfix.compliance.domain.template.TemplateVisibility;
import com.nisfix.compliance.exception.CannotModifyException;
import com.nisfix.compliance.exception.NotFoundException;
import com.nisfix.compliance.exception.ValidationFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Questionnaire templates: the read-only system catalogue plus templates companies author, import
 * and share.
 */
@Service
public class TemplateService {

    private static final Logger log = LoggerFactory.getLogger(TemplateService.class);

    static final String SYSTEM_TEMPLATES_RESOURCE = "seed/system-templates.json";

    private final TemplateRepository templates;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TemplateService(TemplateRepository templates, ObjectMapper objectMapper, Clock clock) {
        this.templates = templates;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Transactional
    public QuestionnaireTemplate create(AuthenticatedUser caller, TemplateDefinition definition) {
        QuestionnaireTemplate template = templates.save(QuestionnaireTemplate.draft(caller.organizationId(),
                caller.userId(), definition.name(), definition.description(), parseCategory(definition.category()),
                definition.version(), definition.defaultPassingScore(), definition.estimatedMinutes(),
                definition.topics(), definition.tags(), OffsetDateTime.now(clock)));
        log.info("Template {} created by user {} of organization {}", template.getId(), caller.userId(),
                caller.organizationId());
        return template;
    }

    /**
     * Creates a draft from an exported template document. Name and category are mandatory.
     */
    @Transactional
    public QuestionnaireTemplate importTemplate(AuthenticatedUser caller, String content) {
        TemplateDefinition definition;
        try {
            definition = objectMapper.readValue(content, TemplateDefinition.class);
        } catch (JsonProcessingException e) {
            log.warn("Rejected template import from organization {}: {}", caller.organizationId(),
                    e.getOriginalMessage());
            throw new ValidationFailedException("template document is not valid JSON");
        }
        if (definition == null || definition.name() == null || definition.name().isBlank()) {
            throw new ValidationFailedException("name is required");
        }
        if (definition.category() == null || definition.category().isBlank()) {
            throw new ValidationFailedException("category is required");
        }
        return create(caller, definition);
    }

    @Transactional(readOnly = true)
    public QuestionnaireTemplate get(UUID organizationId, UUID templateId) {
        return templates.findById(templateId)
                .filter(t -> t.isVisibleTo(organizationId))
                .orElseThrow(() -> new NotFoundException("Template", templateId));
    }

    @Transactional(readOnly = true)
    public PageResult<QuestionnaireTemplate> listAvailable(UUID organizationId, TemplateCategory category,
                                                           PageQuery page) {
        return templates.listAvailable(organizationId, category, page);
    }

    @Transactional(readOnly = true)
    public PageResult<QuestionnaireTemplate> listForOrganization(UUID organizationId, PageQuery page) {
        return templates.listByOrganization(organizationId, page);
    }

    @Transactional(readOnly = true)
    public PageResult<QuestionnaireTemplate> listCreatedBy(UUID userId, PageQuery page) {
        return templates.listByCreator(userId, page);
    }

    @Transactional
    public QuestionnaireTemplate update(AuthenticatedUser caller, UUID templateId, TemplateDefinition definition) {
        QuestionnaireTemplate template = loadOwned(caller.organizationId(), templateId);
        template.update(definition.name(), definition.description(), definition.version(),
                definition.defaultPassingScore(), definition.estimatedMinutes(), definition.topics(),
                definition.tags(), OffsetDateTime.now(clock));
        return templates.save(template);
    }

    @Transactional
    public void delete(AuthenticatedUser caller, UUID templateId) {
        QuestionnaireTemplate template = loadOwned(caller.organizationId(), templateId);
        template.requireDeletable();
        templates.delete(templateId);
        log.info("Template {} deleted by user {}", templateId, caller.userId());
    }

    @Transactional
    public QuestionnaireTemplate publish(AuthenticatedUser caller, UUID templateId, TemplateVisibility visibility) {
        QuestionnaireTemplate template = loadOwned(caller.organizationId(), templateId);
        template.publish(visibility, OffsetDateTime.now(clock));
        log.info("Template {} published as {} by user {}", templateId, visibility, caller.userId());
        return templates.save(template);
    }

    @Transactional
    public QuestionnaireTemplate unpublish(AuthenticatedUser caller, UUID templateId) {
        QuestionnaireTemplate template = loadOwned(caller.organizationId(), templateId);
        template.unpublish(OffsetDateTime.now(clock));
        log.info("Template {} reverted to draft by user {}", templateId, caller.userId());
        return templates.save(template);
    }

    /**
     * Loads the system catalogue from the classpath when no system template exists yet.
     *
     * @return the number of templates created
     */
    @Transactional
    public int seedSystemTemplates() {
        if (templates.countSystemTemplates() > 0) {
            log.info("System templates already present, skipping seed");
            return 0;
        }
        List<TemplateDefinition> definitions;
        try (InputStream in = new ClassPathResource(SYSTEM_TEMPLATES_RESOURCE).getInputStream()) {
            definitions = objectMapper.readValue(in, new TypeReference<List<TemplateDefinition>>() { });
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + SYSTEM_TEMPLATES_RESOURCE, e);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        for (TemplateDefinition d : definitions) {
            templates.save(QuestionnaireTemplate.system(d.name(), d.description(), parseCategory(d.category()),
                    d.version(), d.defaultPassingScore() == null ? 0 : d.defaultPassingScore(),
                    d.estimatedMinutes() == null ? 0 : d.estimatedMinutes(), d.topics(), d.tags(), now));
        }
        log.info("Seeded {} system questionnaire templates", definitions.size());
        return definitions.size();
    }

    private QuestionnaireTemplate loadOwned(UUID organizationId, UUID templateId) {
        QuestionnaireTemplate template = get(organizationId, templateId);
        if (!template.isOwnedBy(organizationId)) {
            throw new CannotModifyException("only the owning company can change this template");
        }
        return template;
    }

    private static TemplateCategory parseCategory(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return TemplateCategory.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationFailedException("invalid category: " + value);
        }
    }
}
