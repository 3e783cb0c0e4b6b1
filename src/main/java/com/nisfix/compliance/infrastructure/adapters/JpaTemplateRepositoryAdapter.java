package com.nisfix.compliance.infrastructure.adapters;

import com.nisfix.compliance.domain.PageQuery;
import com.nisfix.compliance.domain.PageResult;
import com.nisfix.compliance.domain.ports.TemplateRepository;
import com.nisfix.compliance.domain.questionnaire.Topic;
import com.nisfix.compliance.domain.template.QuestionnaireTemplate;
import com.nisfix.compliance.domain.template.TemplateCategory;
import com.nisfix.compliance.domain.template.TemplateVisibility;
import com.nisfix.compliance.infrastructure.jpa.QuestionnaireTemplateEntity;
import com.nisfix.compliance.infrastructure.jpa.SpringQuestionnaireTemplateRepository;
import com.nisfix.compliance.infrastructure.jpa.TopicEmbeddable;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Optional;
import java.util.UUID;

@Component
@Transactional
public class JpaTemplateRepositoryAdapter implements TemplateRepository {
    private final SpringQuestionnaireTemplateRepository templates;

    public JpaTemplateRepositoryAdapter(SpringQuestionnaireTemplateRepository templates) {
        this.templates = templates;
    }

    @Override
    public QuestionnaireTemplate save(QuestionnaireTemplate t) {
        QuestionnaireTemplateEntity e = templates.findById(t.getId()).orElse(null);
        if (e == null) {
            e = new QuestionnaireTemplateEntity();
            e.setUsageCount(t.getUsageCount());
        }
        e.setId(t.getId());
        e.setName(t.getName());
        e.setDescription(t.getDescription());
        e.setCategory(t.getCategory().name());
        e.setTemplateVersion(t.getVersion());
        e.setSystem(t.isSystem());
        e.setOwnerOrganizationId(t.getOwnerOrganizationId());
        e.setCreatedBy(t.getCreatedBy());
        e.setVisibility(t.getVisibility().name());
        e.setDefaultPassingScore(t.getDefaultPassingScore());
        e.setEstimatedMinutes(t.getEstimatedMinutes());
        e.getTopics().clear();
        for (Topic topic : t.getTopics()) {
            e.getTopics().add(new TopicEmbeddable(topic.id(), topic.name(), topic.description(), topic.order()));
        }
        e.setTags(new ArrayList<>(t.getTags()));
        e.setCreatedAt(t.getCreatedAt());
        e.setUpdatedAt(t.getUpdatedAt());
        e.setPublishedAt(t.getPublishedAt());
        return toDomain(templates.save(e));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<QuestionnaireTemplate> findById(UUID id) {
        return templates.findById(id).map(JpaTemplateRepositoryAdapter::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public PageResult<QuestionnaireTemplate> listAvailable(UUID organizationId, TemplateCategory category,
                                                           PageQuery page) {
        return toPage(templates.findAvailable(organizationId, category == null ? null : category.name(),
                pageable(page)), page);
    }

    @Override
    @Transactional(readOnly = true)
    public PageResult<QuestionnaireTemplate> listByOrganization(UUID organizationId, PageQuery page) {
        return toPage(templates.findByOwnerOrganizationId(organizationId, pageable(page)), page);
    }

    @Override
    @Transactional(readOnly = true)
    public PageResult<QuestionnaireTemplate> listByCreator(UUID userId, PageQuery page) {
        return toPage(templates.findByCreatedBy(userId, pageable(page)), page);
    }

    @Override
    @Transactional(readOnly = true)
    public long countSystemTemplates() {
        return templates.countBySystemTrue();
    }

    @Override
    public void incrementUsage(UUID id) {
        templates.incrementUsage(id);
    }

    @Override
    public void delete(UUID id) {
        templates.deleteById(id);
    }

    private static Pageable pageable(PageQuery page) {
        return PageRequest.of(page.page() - 1, page.limit(), Sort.by(Sort.Direction.DESC, "createdAt"));
    }

    private static PageResult<QuestionnaireTemplate> toPage(Page<QuestionnaireTemplateEntity> result,
                                                            PageQuery page) {
        return PageResult.of(result.getContent().stream().map(JpaTemplateRepositoryAdapter::toDomain).toList(),
                result.getTotalElements(), page);
    }

    private static QuestionnaireTemplate toDomain(QuestionnaireTemplateEntity e) {
        return new QuestionnaireTemplate(e.getId(), e.getName(), e.getDescription(),
                TemplateCategory.valueOf(e.getCategory()), e.getTemplateVersion(), e.isSystem(),
                e.getOwnerOrganizationId(), e.getCreatedBy(), TemplateVisibility.valueOf(e.getVisibility()),
                e.getDefaultPassingScore(), e.getEstimatedMinutes(),
                e.getTopics().stream()
                        .map(t -> new Topic(t.getTopicId(), t.getName(), t.getDescription(), t.getSortOrder()))
                        .toList(),
                e.getTags(), e.getUsageCount(), e.getCreatedAt(), e.getUpdatedAt(), e.getPublishedAt());
    }
}
