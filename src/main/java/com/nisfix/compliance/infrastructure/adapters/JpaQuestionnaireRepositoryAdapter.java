package com.nisfix.compliance.infrastructure.adapters;

import com.nisfix.compliance.domain.PageQuery;
import com.nisfix.compliance.domain.PageResult;
import com.nisfix.compliance.domain.ports.QuestionnaireRepository;
import com.nisfix.compliance.domain.questionnaire.Questionnaire;
import com.nisfix.compliance.domain.questionnaire.QuestionnaireStatus;
import com.nisfix.compliance.domain.questionnaire.ScoringMode;
import com.nisfix.compliance.domain.questionnaire.Topic;
import com.nisfix.compliance.infrastructure.jpa.QuestionnaireEntity;
import com.nisfix.compliance.infrastructure.jpa.SpringQuestionnaireRepository;
import com.nisfix.compliance.infrastructure.jpa.TopicEmbeddable;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Component
@Transactional
public class JpaQuestionnaireRepositoryAdapter implements QuestionnaireRepository {
    private final SpringQuestionnaireRepository questionnaires;

    public JpaQuestionnaireRepositoryAdapter(SpringQuestionnaireRepository questionnaires) {
        this.questionnaires = questionnaires;
    }

    @Override
    public Questionnaire save(Questionnaire q) {
        QuestionnaireEntity e = questionnaires.findById(q.getId()).orElseGet(QuestionnaireEntity::new);
        e.setId(q.getId());
        e.setCompanyId(q.getCompanyId());
        e.setTemplateId(q.getTemplateId());
        e.setName(q.getName());
        e.setDescription(q.getDescription());
        e.setStatus(q.getStatus().name());
        e.setPassingScore(q.getPassingScore());
        e.setScoringMode(q.getScoringMode().name());
        e.getTopics().clear();
        for (Topic t : q.getTopics()) {
            e.getTopics().add(new TopicEmbeddable(t.id(), t.name(), t.description(), t.order()));
        }
        e.setQuestionCount(q.getQuestionCount());
        e.setMaxPossibleScore(q.getMaxPossibleScore());
        e.setCreatedAt(q.getCreatedAt());
        e.setUpdatedAt(q.getUpdatedAt());
        e.setPublishedAt(q.getPublishedAt());
        questionnaires.save(e);
        return q;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Questionnaire> findById(UUID id) {
        return questionnaires.findById(id).map(JpaQuestionnaireRepositoryAdapter::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public PageResult<Questionnaire> listByCompany(UUID companyId, QuestionnaireStatus status, PageQuery page) {
        Page<QuestionnaireEntity> result = questionnaires.search(companyId, StatusHistoryMapper.name(status),
                PageRequest.of(page.page() - 1, page.limit(), Sort.by(Sort.Direction.DESC, "createdAt")));
        return PageResult.of(result.getContent().stream().map(JpaQuestionnaireRepositoryAdapter::toDomain).toList(),
                result.getTotalElements(), page);
    }

    @Override
    public void delete(UUID id) {
        questionnaires.deleteById(id);
    }

    private static Questionnaire toDomain(QuestionnaireEntity e) {
        return new Questionnaire(e.getId(), e.getCompanyId(), e.getTemplateId(), e.getName(), e.getDescription(),
                QuestionnaireStatus.valueOf(e.getStatus()), e.getPassingScore(),
                ScoringMode.valueOf(e.getScoringMode()),
                e.getTopics().stream()
                        .map(t -> new Topic(t.getTopicId(), t.getName(), t.getDescription(), t.getSortOrder()))
                        .toList(),
                e.getQuestionCount(), e.getMaxPossibleScore(), e.getCreatedAt(), e.getUpdatedAt(),
                e.getPublishedAt());
    }
}
