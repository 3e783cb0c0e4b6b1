package com.nisfix.compliance.infrastructure.adapters;

import com.nisfix.compliance.domain.ports.QuestionRepository;
import com.nisfix.compliance.domain.questionnaire.Question;
import com.nisfix.compliance.domain.questionnaire.QuestionOption;
import com.nisfix.compliance.domain.questionnaire.QuestionType;
import com.nisfix.compliance.infrastructure.jpa.QuestionEntity;
import com.nisfix.compliance.infrastructure.jpa.QuestionOptionEmbeddable;
import com.nisfix.compliance.infrastructure.jpa.SpringQuestionRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
@Transactional
public class JpaQuestionRepositoryAdapter implements QuestionRepository {
    private final SpringQuestionRepository questions;

    public JpaQuestionRepositoryAdapter(SpringQuestionRepository questions) {
        this.questions = questions;
    }

    @Override
    public Question save(Question q) {
        QuestionEntity e = questions.findById(q.getId()).orElseGet(QuestionEntity::new);
        e.setId(q.getId());
        e.setQuestionnaireId(q.getQuestionnaireId());
        e.setTopicId(q.getTopicId());
        e.setText(q.getText());
        e.setDescription(q.getDescription());
        e.setHelpText(q.getHelpText());
        e.setType(q.getType().name());
        e.setSortOrder(q.getOrder());
        e.setWeight(q.getWeight());
        e.setMaxPoints(q.getMaxPoints());
        e.setMustPass(q.isMustPass());
        e.getOptions().clear();
        for (QuestionOption o : q.getOptions()) {
            e.getOptions().add(new QuestionOptionEmbeddable(o.id(), o.text(), o.points(), o.correct(), o.order()));
        }
        e.setCreatedAt(q.getCreatedAt());
        e.setUpdatedAt(q.getUpdatedAt());
        questions.save(e);
        return q;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Question> findById(UUID id) {
        return questions.findById(id).map(JpaQuestionRepositoryAdapter::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Question> listByQuestionnaire(UUID questionnaireId) {
        return questions.findByQuestionnaireIdOrderBySortOrderAscCreatedAtAsc(questionnaireId)
                .stream().map(JpaQuestionRepositoryAdapter::toDomain).toList();
    }

    @Override
    public void delete(UUID id) {
        questions.deleteById(id);
    }

    @Override
    public void deleteByQuestionnaire(UUID questionnaireId) {
        questions.deleteByQuestionnaireId(questionnaireId);
    }

    private static Question toDomain(QuestionEntity e) {
        return new Question(e.getId(), e.getQuestionnaireId(), e.getTopicId(), e.getText(), e.getDescription(),
                e.getHelpText(), QuestionType.valueOf(e.getType()), e.getSortOrder(), e.getWeight(),
                e.getMaxPoints(), e.isMustPass(),
                e.getOptions().stream()
                        .map(o -> new QuestionOption(o.getOptionId(), o.getText(), o.getPoints(), o.isCorrect(),
                                o.getSortOrder()))
                        .toList(),
                e.getCreatedAt(), e.getUpdatedAt());
    }
}
