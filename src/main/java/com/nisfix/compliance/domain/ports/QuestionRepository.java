package com.nisfix.compliance.domain.ports;

import com.nisfix.compliance.domain.questionnaire.Question;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface QuestionRepository {
    Question save(Question question);

    Optional<Question> findById(UUID id);

    /** Ordered by question order. */
    List<Question> listByQuestionnaire(UUID questionnaireId);

    void delete(UUID id);

    void deleteByQuestionnaire(UUID questionnaireId);
}
