package com.nisfix.compliance.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface SpringQuestionRepository extends JpaRepository<QuestionEntity, UUID> {
    List<QuestionEntity> findByQuestionnaireIdOrderBySortOrderAscCreatedAtAsc(UUID questionnaireId);

    void deleteByQuestionnaireId(UUID questionnaireId);
}
