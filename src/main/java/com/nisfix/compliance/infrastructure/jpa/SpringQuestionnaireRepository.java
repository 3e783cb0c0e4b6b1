package com.nisfix.compliance.infrastructure.jpa;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.UUID;

public interface SpringQuestionnaireRepository extends JpaRepository<QuestionnaireEntity, UUID> {

    @Query("SELECT q FROM QuestionnaireEntity q WHERE q.companyId = :companyId " +
            "AND (:status IS NULL OR q.status = :status)")
    Page<QuestionnaireEntity> search(@Param("companyId") UUID companyId,
                                     @Param("status") String status,
                                     Pageable pageable);
}
