package com.nisfix.compliance.infrastructure.jpa;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.UUID;

public interface SpringQuestionnaireTemplateRepository extends JpaRepository<QuestionnaireTemplateEntity, UUID> {

    @Query("SELECT t FROM QuestionnaireTemplateEntity t " +
            "WHERE (t.system = true OR t.visibility = 'GLOBAL' OR t.ownerOrganizationId = :orgId) " +
            "AND (:category IS NULL OR t.category = :category)")
    Page<QuestionnaireTemplateEntity> findAvailable(@Param("orgId") UUID organizationId,
                                                    @Param("category") String category,
                                                    Pageable pageable);

    Page<QuestionnaireTemplateEntity> findByOwnerOrganizationId(UUID ownerOrganizationId, Pageable pageable);

    Page<QuestionnaireTemplateEntity> findByCreatedBy(UUID createdBy, Pageable pageable);

    long countBySystemTrue();

    @Modifying
    @Query("UPDATE QuestionnaireTemplateEntity t SET t.usageCount = t.usageCount + 1 WHERE t.id = :id")
    int incrementUsage(@Param("id") UUID id);
}
