package com.nisfix.compliance.infrastructure.jpa;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface SpringRelationshipRepository extends JpaRepository<RelationshipEntity, UUID> {

    boolean existsByCompanyIdAndInvitedEmailAndStatusIn(UUID companyId, String invitedEmail,
                                                        Collection<String> statuses);

    @Query("SELECT r FROM RelationshipEntity r WHERE r.companyId = :companyId " +
            "AND (:status IS NULL OR r.status = :status) " +
            "AND (:classification IS NULL OR r.classification = :classification)")
    Page<RelationshipEntity> search(@Param("companyId") UUID companyId,
                                    @Param("status") String status,
                                    @Param("classification") String classification,
                                    Pageable pageable);

    List<RelationshipEntity> findByInvitedEmailAndStatusOrderByCreatedAtDesc(String invitedEmail, String status);

    @Query("SELECT r.status, COUNT(r) FROM RelationshipEntity r WHERE r.companyId = :companyId GROUP BY r.status")
    List<Object[]> countByStatus(@Param("companyId") UUID companyId);

    @Query("SELECT r.classification, COUNT(r) FROM RelationshipEntity r " +
            "WHERE r.companyId = :companyId GROUP BY r.classification")
    List<Object[]> countByClassification(@Param("companyId") UUID companyId);
}
