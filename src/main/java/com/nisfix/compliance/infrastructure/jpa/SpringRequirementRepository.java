package com.nisfix.compliance.infrastructure.jpa;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface SpringRequirementRepository extends JpaRepository<RequirementEntity, UUID> {

    @Query("SELECT r FROM RequirementEntity r WHERE r.companyId = :companyId " +
            "AND (:status IS NULL OR r.status = :status) " +
            "AND (:relationshipId IS NULL OR r.relationshipId = :relationshipId)")
    Page<RequirementEntity> searchByCompany(@Param("companyId") UUID companyId,
                                            @Param("status") String status,
                                            @Param("relationshipId") UUID relationshipId,
                                            Pageable pageable);

    @Query("SELECT r FROM RequirementEntity r WHERE r.supplierId = :supplierId " +
            "AND (:status IS NULL OR r.status = :status)")
    Page<RequirementEntity> searchBySupplier(@Param("supplierId") UUID supplierId,
                                             @Param("status") String status,
                                             Pageable pageable);

    @Query("SELECT r.status, COUNT(r) FROM RequirementEntity r WHERE r.companyId = :companyId GROUP BY r.status")
    List<Object[]> countByStatus(@Param("companyId") UUID companyId);

    long countByCompanyIdAndStatusInAndDueDateBefore(UUID companyId, Collection<String> statuses,
                                                     OffsetDateTime now);

    @Query("SELECT r FROM RequirementEntity r WHERE r.status IN :statuses " +
            "AND r.dueDate IS NOT NULL AND r.dueDate < :now ORDER BY r.dueDate ASC")
    List<RequirementEntity> findOverdue(@Param("statuses") Collection<String> statuses,
                                        @Param("now") OffsetDateTime now,
                                        Pageable pageable);

    @Query("SELECT r FROM RequirementEntity r WHERE r.status IN :statuses AND r.reminderSentAt IS NULL " +
            "AND r.dueDate >= :now AND r.dueDate <= :horizon ORDER BY r.dueDate ASC")
    List<RequirementEntity> findReminderCandidates(@Param("statuses") Collection<String> statuses,
                                                   @Param("now") OffsetDateTime now,
                                                   @Param("horizon") OffsetDateTime horizon,
                                                   Pageable pageable);

    // Exactly-once reminder marking
    @Modifying
    @Query("UPDATE RequirementEntity r SET r.reminderSentAt = :at WHERE r.id = :id AND r.reminderSentAt IS NULL")
    int markReminderSent(@Param("id") UUID id, @Param("at") OffsetDateTime at);
}
