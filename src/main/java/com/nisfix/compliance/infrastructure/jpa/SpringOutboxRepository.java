package com.nisfix.compliance.infrastructure.jpa;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public interface SpringOutboxRepository extends JpaRepository<OutboxEventEntity, UUID> {

    @Query("SELECT e FROM OutboxEventEntity e WHERE e.processedAt IS NULL AND e.attempts < :maxAttempts " +
            "ORDER BY e.occurredAt ASC")
    List<OutboxEventEntity> findPending(@Param("maxAttempts") int maxAttempts, Pageable pageable);

    long countByProcessedAtIsNull();
    long countByProcessedAtIsNotNull();

    @Modifying
    @Query("DELETE FROM OutboxEventEntity e WHERE e.processedAt IS NOT NULL AND e.processedAt < :cutoff")
    int deleteProcessedBefore(@Param("cutoff") OffsetDateTime cutoff);
}
