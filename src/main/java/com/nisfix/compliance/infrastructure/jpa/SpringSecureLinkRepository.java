package com.nisfix.compliance.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

public interface SpringSecureLinkRepository extends JpaRepository<SecureLinkEntity, UUID> {

    Optional<SecureLinkEntity> findByIdentifier(String identifier);

    // Guarded single-row update: the WHERE clause is the precondition for consumption
    @Modifying
    @Query("UPDATE SecureLinkEntity l SET l.usedAt = :usedAt, l.valid = false " +
            "WHERE l.identifier = :identifier AND l.valid = true AND l.usedAt IS NULL")
    int consume(@Param("identifier") String identifier, @Param("usedAt") OffsetDateTime usedAt);

    @Modifying
    @Query("UPDATE SecureLinkEntity l SET l.valid = false " +
            "WHERE l.email = :email AND l.type = :type AND l.valid = true AND l.usedAt IS NULL")
    int invalidateActive(@Param("email") String email, @Param("type") String type);

    long countByEmailAndTypeAndCreatedAtAfter(String email, String type, OffsetDateTime since);

    @Modifying
    @Query("DELETE FROM SecureLinkEntity l WHERE l.expiresAt < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") OffsetDateTime cutoff);
}
