package com.nisfix.compliance.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface SpringSupplierResponseRepository extends JpaRepository<SupplierResponseEntity, UUID> {
    Optional<SupplierResponseEntity> findFirstByRequirementIdOrderByStartedAtDesc(UUID requirementId);
}
