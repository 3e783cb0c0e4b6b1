package com.nisfix.compliance.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface SpringOrganizationRepository extends JpaRepository<OrganizationEntity, UUID> {
    boolean existsBySlug(String slug);
}
