package com.nisfix.compliance.domain.ports;

import com.nisfix.compliance.domain.Organization;

import java.util.Optional;
import java.util.UUID;

public interface OrganizationRepository {
    Organization save(Organization organization);

    Optional<Organization> findById(UUID id);
}
