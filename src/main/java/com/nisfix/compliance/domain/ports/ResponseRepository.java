package com.nisfix.compliance.domain.ports;

import com.nisfix.compliance.domain.response.SupplierResponse;

import java.util.Optional;
import java.util.UUID;

public interface ResponseRepository {
    SupplierResponse save(SupplierResponse response);

    Optional<SupplierResponse> findById(UUID id);

    /** The most recently started response for a requirement. */
    Optional<SupplierResponse> findLatestByRequirement(UUID requirementId);
}
