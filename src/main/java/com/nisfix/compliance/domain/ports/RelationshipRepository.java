package com.nisfix.compliance.domain.ports;

import com.nisfix.compliance.domain.PageQuery;
import com.nisfix.compliance.domain.PageResult;
import com.nisfix.compliance.domain.relationship.Relationship;
import com.nisfix.compliance.domain.relationship.RelationshipStatus;
import com.nisfix.compliance.domain.relationship.SupplierClassification;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public interface RelationshipRepository {
    /**
     * Inserts a new relationship or updates an existing one.
     *
     * @throws com.nisfix.compliance.exception.ConcurrentUpdateException if the stored version moved on
     */
    Relationship save(Relationship relationship);

    Optional<Relationship> findById(UUID id);

    /** True when the company already has a pending, active or suspended relationship for the email. */
    boolean existsOpen(UUID companyId, String invitedEmail);

    PageResult<Relationship> listByCompany(UUID companyId, RelationshipStatus status,
                                           SupplierClassification classification, PageQuery page);

    List<Relationship> findPendingByEmail(String invitedEmail);

    Map<RelationshipStatus, Long> countByStatus(UUID companyId);

    Map<SupplierClassification, Long> countByClassification(UUID companyId);
}
