package com.nisfix.compliance.infrastructure.adapters;

import com.nisfix.compliance.domain.PageQuery;
import com.nisfix.compliance.domain.PageResult;
import com.nisfix.compliance.domain.ports.RelationshipRepository;
import com.nisfix.compliance.domain.relationship.Relationship;
import com.nisfix.compliance.domain.relationship.RelationshipStatus;
import com.nisfix.compliance.domain.relationship.SupplierClassification;
import com.nisfix.compliance.exception.ConcurrentUpdateException;
import com.nisfix.compliance.infrastructure.jpa.RelationshipEntity;
import com.nisfix.compliance.infrastructure.jpa.SpringRelationshipRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Component
@Transactional
public class JpaRelationshipRepositoryAdapter implements RelationshipRepository {
    private static final List<String> OPEN_STATUSES = List.of(
            RelationshipStatus.PENDING.name(), RelationshipStatus.ACTIVE.name(), RelationshipStatus.SUSPENDED.name());

    private final SpringRelationshipRepository relationships;

    public JpaRelationshipRepositoryAdapter(SpringRelationshipRepository relationships) {
        this.relationships = relationships;
    }

    @Override
    public Relationship save(Relationship r) {
        RelationshipEntity e = relationships.findById(r.getId()).orElseGet(RelationshipEntity::new);
        if (e.getVersion() != null && e.getVersion() != r.getVersion()) {
            throw new ConcurrentUpdateException("relationship " + r.getId() + " was modified concurrently");
        }
        e.setId(r.getId());
        e.setCompanyId(r.getCompanyId());
        e.setSupplierId(r.getSupplierId());
        e.setInvitedEmail(r.getInvitedEmail());
        e.setInvitedByUserId(r.getInvitedByUserId());
        e.setStatus(r.getStatus().name());
        e.setClassification(r.getClassification().name());
        e.setNotes(r.getNotes());
        e.setServicesProvided(new ArrayList<>(r.getServicesProvided()));
        e.setContractRef(r.getContractRef());
        e.setInvitedAt(r.getInvitedAt());
        e.setAcceptedAt(r.getAcceptedAt());
        e.setDeclinedAt(r.getDeclinedAt());
        e.setTerminatedAt(r.getTerminatedAt());
        StatusHistoryMapper.appendNew(e.getStatusHistory(), r.getStatusHistory());
        e.setCreatedAt(r.getCreatedAt());
        e.setUpdatedAt(r.getUpdatedAt());
        return toDomain(relationships.saveAndFlush(e));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Relationship> findById(UUID id) {
        return relationships.findById(id).map(JpaRelationshipRepositoryAdapter::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsOpen(UUID companyId, String invitedEmail) {
        return relationships.existsByCompanyIdAndInvitedEmailAndStatusIn(companyId, invitedEmail, OPEN_STATUSES);
    }

    @Override
    @Transactional(readOnly = true)
    public PageResult<Relationship> listByCompany(UUID companyId, RelationshipStatus status,
                                                  SupplierClassification classification, PageQuery page) {
        Page<RelationshipEntity> result = relationships.search(companyId, StatusHistoryMapper.name(status),
                StatusHistoryMapper.name(classification),
                PageRequest.of(page.page() - 1, page.limit(), Sort.by(Sort.Direction.DESC, "createdAt")));
        return PageResult.of(result.getContent().stream().map(JpaRelationshipRepositoryAdapter::toDomain).toList(),
                result.getTotalElements(), page);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Relationship> findPendingByEmail(String invitedEmail) {
        return relationships.findByInvitedEmailAndStatusOrderByCreatedAtDesc(invitedEmail,
                        RelationshipStatus.PENDING.name())
                .stream().map(JpaRelationshipRepositoryAdapter::toDomain).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Map<RelationshipStatus, Long> countByStatus(UUID companyId) {
        Map<RelationshipStatus, Long> counts = new EnumMap<>(RelationshipStatus.class);
        for (RelationshipStatus s : RelationshipStatus.values()) counts.put(s, 0L);
        for (Object[] row : relationships.countByStatus(companyId)) {
            counts.put(RelationshipStatus.valueOf((String) row[0]), ((Number) row[1]).longValue());
        }
        return counts;
    }

    @Override
    @Transactional(readOnly = true)
    public Map<SupplierClassification, Long> countByClassification(UUID companyId) {
        Map<SupplierClassification, Long> counts = new EnumMap<>(SupplierClassification.class);
        for (SupplierClassification c : SupplierClassification.values()) counts.put(c, 0L);
        for (Object[] row : relationships.countByClassification(companyId)) {
            counts.put(SupplierClassification.valueOf((String) row[0]), ((Number) row[1]).longValue());
        }
        return counts;
    }

    private static Relationship toDomain(RelationshipEntity e) {
        return new Relationship(e.getId(), e.getCompanyId(), e.getSupplierId(), e.getInvitedEmail(),
                e.getInvitedByUserId(), RelationshipStatus.valueOf(e.getStatus()),
                SupplierClassification.valueOf(e.getClassification()), e.getNotes(), e.getServicesProvided(),
                e.getContractRef(), e.getInvitedAt(), e.getAcceptedAt(), e.getDeclinedAt(), e.getTerminatedAt(),
                StatusHistoryMapper.toDomain(e.getStatusHistory(), RelationshipStatus.class),
                e.getCreatedAt(), e.getUpdatedAt(), e.getVersion() == null ? 0L : e.getVersion());
    }
}
