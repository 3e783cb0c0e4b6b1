package com.nisfix.compliance.infrastructure.adapters;

import com.nisfix.compliance.domain.PageQuery;
import com.nisfix.compliance.domain.PageResult;
import com.nisfix.compliance.domain.ports.RequirementRepository;
import com.nisfix.compliance.domain.requirement.Priority;
import com.nisfix.compliance.domain.requirement.ReportGrade;
import com.nisfix.compliance.domain.requirement.Requirement;
import com.nisfix.compliance.domain.requirement.RequirementStatus;
import com.nisfix.compliance.domain.requirement.RequirementType;
import com.nisfix.compliance.exception.ConcurrentUpdateException;
import com.nisfix.compliance.infrastructure.jpa.RequirementEntity;
import com.nisfix.compliance.infrastructure.jpa.SpringRequirementRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Component
@Transactional
public class JpaRequirementRepositoryAdapter implements RequirementRepository {
    private static final List<String> OPEN_STATUSES = RequirementStatus.OPEN.stream().map(Enum::name).toList();
    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final SpringRequirementRepository requirements;

    public JpaRequirementRepositoryAdapter(SpringRequirementRepository requirements) {
        this.requirements = requirements;
    }

    /**
     * {@code reminderSentAt} is written on insert only; afterwards it is owned by
     * {@link #markReminderSent} so a concurrent review never clears a recorded reminder.
     */
    @Override
    public Requirement save(Requirement r) {
        Optional<RequirementEntity> existing = requirements.findById(r.getId());
        RequirementEntity e = existing.orElseGet(RequirementEntity::new);
        if (existing.isPresent()) {
            if (e.getVersion() != null && e.getVersion() != r.getVersion()) {
                throw new ConcurrentUpdateException("requirement " + r.getId() + " was modified concurrently");
            }
        } else {
            e.setId(r.getId());
            e.setRelationshipId(r.getRelationshipId());
            e.setCompanyId(r.getCompanyId());
            e.setSupplierId(r.getSupplierId());
            e.setType(r.getType().name());
            e.setQuestionnaireId(r.getQuestionnaireId());
            e.setAssignedByUserId(r.getAssignedByUserId());
            e.setAssignedAt(r.getAssignedAt());
            e.setCreatedAt(r.getCreatedAt());
            e.setReminderSentAt(r.getReminderSentAt());
        }
        e.setTitle(r.getTitle());
        e.setDescription(r.getDescription());
        e.setPriority(r.getPriority().name());
        e.setPassingScore(r.getPassingScore());
        e.setMinimumGrade(StatusHistoryMapper.name(r.getMinimumGrade()));
        e.setMaxReportAgeDays(r.getMaxReportAgeDays());
        e.setDueDate(r.getDueDate());
        e.setStatus(r.getStatus().name());
        StatusHistoryMapper.appendNew(e.getStatusHistory(), r.getStatusHistory());
        e.setUpdatedAt(r.getUpdatedAt());
        return toDomain(requirements.saveAndFlush(e));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Requirement> findById(UUID id) {
        return requirements.findById(id).map(JpaRequirementRepositoryAdapter::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public PageResult<Requirement> listByCompany(UUID companyId, RequirementStatus status, UUID relationshipId,
                                                 PageQuery page) {
        Page<RequirementEntity> result = requirements.searchByCompany(companyId, StatusHistoryMapper.name(status),
                relationshipId, PageRequest.of(page.page() - 1, page.limit(), NEWEST_FIRST));
        return toPage(result, page);
    }

    @Override
    @Transactional(readOnly = true)
    public PageResult<Requirement> listBySupplier(UUID supplierId, RequirementStatus status, PageQuery page) {
        Page<RequirementEntity> result = requirements.searchBySupplier(supplierId, StatusHistoryMapper.name(status),
                PageRequest.of(page.page() - 1, page.limit(), NEWEST_FIRST));
        return toPage(result, page);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<RequirementStatus, Long> countByStatus(UUID companyId) {
        Map<RequirementStatus, Long> counts = new EnumMap<>(RequirementStatus.class);
        for (RequirementStatus s : RequirementStatus.values()) counts.put(s, 0L);
        for (Object[] row : requirements.countByStatus(companyId)) {
            counts.put(RequirementStatus.valueOf((String) row[0]), ((Number) row[1]).longValue());
        }
        return counts;
    }

    @Override
    @Transactional(readOnly = true)
    public long countOverdue(UUID companyId, OffsetDateTime now) {
        return requirements.countByCompanyIdAndStatusInAndDueDateBefore(companyId, OPEN_STATUSES, now);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Requirement> findOverdue(OffsetDateTime now, int limit) {
        return requirements.findOverdue(OPEN_STATUSES, now, PageRequest.of(0, limit))
                .stream().map(JpaRequirementRepositoryAdapter::toDomain).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Requirement> findReminderCandidates(OffsetDateTime now, OffsetDateTime horizon, int limit) {
        return requirements.findReminderCandidates(OPEN_STATUSES, now, horizon, PageRequest.of(0, limit))
                .stream().map(JpaRequirementRepositoryAdapter::toDomain).toList();
    }

    @Override
    public boolean markReminderSent(UUID requirementId, OffsetDateTime at) {
        return requirements.markReminderSent(requirementId, at) == 1;
    }

    private static PageResult<Requirement> toPage(Page<RequirementEntity> result, PageQuery page) {
        return PageResult.of(result.getContent().stream().map(JpaRequirementRepositoryAdapter::toDomain).toList(),
                result.getTotalElements(), page);
    }

    private static Requirement toDomain(RequirementEntity e) {
        return new Requirement(e.getId(), e.getRelationshipId(), e.getCompanyId(), e.getSupplierId(),
                RequirementType.valueOf(e.getType()), e.getTitle(), e.getDescription(),
                Priority.valueOf(e.getPriority()), e.getQuestionnaireId(), e.getPassingScore(),
                e.getMinimumGrade() == null ? null : ReportGrade.valueOf(e.getMinimumGrade()),
                e.getMaxReportAgeDays(), e.getDueDate(), e.getReminderSentAt(),
                RequirementStatus.valueOf(e.getStatus()),
                StatusHistoryMapper.toDomain(e.getStatusHistory(), RequirementStatus.class),
                e.getAssignedByUserId(), e.getAssignedAt(), e.getCreatedAt(), e.getUpdatedAt(),
                e.getVersion() == null ? 0L : e.getVersion());
    }
}
