package com.nisfix.compliance.domain.ports;

import com.nisfix.compliance.domain.PageQuery;
import com.nisfix.compliance.domain.PageResult;
import com.nisfix.compliance.domain.requirement.Requirement;
import com.nisfix.compliance.domain.requirement.RequirementStatus;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public interface RequirementRepository {
    Requirement save(Requirement requirement);

    Optional<Requirement> findById(UUID id);

    PageResult<Requirement> listByCompany(UUID companyId, RequirementStatus status, UUID relationshipId,
                                          PageQuery page);

    PageResult<Requirement> listBySupplier(UUID supplierId, RequirementStatus status, PageQuery page);

    Map<RequirementStatus, Long> countByStatus(UUID companyId);

    long countOverdue(UUID companyId, OffsetDateTime now);

    /** Open requirements whose due date lies before {@code now}. */
    List<Requirement> findOverdue(OffsetDateTime now, int limit);

    /** Open requirements due within {@code [now, horizon]} that have not been reminded yet. */
    List<Requirement> findReminderCandidates(OffsetDateTime now, OffsetDateTime horizon, int limit);

    /**
     * Sets {@code reminderSentAt} only if it is still unset.
     *
     * @return false when the reminder was already recorded
     */
    boolean markReminderSent(UUID requirementId, OffsetDateTime at);
}
