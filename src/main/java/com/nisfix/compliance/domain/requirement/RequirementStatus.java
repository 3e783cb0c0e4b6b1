package com.nisfix.compliance.domain.requirement;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a requirement assigned to a supplier.
 *
 * <p>Valid transitions:
 * <ul>
 *   <li>PENDING → IN_PROGRESS (supplier starts), EXPIRED (due date passed)
 *   <li>IN_PROGRESS → SUBMITTED (supplier submits), EXPIRED (due date passed)
 *   <li>SUBMITTED → APPROVED, REJECTED, REVISION_REQUESTED (company review)
 *   <li>REVISION_REQUESTED → IN_PROGRESS (supplier reworks the response)
 * </ul>
 * APPROVED, REJECTED and EXPIRED are terminal.
 */
public enum RequirementStatus {
    PENDING,
    IN_PROGRESS,
    SUBMITTED,
    APPROVED,
    REJECTED,
    REVISION_REQUESTED,
    EXPIRED;

    /** Statuses the expiry and reminder sweeps look at. */
    public static final Set<RequirementStatus> OPEN = EnumSet.of(PENDING, IN_PROGRESS);

    public boolean canTransitionTo(RequirementStatus target) {
        return switch (this) {
            case PENDING -> target == IN_PROGRESS || target == EXPIRED;
            case IN_PROGRESS -> target == SUBMITTED || target == EXPIRED;
            case SUBMITTED -> target == APPROVED || target == REJECTED || target == REVISION_REQUESTED;
            case REVISION_REQUESTED -> target == IN_PROGRESS;
            case APPROVED, REJECTED, EXPIRED -> false;
        };
    }

    public boolean isTerminal() {
        return this == APPROVED || this == REJECTED || this == EXPIRED;
    }
}
