package com.nisfix.compliance.domain.relationship;

/**
 * Lifecycle of a company-supplier relationship.
 *
 * <p>Valid transitions:
 * <ul>
 *   <li>PENDING → ACTIVE (supplier accepts the invitation)
 *   <li>PENDING → DECLINED (supplier declines the invitation)
 *   <li>ACTIVE → SUSPENDED
 *   <li>SUSPENDED → ACTIVE (reactivation)
 *   <li>ACTIVE, SUSPENDED → TERMINATED
 * </ul>
 * DECLINED and TERMINATED are terminal.
 */
public enum RelationshipStatus {
    PENDING,
    ACTIVE,
    SUSPENDED,
    TERMINATED,
    DECLINED;

    public boolean canTransitionTo(RelationshipStatus target) {
        return switch (this) {
            case PENDING -> target == ACTIVE || target == DECLINED;
            case ACTIVE -> target == SUSPENDED || target == TERMINATED;
            case SUSPENDED -> target == ACTIVE || target == TERMINATED;
            case TERMINATED, DECLINED -> false;
        };
    }

    public boolean isTerminal() {
        return this == TERMINATED || this == DECLINED;
    }
}
