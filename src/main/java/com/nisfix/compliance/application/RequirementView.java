package com.nisfix.compliance.application;

import com.nisfix.compliance.domain.requirement.Requirement;

import java.time.OffsetDateTime;

/**
 * A requirement together with the values derived from the current time.
 */
public record RequirementView(Requirement requirement, boolean overdue, Integer daysUntilDue) {

    public static RequirementView of(Requirement requirement, OffsetDateTime now) {
        return new RequirementView(requirement, requirement.isOverdue(now), requirement.daysUntilDue(now));
    }
}
