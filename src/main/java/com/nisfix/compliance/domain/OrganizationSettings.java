package com.nisfix.compliance.domain;

/**
 * Per-organization preferences. {@code notificationsEnabled} controls the requirement emails
 * sent on behalf of a company.
 */
public record OrganizationSettings(int defaultDueDays,
                                   int reminderDaysBefore,
                                   boolean requireApproval,
                                   boolean notificationsEnabled) {

    public static OrganizationSettings defaults() {
        return new OrganizationSettings(30, 7, true, true);
    }
}
