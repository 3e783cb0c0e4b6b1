package com.nisfix.compliance.domain.ports;

import com.nisfix.compliance.domain.requirement.RequirementStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Outgoing email notifications. Implementations must not fail the calling transaction for
 * delivery problems; they queue the message and deliver it later.
 */
public interface NotifierPort {

    void sendMagicLink(String email, String name, String url, OffsetDateTime expiresAt);

    void sendSupplierInvitation(String email, String companyName, String url, OffsetDateTime expiresAt);

    void sendRequirementAssigned(String email, UUID requirementId, String title, String companyName,
                                 OffsetDateTime dueDate);

    void sendRequirementReminder(String email, UUID requirementId, String title, OffsetDateTime dueDate);

    void sendReviewOutcome(String email, UUID requirementId, String title, RequirementStatus outcome,
                           String reason);
}
