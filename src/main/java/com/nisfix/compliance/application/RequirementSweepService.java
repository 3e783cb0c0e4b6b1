package com.nisfix.compliance.application;

import com.nisfix.compliance.config.AppProperties;
import com.nisfix.compliance.domain.ports.NotifierPort;
import com.nisfix.compliance.domain.ports.RelationshipRepository;
import com.nisfix.compliance.domain.ports.RequirementRepository;
import com.nisfix.compliance.domain.relationship.Relationship;
import com.nisfix.compliance.domain.requirement.Requirement;
import com.nisfix.compliance.exception.ComplianceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Batch jobs over open requirements. Both sweeps select their work by query filter, so running
 * them twice has no further effect.
 */
@Service
public class RequirementSweepService {

    private static final Logger log = LoggerFactory.getLogger(RequirementSweepService.class);

    private final RequirementRepository requirements;
    private final RelationshipRepository relationships;
    private final NotifierPort notifier;
    private final AppProperties props;
    private final TransactionTemplate tx;
    private final Clock clock;

    public RequirementSweepService(RequirementRepository requirements, RelationshipRepository relationships,
                                   NotifierPort notifier, AppProperties props, TransactionTemplate tx, Clock clock) {
        this.requirements = requirements;
        this.relationships = relationships;
        this.notifier = notifier;
        this.props = props;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * Expires pending and in-progress requirements whose due date has passed.
     *
     * @return number of requirements expired
     */
    public int expireOverdue() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<Requirement> overdue = requirements.findOverdue(now, props.getSweep().getBatchSize());
        int expired = 0;
        for (Requirement requirement : overdue) {
            try {
                requirement.expire(now);
                requirements.save(requirement);
                expired++;
            } catch (ComplianceException | OptimisticLockingFailureException e) {
                // moved on since it was selected, e.g. submitted by the supplier
                log.warn("Skipped expiring requirement {}: {}", requirement.getId(), e.getMessage());
            }
        }
        if (expired > 0) {
            log.info("Expired {} overdue requirements", expired);
        }
        return expired;
    }

    /**
     * Sends one reminder for each open requirement due within the reminder horizon. The reminder
     * is queued and recorded in one transaction; if another sweep recorded it first the queued
     * message is rolled back.
     *
     * @return number of reminders sent
     */
    public int sendReminders() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime horizon = now.plusDays(props.getSweep().getReminderDaysBefore());
        List<Requirement> candidates = requirements.findReminderCandidates(now, horizon,
                props.getSweep().getBatchSize());
        int sent = 0;
        for (Requirement requirement : candidates) {
            String recipient = relationships.findById(requirement.getRelationshipId())
                    .map(Relationship::getInvitedEmail)
                    .orElse(null);
            if (recipient == null) {
                log.warn("No recipient for reminder of requirement {}", requirement.getId());
                continue;
            }
            Boolean recorded = tx.execute(status -> {
                notifier.sendRequirementReminder(recipient, requirement.getId(), requirement.getTitle(),
                        requirement.getDueDate());
                if (!requirements.markReminderSent(requirement.getId(), now)) {
                    status.setRollbackOnly();
                    return false;
                }
                return true;
            });
            if (Boolean.TRUE.equals(recorded)) {
                sent++;
            } else {
                log.debug("Reminder for requirement {} already recorded", requirement.getId());
            }
        }
        if (sent > 0) {
            log.info("Sent {} requirement reminders", sent);
        }
        return sent;
    }
}
