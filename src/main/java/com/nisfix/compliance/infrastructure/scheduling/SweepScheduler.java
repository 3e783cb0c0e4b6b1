package com.nisfix.compliance.infrastructure.scheduling;

import com.nisfix.compliance.application.RequirementSweepService;
import com.nisfix.compliance.application.TokenIssuer;
import com.nisfix.compliance.config.AppProperties;
import com.nisfix.compliance.infrastructure.outbox.OutboxDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic maintenance jobs. Each job is switched off through {@code app.sweep.*}.
 */
@Component
public class SweepScheduler {
    private static final Logger log = LoggerFactory.getLogger(SweepScheduler.class);

    private final RequirementSweepService sweeps;
    private final TokenIssuer tokenIssuer;
    private final OutboxDispatcher outbox;
    private final AppProperties props;

    public SweepScheduler(RequirementSweepService sweeps, TokenIssuer tokenIssuer, OutboxDispatcher outbox,
                          AppProperties props) {
        this.sweeps = sweeps;
        this.tokenIssuer = tokenIssuer;
        this.outbox = outbox;
        this.props = props;
    }

    @Scheduled(cron = "${app.sweep.expiry-cron:0 0 * * * *}")
    public void expireOverdueRequirements() {
        if (!props.getSweep().isExpiryEnabled()) {
            return;
        }
        int expired = sweeps.expireOverdue();
        log.debug("Expiry sweep finished, {} requirements expired", expired);
    }

    @Scheduled(cron = "${app.sweep.reminder-cron:0 0 8 * * *}")
    public void sendDueDateReminders() {
        if (!props.getSweep().isReminderEnabled()) {
            return;
        }
        int sent = sweeps.sendReminders();
        log.debug("Reminder sweep finished, {} reminders queued", sent);
    }

    @Scheduled(cron = "${app.sweep.retention-cron:0 30 3 * * *}")
    public void purgeStaleRecords() {
        if (!props.getSweep().isRetentionEnabled()) {
            return;
        }
        try {
            tokenIssuer.purgeExpired();
            outbox.purgeProcessed(props.getSweep().getOutboxRetentionDays());
        } catch (RuntimeException e) {
            log.error("Retention sweep failed: {}", e.getMessage(), e);
        }
    }
}
