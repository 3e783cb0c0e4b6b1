package com.nisfix.compliance.infrastructure.outbox;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/** Reports the outbox backlog under {@code /actuator/health}. */
@Component("outbox")
public class OutboxHealthIndicator implements HealthIndicator {

    private final OutboxDispatcher dispatcher;

    public OutboxHealthIndicator(OutboxDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public Health health() {
        OutboxDispatcher.OutboxStats stats = dispatcher.getStats();
        Health.Builder builder = stats.dispatchEnabled() ? Health.up() : Health.unknown();
        return builder
                .withDetail("pendingEvents", stats.pendingEvents())
                .withDetail("processedEvents", stats.processedEvents())
                .withDetail("dispatchEnabled", stats.dispatchEnabled())
                .build();
    }
}
