package com.nisfix.compliance.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One immutable entry of a status history log.
 * {@code fromStatus} is null for the entry recorded at creation, {@code changedBy}
 * is null when the change was made by a system sweep.
 */
public final class StatusChange<S extends Enum<S>> {

    private final S fromStatus;
    private final S toStatus;
    private final UUID changedBy;
    private final String reason;
    private final OffsetDateTime changedAt;

    public StatusChange(S fromStatus, S toStatus, UUID changedBy, String reason, OffsetDateTime changedAt) {
        this.fromStatus = fromStatus;
        this.toStatus = toStatus;
        this.changedBy = changedBy;
        this.reason = reason;
        this.changedAt = changedAt;
    }

    public S getFromStatus() { return fromStatus; }
    public S getToStatus() { return toStatus; }
    public UUID getChangedBy() { return changedBy; }
    public String getReason() { return reason; }
    public OffsetDateTime getChangedAt() { return changedAt; }

    public boolean isSystemChange() {
        return changedBy == null;
    }

    @Override
    public String toString() {
        return "StatusChange{" + fromStatus + " -> " + toStatus + ", by=" + changedBy + ", at=" + changedAt + '}';
    }
}
