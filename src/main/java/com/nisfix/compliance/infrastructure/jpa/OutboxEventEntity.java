package com.nisfix.compliance.infrastructure.jpa;

import jakarta.persistence.*;
import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "outbox")
public class OutboxEventEntity {
    @Id
    @Column(name = "event_id")
    private UUID eventId;

    @Column(nullable = false, length = 64)
    private String type;

    @Column(nullable = false, length = 320)
    private String recipient;

    @Column(name = "payload_json", nullable = false, length = 8000)
    private String payloadJson;

    @Column(name = "occurred_at", nullable = false)
    private OffsetDateTime occurredAt;

    @Column(name = "processed_at")
    private OffsetDateTime processedAt;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    public OutboxEventEntity() {}

    public OutboxEventEntity(UUID eventId, String type, String recipient, String payloadJson,
                             OffsetDateTime occurredAt) {
        this.eventId = eventId;
        this.type = type;
        this.recipient = recipient;
        this.payloadJson = payloadJson;
        this.occurredAt = occurredAt;
    }

    public UUID getEventId() { return eventId; }
    public void setEventId(UUID eventId) { this.eventId = eventId; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public String getRecipient() { return recipient; }
    public void setRecipient(String recipient) { this.recipient = recipient; }

    public String getPayloadJson() { return payloadJson; }
    public void setPayloadJson(String payloadJson) { this.payloadJson = payloadJson; }

    public OffsetDateTime getOccurredAt() { return occurredAt; }
    public void setOccurredAt(OffsetDateTime occurredAt) { this.occurredAt = occurredAt; }

    public OffsetDateTime getProcessedAt() { return processedAt; }
    public void setProcessedAt(OffsetDateTime processedAt) { this.processedAt = processedAt; }

    public int getAttempts() { return attempts; }
    public void setAttempts(int attempts) { this.attempts = attempts; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }

    public boolean isProcessed() {
        return processedAt != null;
    }

    public void markAsProcessed(OffsetDateTime at) {
        this.processedAt = at;
    }

    public void recordFailure(String error) {
        this.attempts++;
        this.lastError = error == null ? null : error.substring(0, Math.min(error.length(), 1000));
    }

    @Override
    public String toString() {
        return "OutboxEventEntity{" +
                "eventId=" + eventId +
                ", type='" + type + '\'' +
                ", occurredAt=" + occurredAt +
                ", processedAt=" + processedAt +
                ", attempts=" + attempts +
                '}';
    }
}
