package com.nisfix.compliance.infrastructure.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nisfix.compliance.domain.ports.NotifierPort;
import com.nisfix.compliance.domain.requirement.RequirementStatus;
import com.nisfix.compliance.infrastructure.jpa.OutboxEventEntity;
import com.nisfix.compliance.infrastructure.jpa.SpringOutboxRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Queues notifications in the outbox table inside the caller's transaction.
 * {@link com.nisfix.compliance.infrastructure.outbox.OutboxDispatcher} delivers them.
 */
@Component
public class OutboxPublisherAdapter implements NotifierPort {

    public static final String MAGIC_LINK = "auth.magic_link";
    public static final String SUPPLIER_INVITATION = "relationship.invitation";
    public static final String REQUIREMENT_ASSIGNED = "requirement.assigned";
    public static final String REQUIREMENT_REMINDER = "requirement.reminder";
    public static final String REVIEW_OUTCOME = "requirement.reviewed";

    private static final Logger log = LoggerFactory.getLogger(OutboxPublisherAdapter.class);

    private final SpringOutboxRepository outbox;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OutboxPublisherAdapter(SpringOutboxRepository outbox, ObjectMapper objectMapper, Clock clock) {
        this.outbox = outbox;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void sendMagicLink(String email, String name, String url, OffsetDateTime expiresAt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", name);
        payload.put("url", url);
        payload.put("expiresAt", expiresAt.toString());
        publish(MAGIC_LINK, email, payload);
    }

    @Override
    public void sendSupplierInvitation(String email, String companyName, String url, OffsetDateTime expiresAt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("companyName", companyName);
        payload.put("url", url);
        payload.put("expiresAt", expiresAt.toString());
        publish(SUPPLIER_INVITATION, email, payload);
    }

    @Override
    public void sendRequirementAssigned(String email, UUID requirementId, String title, String companyName,
                                        OffsetDateTime dueDate) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requirementId", requirementId.toString());
        payload.put("title", title);
        payload.put("companyName", companyName);
        payload.put("dueDate", dueDate == null ? null : dueDate.toString());
        publish(REQUIREMENT_ASSIGNED, email, payload);
    }

    @Override
    public void sendRequirementReminder(String email, UUID requirementId, String title, OffsetDateTime dueDate) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requirementId", requirementId.toString());
        payload.put("title", title);
        payload.put("dueDate", dueDate == null ? null : dueDate.toString());
        publish(REQUIREMENT_REMINDER, email, payload);
    }

    @Override
    public void sendReviewOutcome(String email, UUID requirementId, String title, RequirementStatus outcome,
                                  String reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requirementId", requirementId.toString());
        payload.put("title", title);
        payload.put("outcome", outcome.name());
        payload.put("reason", reason);
        publish(REVIEW_OUTCOME, email, payload);
    }

    private void publish(String type, String recipient, Map<String, Object> payload) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + type + " payload", e);
        }
        OutboxEventEntity event = new OutboxEventEntity(UUID.randomUUID(), type, recipient, json,
                OffsetDateTime.now(clock));
        outbox.save(event);
        log.info("Queued outbox event - ID: {}, Type: {}", event.getEventId(), type);
    }
}
