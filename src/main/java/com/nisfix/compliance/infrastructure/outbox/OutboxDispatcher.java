package com.nisfix.compliance.infrastructure.outbox;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nisfix.compliance.infrastructure.adapters.OutboxPublisherAdapter;
import com.nisfix.compliance.infrastructure.jpa.OutboxEventEntity;
import com.nisfix.compliance.infrastructure.jpa.SpringOutboxRepository;
import com.nisfix.compliance.infrastructure.notify.Mailer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

@Component
public class OutboxDispatcher {
  private static final Logger log = LoggerFactory.getLogger(OutboxDispatcher.class);
  private static final TypeReference<Map<String, Object>> PAYLOAD = new TypeReference<>() { };

  private final SpringOutboxRepository repo;
  private final ObjectMapper objectMapper;
  private final Mailer mailer;
  private final Clock clock;
  private final boolean enableDispatch;
  private final int batchSize;
  private final int maxAttempts;

  public OutboxDispatcher(
          SpringOutboxRepository repo,
          ObjectMapper objectMapper,
          Mailer mailer,
          Clock clock,
          @Value("${app.outbox.enabled:true}") boolean enableDispatch,
          @Value("${app.outbox.batch-size:50}") int batchSize,
          @Value("${app.outbox.max-attempts:5}") int maxAttempts) {
    this.repo = repo;
    this.objectMapper = objectMapper;
    this.mailer = mailer;
    this.clock = clock;
    this.enableDispatch = enableDispatch;
    this.batchSize = batchSize;
    this.maxAttempts = maxAttempts;

    log.info("OutboxDispatcher initialized - enabled: {}, batchSize: {}, maxAttempts: {}",
            enableDispatch, batchSize, maxAttempts);
  }

  @Scheduled(fixedDelayString = "${app.outbox.poll-ms:5000}")
  @Transactional
  public void dispatch() {
    if (!enableDispatch) {
      log.debug("Outbox dispatch is disabled");
      return;
    }
    dispatchPending();
  }

  /**
   * Delivers one batch of pending events. Failed events stay pending with an attempt count
   * and are skipped once they reach the attempt limit.
   *
   * @return number of events delivered
   */
  @Transactional
  public int dispatchPending() {
    List<OutboxEventEntity> batch = repo.findPending(maxAttempts, PageRequest.of(0, batchSize));
    if (batch.isEmpty()) {
      log.trace("No outbox events to process");
      return 0;
    }

    log.info("Processing {} outbox events", batch.size());
    int delivered = 0;
    for (OutboxEventEntity event : batch) {
      try {
        processEvent(event);
        event.markAsProcessed(OffsetDateTime.now(clock));
        delivered++;
        log.debug("Successfully processed outbox event: {}", event.getEventId());
      } catch (Exception e) {
        event.recordFailure(e.getMessage());
        log.error("Failed to process outbox event {} (attempt {}): {}",
                event.getEventId(), event.getAttempts(), e.getMessage(), e);
      }
      repo.save(event);
    }
    return delivered;
  }

  private void processEvent(OutboxEventEntity event) throws Exception {
    Map<String, Object> payload = objectMapper.readValue(event.getPayloadJson(), PAYLOAD);

    switch (event.getType()) {
      case OutboxPublisherAdapter.MAGIC_LINK -> mailer.send(event.getRecipient(),
              "Your sign-in link",
              "Hello " + payload.get("name") + ",\n\nUse this link to sign in: " + payload.get("url")
                      + "\nIt expires at " + payload.get("expiresAt") + " and can only be used once.");
      case OutboxPublisherAdapter.SUPPLIER_INVITATION -> mailer.send(event.getRecipient(),
              payload.get("companyName") + " invited you as a supplier",
              "You have been invited to share compliance information with " + payload.get("companyName")
                      + ".\n\nAccept the invitation: " + payload.get("url")
                      + "\nThe link expires at " + payload.get("expiresAt") + ".");
      case OutboxPublisherAdapter.REQUIREMENT_ASSIGNED -> mailer.send(event.getRecipient(),
              "New compliance requirement: " + payload.get("title"),
              payload.get("companyName") + " assigned you the requirement \"" + payload.get("title") + "\""
                      + (payload.get("dueDate") == null ? "." : ", due " + payload.get("dueDate") + "."));
      case OutboxPublisherAdapter.REQUIREMENT_REMINDER -> mailer.send(event.getRecipient(),
              "Reminder: " + payload.get("title") + " is due soon",
              "The requirement \"" + payload.get("title") + "\" is due " + payload.get("dueDate") + ".");
      case OutboxPublisherAdapter.REVIEW_OUTCOME -> mailer.send(event.getRecipient(),
              "Requirement " + payload.get("title") + ": " + payload.get("outcome"),
              "Your response to \"" + payload.get("title") + "\" was reviewed. Outcome: " + payload.get("outcome")
                      + (payload.get("reason") == null ? "" : "\nReason: " + payload.get("reason")));
      default -> log.warn("Unknown event type: {} for event {}", event.getType(), event.getEventId());
    }
  }

  /** Deletes delivered events older than the retention period. */
  @Transactional
  public int purgeProcessed(int retentionDays) {
    int deleted = repo.deleteProcessedBefore(OffsetDateTime.now(clock).minusDays(retentionDays));
    if (deleted > 0) {
      log.info("Deleted {} processed outbox events older than {} days", deleted, retentionDays);
    }
    return deleted;
  }

  // Statistics for monitoring
  public OutboxStats getStats() {
    long pending = repo.countByProcessedAtIsNull();
    long processed = repo.countByProcessedAtIsNotNull();

    return new OutboxStats(pending, processed, enableDispatch);
  }

  public record OutboxStats(long pendingEvents, long processedEvents, boolean dispatchEnabled) {}
}
