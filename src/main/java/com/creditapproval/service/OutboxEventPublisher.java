package com.creditapproval.service;

import com.creditapproval.event.CustomerRegistered;
import com.creditapproval.event.LoanApproved;
import com.creditapproval.event.LoanClosed;
import com.creditapproval.model.OutboxEvent;
import com.creditapproval.producer.EventProducer;
import com.creditapproval.repository.OutboxEventRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * OUTBOX EVENT PUBLISHER
 * ======================
 *
 * Relays outbox rows to Kafka:
 * 1. Every 100ms, fetch up to BATCH_SIZE unpublished events (oldest first)
 * 2. Deserialize the payload into its event record
 * 3. Publish through EventProducer and wait for the broker acknowledgement
 * 4. Mark the row as published
 *
 * A failed publish increments the row's retry count and is retried on the
 * next poll. Delivery is at-least-once; consumers deduplicate on eventId.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxEventPublisher {

    private final OutboxEventRepository outboxEventRepository;
    private final EventProducer eventProducer;
    private final ObjectMapper objectMapper;

    private static final int BATCH_SIZE = 100;
    private static final int MAX_RETRY_COUNT = 10; // Escalate to ERROR after 10 failed attempts
    private static final long SEND_TIMEOUT_SECONDS = 10;
    private static final int MAX_ERROR_LENGTH = 2000;

    @Scheduled(fixedDelayString = "${credit.outbox.poll-interval-ms:100}")
    @Transactional
    public void publishEvents() {
        List<OutboxEvent> events = outboxEventRepository.findUnpublishedEventsWithLimit(BATCH_SIZE);

        if (events.isEmpty()) {
            return;
        }

        log.debug("Publishing {} outbox events", events.size());

        for (OutboxEvent event : events) {
            try {
                publishEvent(event);
            } catch (Exception e) {
                handlePublishError(event, e);
            }
        }
    }

    private void publishEvent(OutboxEvent outboxEvent) throws Exception {
        log.debug("Publishing event: {} (type: {})", outboxEvent.getEventId(), outboxEvent.getEventType());

        switch (outboxEvent.getEventType()) {
            case OutboxWriter.CUSTOMER_REGISTERED -> eventProducer.publishCustomerRegistered(
                    objectMapper.readValue(outboxEvent.getPayload(), CustomerRegistered.class))
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            case OutboxWriter.LOAN_APPROVED -> eventProducer.publishLoanApproved(
                    objectMapper.readValue(outboxEvent.getPayload(), LoanApproved.class))
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            case OutboxWriter.LOAN_CLOSED -> eventProducer.publishLoanClosed(
                    objectMapper.readValue(outboxEvent.getPayload(), LoanClosed.class))
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            default -> throw new IllegalArgumentException("Unknown event type: " + outboxEvent.getEventType());
        }

        outboxEvent.setPublished(true);
        outboxEvent.setPublishedAt(Instant.now());
        outboxEventRepository.save(outboxEvent);
    }

    private void handlePublishError(OutboxEvent event, Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        String message = String.valueOf(e.getMessage());
        event.setRetryCount(event.getRetryCount() + 1);
        event.setLastError(message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message);
        outboxEventRepository.save(event);

        if (event.getRetryCount() >= MAX_RETRY_COUNT) {
            log.error("Event {} has failed {} times. Manual intervention may be required. Error: {}",
                      event.getEventId(), event.getRetryCount(), message);
        } else {
            log.warn("Failed to publish event {} (attempt {}): {}",
                     event.getEventId(), event.getRetryCount(), message);
        }
    }

    /**
     * Report events that stayed unpublished for more than 5 minutes.
     */
    @Scheduled(fixedDelay = 60000)
    public void monitorStuckEvents() {
        Instant threshold = Instant.now().minusSeconds(300);
        List<OutboxEvent> stuckEvents = outboxEventRepository.findByPublishedFalseAndCreatedAtBefore(threshold);

        if (!stuckEvents.isEmpty()) {
            log.error("Found {} stuck events older than 5 minutes. Manual intervention may be required.",
                      stuckEvents.size());
            stuckEvents.forEach(event ->
                log.error("Stuck event: id={}, eventId={}, eventType={}, createdAt={}, retryCount={}, lastError={}",
                          event.getId(), event.getEventId(), event.getEventType(),
                          event.getCreatedAt(), event.getRetryCount(), event.getLastError())
            );
        }

        long queueSize = outboxEventRepository.countByPublishedFalse();
        if (queueSize > 1000) {
            log.warn("Outbox queue size is {}, which is high.", queueSize);
        } else {
            log.debug("Outbox queue size: {}", queueSize);
        }
    }
}
