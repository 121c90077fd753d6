package com.creditapproval.service;

import com.creditapproval.config.KafkaTopics;
import com.creditapproval.event.CustomerRegistered;
import com.creditapproval.event.LoanApproved;
import com.creditapproval.event.LoanClosed;
import com.creditapproval.model.OutboxEvent;
import com.creditapproval.repository.OutboxEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes domain events to the outbox table inside the caller's transaction.
 *
 * The event row commits or rolls back together with the business change,
 * OutboxEventPublisher relays it to Kafka afterwards.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxWriter {

    static final String CUSTOMER_REGISTERED = "CustomerRegistered";
    static final String LOAN_APPROVED = "LoanApproved";
    static final String LOAN_CLOSED = "LoanClosed";

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public void customerRegistered(CustomerRegistered event) {
        save(event, event.eventId(), CUSTOMER_REGISTERED, KafkaTopics.CUSTOMER_REGISTERED);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void loanApproved(LoanApproved event) {
        save(event, event.eventId(), LOAN_APPROVED, KafkaTopics.LOAN_APPROVED);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void loanClosed(LoanClosed event) {
        save(event, event.eventId(), LOAN_CLOSED, KafkaTopics.LOAN_CLOSED);
    }

    private void save(Object event, String eventId, String eventType, String topic) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event for outbox: {}", eventId, e);
            throw new IllegalStateException("Failed to save event to outbox", e);
        }

        OutboxEvent outboxEvent = new OutboxEvent();
        outboxEvent.setEventId(eventId);
        outboxEvent.setEventType(eventType);
        outboxEvent.setPayload(payload);
        outboxEvent.setTopic(topic);

        outboxEventRepository.save(outboxEvent);
        log.info("Saved {} event to outbox: {}", eventType, eventId);
    }
}
