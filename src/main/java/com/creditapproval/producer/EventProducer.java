package com.creditapproval.producer;

import com.creditapproval.config.KafkaTopics;
import com.creditapproval.event.CustomerRegistered;
import com.creditapproval.event.LoanApproved;
import com.creditapproval.event.LoanClosed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes domain events to Kafka.
 *
 * Sends are asynchronous: the returned future completes when the broker
 * acknowledges. Events are keyed by customer id so one customer's events keep
 * their order on a single partition.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    public CompletableFuture<SendResult<String, Object>> publishCustomerRegistered(CustomerRegistered event) {
        return send(KafkaTopics.CUSTOMER_REGISTERED, String.valueOf(event.customerId()), event.eventId(), event);
    }

    public CompletableFuture<SendResult<String, Object>> publishLoanApproved(LoanApproved event) {
        return send(KafkaTopics.LOAN_APPROVED, String.valueOf(event.customerId()), event.eventId(), event);
    }

    public CompletableFuture<SendResult<String, Object>> publishLoanClosed(LoanClosed event) {
        return send(KafkaTopics.LOAN_CLOSED, String.valueOf(event.customerId()), event.eventId(), event);
    }

    private CompletableFuture<SendResult<String, Object>> send(String topic, String key, String eventId, Object event) {
        log.info("Publishing {} event: {}", event.getClass().getSimpleName(), eventId);

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish event {} to {}", eventId, topic, ex);
            } else {
                log.info("Successfully published event {} to {} partition {}",
                        eventId, topic, result.getRecordMetadata().partition());
            }
        });

        return future;
    }
}
