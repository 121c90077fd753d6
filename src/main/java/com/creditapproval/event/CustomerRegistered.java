package com.creditapproval.event;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event published when a customer is registered and receives an approved limit.
 */
public record CustomerRegistered(
    String eventId,
    Long customerId,
    BigDecimal monthlyIncome,
    BigDecimal approvedLimit,
    Instant timestamp
) {
    public CustomerRegistered {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("Event ID cannot be null or empty");
        }
        if (customerId == null) {
            throw new IllegalArgumentException("Customer ID cannot be null");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
