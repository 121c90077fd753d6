package com.creditapproval.event;

import java.time.Instant;

/**
 * Event published when a loan is fully repaid or closed early.
 */
public record LoanClosed(
    String eventId,
    Long loanId,
    Long customerId,
    int installmentsPaid,
    int emisPaidOnTime,
    boolean repaidInFull,
    Instant timestamp
) {
    public LoanClosed {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("Event ID cannot be null or empty");
        }
        if (loanId == null) {
            throw new IllegalArgumentException("Loan ID cannot be null");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
