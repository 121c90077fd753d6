package com.creditapproval.event;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event published when a loan passes the eligibility check and is persisted.
 *
 * requestedRate and interestRate differ when the rate was corrected up to the
 * floor of the customer's score band.
 */
public record LoanApproved(
    String eventId,
    Long loanId,
    Long customerId,
    BigDecimal principal,
    BigDecimal requestedRate,
    BigDecimal interestRate,
    int tenureMonths,
    BigDecimal monthlyInstallment,
    int creditScore,
    Instant timestamp
) {
    public LoanApproved {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("Event ID cannot be null or empty");
        }
        if (loanId == null) {
            throw new IllegalArgumentException("Loan ID cannot be null");
        }
        if (customerId == null) {
            throw new IllegalArgumentException("Customer ID cannot be null");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
