package com.creditapproval.dto;

import com.creditapproval.exception.InvalidLoanRequestException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A customer's request for a new loan. Validated on construction, so every
 * service receives a well-formed request.
 *
 * Amount and rate are rounded half-up to two decimals on construction, the
 * scale loan records store them at, so the EMI is always computed from the
 * stored values.
 */
public record LoanRequest(
    Long customerId,
    BigDecimal principal,      // Amount asked for
    BigDecimal interestRate,   // Annual percentage rate asked for
    int tenureMonths
) {
    // Largest values the loan_records columns hold: numeric(14,2) and numeric(5,2)
    public static final BigDecimal MAX_PRINCIPAL = new BigDecimal("999999999999.99");
    public static final BigDecimal MAX_INTEREST_RATE = new BigDecimal("999.99");

    private static final int SCALE = 2;

    public LoanRequest {
        if (customerId == null) {
            throw new InvalidLoanRequestException("Customer ID is required");
        }
        if (principal == null || principal.signum() <= 0) {
            throw new InvalidLoanRequestException("Loan amount must be positive");
        }
        if (interestRate == null || interestRate.signum() < 0) {
            throw new InvalidLoanRequestException("Interest rate must not be negative");
        }
        if (tenureMonths <= 0) {
            throw new InvalidLoanRequestException("Tenure must be a positive number of months");
        }
        principal = principal.setScale(SCALE, RoundingMode.HALF_UP);
        interestRate = interestRate.setScale(SCALE, RoundingMode.HALF_UP);
        if (principal.signum() == 0) {
            throw new InvalidLoanRequestException("Loan amount must be at least 0.01");
        }
        if (principal.compareTo(MAX_PRINCIPAL) > 0) {
            throw new InvalidLoanRequestException("Loan amount must not exceed " + MAX_PRINCIPAL);
        }
        if (interestRate.compareTo(MAX_INTEREST_RATE) > 0) {
            throw new InvalidLoanRequestException("Interest rate must not exceed " + MAX_INTEREST_RATE + "%");
        }
    }
}
