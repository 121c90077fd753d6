package com.creditapproval.dto;

import com.creditapproval.engine.EligibilityResult;
import com.creditapproval.model.LoanRecord;

import java.math.BigDecimal;

/**
 * Outcome of a loan creation request: the created loan, or the rejection.
 *
 * @param loanId             id of the new loan, null when rejected
 * @param monthlyInstallment EMI of the new loan, null when rejected
 * @param eligibility        the decision the outcome is based on
 */
public record LoanCreationResult(
    Long loanId,
    Long customerId,
    boolean loanApproved,
    String message,
    BigDecimal monthlyInstallment,
    EligibilityResult eligibility
) {
    public static LoanCreationResult approved(LoanRecord loan, EligibilityResult eligibility) {
        return new LoanCreationResult(loan.getId(), loan.getCustomerId(), true,
                "Loan approved successfully.", loan.getMonthlyInstallment(), eligibility);
    }

    public static LoanCreationResult rejected(EligibilityResult eligibility) {
        return new LoanCreationResult(null, eligibility.customerId(), false,
                rejectionMessage(eligibility), null, eligibility);
    }

    private static String rejectionMessage(EligibilityResult eligibility) {
        return switch (eligibility.decision()) {
            case REJECTED_BAND_FLOOR -> "Loan not approved: credit score too low.";
            case REJECTED_RATE_MISMATCH -> "Loan not approved: interest rate must be at least "
                    + eligibility.correctedRate() + "%.";
            case REJECTED_INCOME_BURDEN -> "Loan not approved: total EMIs would exceed half of monthly income.";
            case APPROVED, APPROVED_AT_CORRECTED_RATE ->
                    throw new IllegalArgumentException("Eligibility result is an approval");
        };
    }
}
