package com.creditapproval.engine;

/**
 * Outcome of a single eligibility decision.
 */
public enum EligibilityDecision {
    APPROVED(true),                    // Approved at the requested rate
    APPROVED_AT_CORRECTED_RATE(true),  // Requested rate raised to the band floor
    REJECTED_BAND_FLOOR(false),        // Score too low for any loan
    REJECTED_RATE_MISMATCH(false),     // Requested rate below band floor, correction disabled
    REJECTED_INCOME_BURDEN(false);     // All EMIs together would exceed the income share

    private final boolean approved;

    EligibilityDecision(boolean approved) {
        this.approved = approved;
    }

    public boolean isApproved() {
        return approved;
    }
}
