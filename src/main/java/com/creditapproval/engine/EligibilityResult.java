package com.creditapproval.engine;

import java.math.BigDecimal;

/**
 * Result of an eligibility check. Not persisted: the caller either creates a
 * loan from it or discards it.
 *
 * @param customerId         customer the check ran for
 * @param score              credit score used for the decision
 * @param requestedRate      annual rate asked for
 * @param correctedRate      annual rate the decision applies; equals requestedRate when nothing was corrected
 * @param tenureMonths       requested tenure
 * @param monthlyInstallment EMI at the corrected rate
 * @param decision           outcome, including the rule that rejected the loan
 */
public record EligibilityResult(
    Long customerId,
    int score,
    BigDecimal requestedRate,
    BigDecimal correctedRate,
    int tenureMonths,
    BigDecimal monthlyInstallment,
    EligibilityDecision decision
) {
    public EligibilityResult {
        if (requestedRate == null || correctedRate == null) {
            throw new IllegalArgumentException("Rates cannot be null");
        }
        if (decision == null) {
            throw new IllegalArgumentException("Decision cannot be null");
        }
    }

    public boolean approved() {
        return decision.isApproved();
    }

    public boolean rateCorrected() {
        return correctedRate.compareTo(requestedRate) != 0;
    }
}
