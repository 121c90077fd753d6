package com.creditapproval.engine;

import com.creditapproval.config.CreditPolicyProperties;
import com.creditapproval.model.Customer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Turns a credit score and a loan request into a decision.
 *
 * Score bands (defaults):
 * - score > 50: approve at the requested rate
 * - 30 < score <= 50: rate at least 12%
 * - 10 < score <= 30: rate at least 16%
 * - score <= 10: reject
 *
 * A rate below the band floor is raised to the floor, or rejected when rate
 * correction is disabled. After the band decision the income-burden check runs:
 * existing EMIs plus the new EMI may not exceed half the monthly income.
 */
@Component
@RequiredArgsConstructor
public class EligibilityResolver {

    private final CreditPolicyProperties policy;
    private final EmiCalculator emiCalculator;

    public EligibilityResult resolve(int score,
                                     BigDecimal requestedRate,
                                     BigDecimal principal,
                                     int tenureMonths,
                                     Customer customer,
                                     BigDecimal existingMonthlyEmiTotal) {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("Score must be within [0, 100]: " + score);
        }

        BigDecimal floor = bandFloor(score);
        BigDecimal rate = requestedRate;
        EligibilityDecision decision;

        if (floor == null) {
            decision = EligibilityDecision.REJECTED_BAND_FLOOR;
        } else if (requestedRate.compareTo(floor) >= 0) {
            decision = EligibilityDecision.APPROVED;
        } else if (policy.getRateCorrection() == RateCorrectionMode.CORRECT) {
            rate = floor;
            decision = EligibilityDecision.APPROVED_AT_CORRECTED_RATE;
        } else {
            rate = floor;
            decision = EligibilityDecision.REJECTED_RATE_MISMATCH;
        }

        BigDecimal emi = emiCalculator.computeEmi(principal, rate, tenureMonths);

        // Income burden overrides any band approval
        if (decision.isApproved()) {
            BigDecimal totalEmis = existingMonthlyEmiTotal.add(emi);
            BigDecimal maxBurden = customer.getMonthlyIncome().multiply(policy.getMaxIncomeBurdenRatio());
            if (totalEmis.compareTo(maxBurden) > 0) {
                decision = EligibilityDecision.REJECTED_INCOME_BURDEN;
            }
        }

        return new EligibilityResult(customer.getId(), score, requestedRate, rate, tenureMonths, emi, decision);
    }

    /**
     * Minimum rate for the band the score falls in; null when the band rejects outright.
     */
    private BigDecimal bandFloor(int score) {
        if (score > policy.getPrimeScoreThreshold()) {
            return BigDecimal.ZERO;
        }
        if (score > policy.getStandardScoreThreshold()) {
            return policy.getStandardMinRate();
        }
        if (score > policy.getSubprimeScoreThreshold()) {
            return policy.getSubprimeMinRate();
        }
        return null;
    }
}
