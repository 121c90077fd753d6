package com.creditapproval.engine;

import com.creditapproval.config.ScoringWeights;
import com.creditapproval.model.Customer;
import com.creditapproval.model.LoanRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Credit score (0-100) from a customer's loan history and current exposure.
 *
 * Components, each normalized to [0, 100] before weighting:
 * - PAYMENT_HISTORY: installments paid on time over installments due (tenure) of all loans
 * - LOAN_COUNT: fewer loans taken scores higher
 * - CURRENT_ACTIVITY: fewer loans started this calendar year scores higher
 * - VOLUME: lower active principal relative to the approved limit scores higher
 *
 * A customer whose active principal exceeds the approved limit scores 0,
 * whatever the components say.
 */
@Component
@Slf4j
public class CreditScoreEstimator {

    private static final int RATIO_SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ScoringWeights weights;
    private final Clock clock;

    public CreditScoreEstimator(ScoringWeights weights, Clock clock) {
        if (weights.total() != 100) {
            throw new IllegalStateException("Score weights must sum to 100, got " + weights.total());
        }
        if (weights.getPaymentHistory() < 0 || weights.getLoanCount() < 0
                || weights.getCurrentActivity() < 0 || weights.getVolume() < 0) {
            throw new IllegalStateException("Score weights must not be negative");
        }
        this.weights = weights;
        this.clock = clock;
    }

    /**
     * @param customer     the borrower (for the approved limit)
     * @param loanHistory  all loans of the customer, active and closed
     * @param currentLoans the customer's active loans
     */
    public ScoreBreakdown computeScore(Customer customer, List<LoanRecord> loanHistory, List<LoanRecord> currentLoans) {
        BigDecimal activePrincipal = currentLoans.stream()
                .map(LoanRecord::getPrincipal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal approvedLimit = customer.getApprovedLimit();

        List<ScoreComponent> components = List.of(
                paymentHistory(loanHistory),
                loanCount(loanHistory),
                currentActivity(loanHistory),
                volume(activePrincipal, approvedLimit));

        int weightedSum = components.stream()
                .mapToInt(component -> component.normalized() * component.weight())
                .sum();
        int weightedScore = clamp(BigDecimal.valueOf(weightedSum)
                .divide(HUNDRED, 0, RoundingMode.HALF_UP)
                .intValue());

        boolean overLimit = activePrincipal.compareTo(approvedLimit) > 0;
        int score = overLimit ? 0 : weightedScore;

        log.debug("Credit score for customer {}: {} (weighted {}, overLimit {}, components {})",
                customer.getId(), score, weightedScore, overLimit, components);

        return new ScoreBreakdown(components, weightedScore, overLimit, score);
    }

    private ScoreComponent paymentHistory(List<LoanRecord> loanHistory) {
        long installmentsDue = loanHistory.stream().mapToLong(LoanRecord::getTenureMonths).sum();
        if (installmentsDue == 0) {
            // No history: benefit of the doubt
            return new ScoreComponent(ScoreComponentType.PAYMENT_HISTORY, BigDecimal.ONE, 100,
                    weights.getPaymentHistory());
        }
        long paidOnTime = loanHistory.stream().mapToLong(LoanRecord::getEmisPaidOnTime).sum();
        BigDecimal ratio = BigDecimal.valueOf(paidOnTime)
                .divide(BigDecimal.valueOf(installmentsDue), RATIO_SCALE, RoundingMode.HALF_UP)
                .min(BigDecimal.ONE);
        int normalized = clamp(ratio.multiply(HUNDRED).setScale(0, RoundingMode.HALF_UP).intValue());
        return new ScoreComponent(ScoreComponentType.PAYMENT_HISTORY, ratio, normalized,
                weights.getPaymentHistory());
    }

    private ScoreComponent loanCount(List<LoanRecord> loanHistory) {
        int count = loanHistory.size();
        int normalized;
        if (count < 5) {
            normalized = 100;
        } else if (count < 10) {
            normalized = 75;
        } else {
            normalized = 50;
        }
        return new ScoreComponent(ScoreComponentType.LOAN_COUNT, BigDecimal.valueOf(count), normalized,
                weights.getLoanCount());
    }

    private ScoreComponent currentActivity(List<LoanRecord> loanHistory) {
        int currentYear = LocalDate.now(clock).getYear();
        long startedThisYear = loanHistory.stream()
                .filter(loan -> loan.getStartDate() != null && loan.getStartDate().getYear() == currentYear)
                .count();
        int normalized;
        if (startedThisYear == 0) {
            normalized = 100;
        } else if (startedThisYear <= 2) {
            normalized = 75;
        } else if (startedThisYear <= 5) {
            normalized = 50;
        } else {
            normalized = 25;
        }
        return new ScoreComponent(ScoreComponentType.CURRENT_ACTIVITY, BigDecimal.valueOf(startedThisYear),
                normalized, weights.getCurrentActivity());
    }

    private ScoreComponent volume(BigDecimal activePrincipal, BigDecimal approvedLimit) {
        // Nothing borrowed is the best ratio, whatever the limit
        if (activePrincipal.signum() == 0) {
            return new ScoreComponent(ScoreComponentType.VOLUME, BigDecimal.ZERO, 100, weights.getVolume());
        }
        if (approvedLimit == null || approvedLimit.signum() <= 0) {
            return new ScoreComponent(ScoreComponentType.VOLUME, null, 0, weights.getVolume());
        }
        BigDecimal ratio = activePrincipal.divide(approvedLimit, RATIO_SCALE, RoundingMode.HALF_UP);
        int normalized;
        if (ratio.compareTo(new BigDecimal("0.3")) <= 0) {
            normalized = 100;
        } else if (ratio.compareTo(new BigDecimal("0.5")) <= 0) {
            normalized = 83;
        } else if (ratio.compareTo(new BigDecimal("0.8")) <= 0) {
            normalized = 50;
        } else if (ratio.compareTo(BigDecimal.ONE) <= 0) {
            normalized = 33;
        } else {
            normalized = 17;
        }
        return new ScoreComponent(ScoreComponentType.VOLUME, ratio, normalized, weights.getVolume());
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(100, value));
    }
}
