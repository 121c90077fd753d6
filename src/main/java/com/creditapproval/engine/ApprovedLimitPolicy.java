package com.creditapproval.engine;

import com.creditapproval.config.CreditPolicyProperties;
import com.creditapproval.exception.InvalidLoanRequestException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Maximum aggregate principal a customer may hold: a multiple of the monthly
 * income, rounded half-up to the nearest lakh (100,000).
 */
@Component
public class ApprovedLimitPolicy {

    private final BigDecimal incomeMultiplier;
    private final BigDecimal roundingUnit;

    public ApprovedLimitPolicy(CreditPolicyProperties properties) {
        this.incomeMultiplier = properties.getApprovedLimit().getIncomeMultiplier();
        this.roundingUnit = properties.getApprovedLimit().getRoundingUnit();
    }

    public BigDecimal computeApprovedLimit(BigDecimal monthlyIncome) {
        if (monthlyIncome == null || monthlyIncome.signum() <= 0) {
            throw new InvalidLoanRequestException("Monthly income must be positive");
        }
        BigDecimal units = monthlyIncome.multiply(incomeMultiplier)
                .divide(roundingUnit, 0, RoundingMode.HALF_UP);
        return units.multiply(roundingUnit).setScale(EmiCalculator.CURRENCY_SCALE, RoundingMode.HALF_UP);
    }
}
