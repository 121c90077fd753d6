package com.creditapproval.engine;

import com.creditapproval.exception.InvalidLoanRequestException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Equated monthly installment on the compound interest formula:
 *
 * <pre>
 * EMI = P * r * (1 + r)^n / ((1 + r)^n - 1)
 * </pre>
 *
 * where r is the monthly fractional rate (annual percentage / 12 / 100) and n the
 * tenure in months. A zero rate degenerates to P / n.
 *
 * Results are currency amounts: scale 2, rounded half-up.
 */
@Component
public class EmiCalculator {

    public static final int CURRENCY_SCALE = 2;

    private static final MathContext PRECISION = MathContext.DECIMAL128;
    private static final BigDecimal MONTHS_TIMES_PERCENT = BigDecimal.valueOf(1200);

    public BigDecimal computeEmi(BigDecimal principal, BigDecimal annualRatePercent, int tenureMonths) {
        if (principal == null || principal.signum() <= 0) {
            throw new InvalidLoanRequestException("Principal must be positive");
        }
        if (annualRatePercent == null || annualRatePercent.signum() < 0) {
            throw new InvalidLoanRequestException("Interest rate must not be negative");
        }
        if (tenureMonths <= 0) {
            throw new InvalidLoanRequestException("Tenure must be a positive number of months");
        }

        BigDecimal monthlyRate = annualRatePercent.divide(MONTHS_TIMES_PERCENT, PRECISION);
        if (monthlyRate.signum() == 0) {
            return principal.divide(BigDecimal.valueOf(tenureMonths), CURRENCY_SCALE, RoundingMode.HALF_UP);
        }

        BigDecimal compoundFactor = BigDecimal.ONE.add(monthlyRate).pow(tenureMonths, PRECISION);
        BigDecimal emi = principal.multiply(monthlyRate, PRECISION)
                .multiply(compoundFactor, PRECISION)
                .divide(compoundFactor.subtract(BigDecimal.ONE), PRECISION);
        return emi.setScale(CURRENCY_SCALE, RoundingMode.HALF_UP);
    }
}
