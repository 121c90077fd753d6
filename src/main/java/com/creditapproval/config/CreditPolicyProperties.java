package com.creditapproval.config;

import com.creditapproval.engine.RateCorrectionMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Eligibility and approved-limit policy.
 *
 * Score bands (exclusive lower bounds):
 * - score > primeScoreThreshold: any rate
 * - score > standardScoreThreshold: rate of at least standardMinRate
 * - score > subprimeScoreThreshold: rate of at least subprimeMinRate
 * - otherwise: rejected
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "credit.policy")
public class CreditPolicyProperties {

    @Min(0) @Max(100)
    private int primeScoreThreshold = 50;

    @Min(0) @Max(100)
    private int standardScoreThreshold = 30;

    @NotNull @DecimalMin("0")
    private BigDecimal standardMinRate = new BigDecimal("12");

    @Min(0) @Max(100)
    private int subprimeScoreThreshold = 10;

    @NotNull @DecimalMin("0")
    private BigDecimal subprimeMinRate = new BigDecimal("16");

    // Share of monthly income all EMIs together may take
    @NotNull @DecimalMin(value = "0", inclusive = false) @DecimalMax("1")
    private BigDecimal maxIncomeBurdenRatio = new BigDecimal("0.5");

    @NotNull
    private RateCorrectionMode rateCorrection = RateCorrectionMode.CORRECT;

    @Valid
    private ApprovedLimit approvedLimit = new ApprovedLimit();

    @Data
    public static class ApprovedLimit {

        @NotNull @DecimalMin(value = "0", inclusive = false)
        private BigDecimal incomeMultiplier = new BigDecimal("36");

        // One lakh
        @NotNull @DecimalMin(value = "1")
        private BigDecimal roundingUnit = new BigDecimal("100000");
    }
}
