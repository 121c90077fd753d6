package com.creditapproval.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Percentage weight of each credit score component. Must sum to 100.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "credit.scoring.weights")
public class ScoringWeights {

    @Min(0)
    private int paymentHistory = 30;

    @Min(0)
    private int loanCount = 20;

    @Min(0)
    private int currentActivity = 20;

    @Min(0)
    private int volume = 30;

    public int total() {
        return paymentHistory + loanCount + currentActivity + volume;
    }
}
