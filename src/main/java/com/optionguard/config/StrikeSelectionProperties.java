package com.optionguard.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Strike search and skew adjustment tuning, read from {@code optionguard.strike-selection}.
 */
@Configuration
@ConfigurationProperties(prefix = "optionguard.strike-selection")
@Validated
@Getter
@Setter
public class StrikeSelectionProperties {

    /** Accepted absolute error between observed and target sensitivity. */
    @Positive
    private double tolerance = 0.03;

    /** Probe budget per search. */
    @Min(1)
    private int maxIterations = 10;

    /** Volatility assumed when neither implied nor historical volatility is known. */
    @Positive
    private double defaultVolatility = 0.20;

    /** Largest fractional widening of the target on the richer-volatility side. */
    @Positive
    @DecimalMax("1.0")
    private double maxSkewAdjustment = 0.20;

    /** Ceiling for a skew-adjusted target sensitivity. */
    @Positive
    @DecimalMax("1.0")
    private double maxAdjustedTarget = 0.30;
}
