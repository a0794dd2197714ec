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
 * Default build parameters for candidate strategies, read from {@code optionguard.strategy}.
 */
@Configuration
@ConfigurationProperties(prefix = "optionguard.strategy")
@Validated
@Getter
@Setter
public class StrategyProperties {

    @Min(1)
    private int targetDte = 45;

    /** Short-leg delta target for iron condors. */
    @Positive
    @DecimalMax("0.5")
    private double ironCondorDelta = 0.16;

    /** Short-leg delta target for credit verticals. */
    @Positive
    @DecimalMax("0.5")
    private double verticalDelta = 0.20;

    @Positive
    private double wingWidth = 10.0;

    @Positive
    private double spreadWidth = 5.0;

    @Min(1)
    private int quantity = 1;

    /** Measure volatility skew and lean the iron condor targets toward the richer side. */
    private boolean useSkew = true;
}
