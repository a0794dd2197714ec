package com.optionguard.config;

import com.optionguard.risk.TrailingStopConfig;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Default trailing-stop parameters applied when a position enables a trailing stop
 * without an explicit config. Properties are read from {@code optionguard.trailing-stop}.
 */
@Configuration
@ConfigurationProperties(prefix = "optionguard.trailing-stop")
@Validated
@Getter
@Setter
public class TrailingStopProperties {

    /** Percent rise of the peak premium over entry that arms the stop. */
    @Positive
    private double activationPct = 2.0;

    /** Percent below the peak premium at which the stop sits. Must be below activationPct. */
    @Positive
    private double trailingPct = 1.5;

    /** Minimum percent change before an active stop is moved. */
    @Positive
    private double minMovePct = 0.5;

    public TrailingStopConfig toConfig() {
        return new TrailingStopConfig(activationPct, trailingPct, minMovePct);
    }
}
