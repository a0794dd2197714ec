package com.optionguard.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the trading circuit breaker, read from {@code optionguard.circuit-breaker}.
 */
@Configuration
@ConfigurationProperties(prefix = "optionguard.circuit-breaker")
@Validated
@Getter
@Setter
public class CircuitBreakerProperties {

    /** Consecutive failures that trip the breaker. */
    @Min(1)
    private int failureThreshold = 3;

    /** Cool-down spent OPEN before a trial is allowed. */
    @NotNull
    private Duration openTimeout = Duration.ofMinutes(5);

    /** Successful trials in HALF_OPEN required to close again. */
    @Min(1)
    private int halfOpenMaxTrials = 1;
}
