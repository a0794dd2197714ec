package com.optionguard.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Buffering policy of the risk event log, read from {@code optionguard.event-log}.
 */
@Configuration
@ConfigurationProperties(prefix = "optionguard.event-log")
@Validated
@Getter
@Setter
public class RiskEventLogProperties {

    /** Buffered events that force an immediate flush. */
    @Min(1)
    private int batchSize = 100;

    /** Upper bound on buffered events while the store is failing; the oldest are dropped beyond it. */
    @Min(1)
    private int maxBuffered = 10_000;

    /** Period of the time-based flush. */
    @Positive
    private long flushIntervalMs = 5_000;
}
