package com.optionguard.config;

import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Position monitoring cadence, read from {@code optionguard.monitor}.
 */
@Configuration
@ConfigurationProperties(prefix = "optionguard.monitor")
@Validated
@Getter
@Setter
public class MonitorProperties {

    /** When false the scheduled loop skips its cycles; manual calls still work. */
    private boolean enabled = true;

    @Positive
    private long intervalMs = 30_000;
}
