package com.optionguard.risk;

import com.optionguard.domain.enums.CircuitState;
import java.time.Instant;

/**
 * Read-only snapshot of the trading circuit breaker for dashboards and health checks.
 *
 * @param retryAt when an OPEN breaker will allow a trial; null unless OPEN
 */
public record CircuitBreakerStatus(
        CircuitState state,
        int consecutiveFailures,
        int failureThreshold,
        int halfOpenSuccesses,
        Instant openedAt,
        Instant retryAt,
        String lastFailureReason) {}
