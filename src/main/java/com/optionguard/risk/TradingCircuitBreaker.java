package com.optionguard.risk;

import com.optionguard.config.CircuitBreakerProperties;
import com.optionguard.domain.enums.CircuitState;
import com.optionguard.observability.RiskEventLog;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Process-wide failure-rate safety valve for automated trading.
 *
 * <p>State machine:
 * <ul>
 *   <li>CLOSED: actions allowed. {@code failureThreshold} consecutive failures trip to OPEN;
 *       any success clears the streak.</li>
 *   <li>OPEN: actions refused. Once {@code openTimeout} has elapsed the next permission
 *       query moves to HALF_OPEN.</li>
 *   <li>HALF_OPEN: trial actions allowed. {@code halfOpenMaxTrials} successes close the
 *       breaker; a single failure re-opens it and restarts the cool-down.</li>
 * </ul>
 *
 * <p>{@link #reset()} forces CLOSED regardless of counters. Every transition is written
 * to the {@link RiskEventLog}.
 *
 * <p>One instance is shared by every caller in the process. A second process driving the
 * same execution gateway would keep its own counters and trip independently.
 */
@Service
public class TradingCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(TradingCircuitBreaker.class);

    private final int failureThreshold;
    private final Duration openTimeout;
    private final int halfOpenMaxTrials;
    private final RiskEventLog riskEventLog;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private int halfOpenSuccesses;
    private Instant openedAt;
    private String lastFailureReason;

    public TradingCircuitBreaker(CircuitBreakerProperties properties, RiskEventLog riskEventLog, Clock clock) {
        this.failureThreshold = properties.getFailureThreshold();
        this.openTimeout = properties.getOpenTimeout();
        this.halfOpenMaxTrials = properties.getHalfOpenMaxTrials();
        this.riskEventLog = riskEventLog;
        this.clock = clock;
    }

    /**
     * Records a failed automated action (order placement, cancellation, persistence write).
     */
    public synchronized void recordFailure(String reason) {
        consecutiveFailures++;
        lastFailureReason = reason;
        log.warn(
                "Circuit breaker failure recorded ({}/{}) in state {}: {}",
                consecutiveFailures,
                failureThreshold,
                state,
                reason);
        riskEventLog.logCircuitBreakerFailure(state, consecutiveFailures, reason);

        if (state == CircuitState.HALF_OPEN) {
            transitionTo(CircuitState.OPEN, "Trial failed in HALF_OPEN: " + reason);
        } else if (state == CircuitState.CLOSED && consecutiveFailures >= failureThreshold) {
            transitionTo(
                    CircuitState.OPEN,
                    String.format("%d consecutive failures (threshold %d)", consecutiveFailures, failureThreshold));
        }
    }

    /**
     * Records a successful automated action.
     */
    public synchronized void recordSuccess() {
        switch (state) {
            case CLOSED -> {
                if (consecutiveFailures > 0) {
                    log.info("Circuit breaker failure streak of {} cleared by success", consecutiveFailures);
                    riskEventLog.logCircuitBreakerSuccess(state, consecutiveFailures);
                }
                consecutiveFailures = 0;
            }
            case HALF_OPEN -> {
                halfOpenSuccesses++;
                riskEventLog.logCircuitBreakerSuccess(state, consecutiveFailures);
                if (halfOpenSuccesses >= halfOpenMaxTrials) {
                    transitionTo(CircuitState.CLOSED, halfOpenSuccesses + " successful trial(s) in HALF_OPEN");
                }
            }
            case OPEN -> log.debug("Success reported while OPEN, ignored");
        }
    }

    /**
     * Whether automated entries and executions may proceed now. An OPEN breaker whose
     * cool-down has elapsed moves to HALF_OPEN here and allows the trial.
     */
    public synchronized TradingPermission isTradingAllowed() {
        if (state == CircuitState.OPEN) {
            Instant retryAt = openedAt.plus(openTimeout);
            Instant now = clock.instant();
            if (now.isBefore(retryAt)) {
                long remainingSecs = Duration.between(now, retryAt).toSeconds();
                return TradingPermission.deny(String.format(
                        "Circuit breaker OPEN after %d failures, retry in %ds (last failure: %s)",
                        consecutiveFailures, remainingSecs, lastFailureReason));
            }
            transitionTo(CircuitState.HALF_OPEN, "Cool-down of " + openTimeout.toSeconds() + "s elapsed");
        }
        if (state == CircuitState.HALF_OPEN) {
            return TradingPermission.allow("Circuit breaker HALF_OPEN, trial allowed");
        }
        return TradingPermission.allow("Circuit breaker CLOSED");
    }

    /** Manual override: forces CLOSED and clears all counters. */
    public synchronized void reset() {
        CircuitState previous = state;
        log.warn("Circuit breaker manually reset from {}", previous);
        riskEventLog.logCircuitBreakerReset(previous, consecutiveFailures);
        if (previous != CircuitState.CLOSED) {
            transitionTo(CircuitState.CLOSED, "Manual reset");
        }
        consecutiveFailures = 0;
        halfOpenSuccesses = 0;
        openedAt = null;
        lastFailureReason = null;
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized CircuitBreakerStatus getStatus() {
        Instant retryAt = state == CircuitState.OPEN ? openedAt.plus(openTimeout) : null;
        return new CircuitBreakerStatus(
                state,
                consecutiveFailures,
                failureThreshold,
                halfOpenSuccesses,
                openedAt,
                retryAt,
                lastFailureReason);
    }

    private void transitionTo(CircuitState newState, String reason) {
        CircuitState oldState = state;
        state = newState;
        halfOpenSuccesses = 0;
        if (newState == CircuitState.OPEN) {
            openedAt = clock.instant();
        } else if (newState == CircuitState.CLOSED) {
            consecutiveFailures = 0;
            openedAt = null;
        }
        log.info("Circuit breaker {} -> {}: {}", oldState, newState, reason);
        riskEventLog.logCircuitBreakerStateChange(oldState, newState, consecutiveFailures, reason);
    }
}
