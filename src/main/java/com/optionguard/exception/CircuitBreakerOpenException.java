package com.optionguard.exception;

/**
 * Thrown by guarded callers when the trading circuit breaker refuses an automated action.
 */
public class CircuitBreakerOpenException extends BaseException {

    public CircuitBreakerOpenException(String reason) {
        super(ErrorCode.CIRCUIT_OPEN, "Trading suspended by circuit breaker: " + reason);
    }
}
