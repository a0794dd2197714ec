package com.optionguard.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Machine-readable failure categories. The {@code retryable} flag tells orchestration
 * whether the same call can be attempted again once the underlying condition clears.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", false),
    NO_MARKET_DATA("NO_MARKET_DATA", true),
    STRATEGY_BUILD_FAILED("STRATEGY_BUILD_FAILED", false),
    CIRCUIT_OPEN("CIRCUIT_OPEN", true),
    NOT_FOUND("NOT_FOUND", false),
    EXECUTION_ERROR("EXECUTION_ERROR", true),
    INTERNAL_ERROR("INTERNAL_ERROR", false);

    private final String code;
    private final boolean retryable;
}
