package com.optionguard.domain.enums;

/**
 * Severity level for alerts forwarded to the alerting channel.
 *
 * <p>Ordinal ordering matters: CRITICAL sorts first so a rate-limited channel can
 * deliver it ahead of the rest.
 */
public enum AlertSeverity {

    /** Position closed at IMMEDIATE urgency, trailing stop triggered, breaker opened. */
    CRITICAL,

    /** Limit rejection or portfolio warning that needs trader attention. */
    WARNING,

    /** Routine non-HOLD decision. */
    INFO
}
