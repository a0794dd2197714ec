package com.optionguard.event;

/**
 * Severity level for a recorded risk event.
 *
 * <p>INFO is routine bookkeeping, WARNING a rejection or breach that needs attention,
 * CRITICAL a condition that suspended automation or forced an exit.
 */
public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL
}
