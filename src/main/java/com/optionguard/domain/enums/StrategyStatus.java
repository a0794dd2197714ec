package com.optionguard.domain.enums;

/**
 * Lifecycle of a built strategy.
 *
 * <p>DRAFT: built and scored but not submitted. OPEN: legs filled and monitored.
 * CLOSED: all legs exited, trailing stop discarded.
 */
public enum StrategyStatus {
    DRAFT,
    OPEN,
    CLOSED
}
