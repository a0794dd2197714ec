package com.optionguard.domain.enums;

/**
 * Outcome of a single trailing-stop update.
 */
public enum TrailingStopAction {
    HOLD,
    ACTIVATE,
    UPDATE,
    TRIGGER
}
