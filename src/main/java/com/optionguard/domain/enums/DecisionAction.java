package com.optionguard.domain.enums;

/**
 * Action recommended for a position in one monitoring cycle.
 */
public enum DecisionAction {

    /** Keep the position unchanged. */
    HOLD,

    /** Exit all legs. */
    CLOSE,

    /** Close and re-open further out in time or strike. Adds new exposure. */
    ROLL,

    /** Open a new position. Adds new exposure. */
    ENTER;

    /** True for actions that open new exposure and therefore pass through risk gating. */
    public boolean addsExposure() {
        return this == ROLL || this == ENTER;
    }
}
