package com.optionguard.domain.enums;

public enum CircuitState {

    /** Normal operation; automated actions allowed. */
    CLOSED,

    /** Tripped after repeated failures; automated actions refused until cool-down elapses. */
    OPEN,

    /** Cool-down elapsed; a limited number of trial actions allowed. */
    HALF_OPEN
}
