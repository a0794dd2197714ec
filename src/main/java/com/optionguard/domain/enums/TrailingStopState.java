package com.optionguard.domain.enums;

public enum TrailingStopState {
    INACTIVE,
    ACTIVE,
    TRIGGERED
}
