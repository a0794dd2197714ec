package com.optionguard.domain.enums;

public enum LegAction {
    BUY,
    SELL
}
