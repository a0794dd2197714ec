package com.optionguard.domain.enums;

/**
 * Option side. Calls carry positive sensitivity, puts negative.
 */
public enum OptionRight {
    CALL,
    PUT;

    public boolean isCall() {
        return this == CALL;
    }
}
