package com.optionguard.domain.enums;

/**
 * Vertical spread flavours. The short leg is the one nearer the money for credit
 * spreads and the one further from the money for debit spreads.
 */
public enum SpreadDirection {
    BULL_PUT(OptionRight.PUT, true),
    BEAR_CALL(OptionRight.CALL, true),
    BULL_CALL(OptionRight.CALL, false),
    BEAR_PUT(OptionRight.PUT, false);

    private final OptionRight right;
    private final boolean credit;

    SpreadDirection(OptionRight right, boolean credit) {
        this.right = right;
        this.credit = credit;
    }

    public OptionRight getRight() {
        return right;
    }

    public boolean isCredit() {
        return credit;
    }
}
