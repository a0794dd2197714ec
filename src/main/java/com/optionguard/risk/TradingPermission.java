package com.optionguard.risk;

/**
 * Answer to "may automation act now?" with the reason when it may not.
 */
public record TradingPermission(boolean allowed, String reason) {

    public static TradingPermission allow(String reason) {
        return new TradingPermission(true, reason);
    }

    public static TradingPermission deny(String reason) {
        return new TradingPermission(false, reason);
    }
}
