package com.optionguard.event;

/**
 * The risk component that emitted a {@link RiskEventType}. The wire value is the
 * string stored in the persisted event record.
 */
public enum RiskComponent {
    CIRCUIT_BREAKER("circuit_breaker"),
    TRAILING_STOP("trailing_stop"),
    PORTFOLIO_LIMITS("portfolio_limits"),
    POSITION_MONITOR("position_monitor");

    private final String wireValue;

    RiskComponent(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }
}
