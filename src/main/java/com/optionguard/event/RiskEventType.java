package com.optionguard.event;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of risk event kinds.
 *
 * <p>In-process dispatch uses the enum constant; the persisted record stores
 * {@link #getWireValue()}. {@link #fromWireValue(String)} is the only way back from the
 * stored form, so renaming a constant never changes what is on disk.
 */
public enum RiskEventType {

    // Circuit breaker
    CB_STATE_CHANGE("circuit_breaker_state_change", RiskComponent.CIRCUIT_BREAKER, RiskLevel.WARNING),
    CB_FAILURE("circuit_breaker_failure", RiskComponent.CIRCUIT_BREAKER, RiskLevel.INFO),
    CB_SUCCESS("circuit_breaker_success", RiskComponent.CIRCUIT_BREAKER, RiskLevel.INFO),
    CB_MANUAL_RESET("circuit_breaker_manual_reset", RiskComponent.CIRCUIT_BREAKER, RiskLevel.WARNING),

    // Trailing stop
    TS_ADD("trailing_stop_add", RiskComponent.TRAILING_STOP, RiskLevel.INFO),
    TS_ACTIVATE("trailing_stop_activate", RiskComponent.TRAILING_STOP, RiskLevel.INFO),
    TS_UPDATE("trailing_stop_update", RiskComponent.TRAILING_STOP, RiskLevel.INFO),
    TS_TRIGGER("trailing_stop_trigger", RiskComponent.TRAILING_STOP, RiskLevel.CRITICAL),
    TS_REMOVE("trailing_stop_remove", RiskComponent.TRAILING_STOP, RiskLevel.INFO),
    TS_RESET("trailing_stop_reset", RiskComponent.TRAILING_STOP, RiskLevel.WARNING),

    // Portfolio limits
    PL_CHECK("portfolio_limit_check", RiskComponent.PORTFOLIO_LIMITS, RiskLevel.INFO),
    PL_REJECTION("portfolio_limit_rejection", RiskComponent.PORTFOLIO_LIMITS, RiskLevel.WARNING),
    PL_WARNING("portfolio_limit_warning", RiskComponent.PORTFOLIO_LIMITS, RiskLevel.WARNING),

    // Position monitor
    DECISION("position_decision", RiskComponent.POSITION_MONITOR, RiskLevel.INFO);

    private static final Map<String, RiskEventType> BY_WIRE_VALUE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(RiskEventType::getWireValue, Function.identity()));

    private final String wireValue;
    private final RiskComponent component;
    private final RiskLevel defaultLevel;

    RiskEventType(String wireValue, RiskComponent component, RiskLevel defaultLevel) {
        this.wireValue = wireValue;
        this.component = component;
        this.defaultLevel = defaultLevel;
    }

    public String getWireValue() {
        return wireValue;
    }

    public RiskComponent getComponent() {
        return component;
    }

    public RiskLevel getDefaultLevel() {
        return defaultLevel;
    }

    /**
     * @throws IllegalArgumentException if the value does not name a known event type
     */
    public static RiskEventType fromWireValue(String wireValue) {
        RiskEventType type = BY_WIRE_VALUE.get(wireValue);
        if (type == null) {
            throw new IllegalArgumentException("Unknown risk event type: " + wireValue);
        }
        return type;
    }
}
