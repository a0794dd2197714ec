package com.optionguard.domain.model;

import com.optionguard.event.RiskComponent;
import com.optionguard.event.RiskEventType;
import com.optionguard.event.RiskLevel;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable, append-only fact record of one risk-relevant transition.
 *
 * <p>Only the fields meaningful to the event's component are populated: circuit breaker
 * events carry old/new state and failure count, trailing stop events carry the premium
 * ladder, portfolio limit events carry limit type, observed value, limit value and the
 * allowed flag. Everything else stays null.
 */
@Value
@Builder
public class RiskEvent {

    String eventId;
    RiskEventType eventType;
    RiskComponent component;
    RiskLevel level;
    LocalDateTime timestamp;

    String executionId;
    String symbol;
    String message;

    // Circuit breaker
    String oldState;
    String newState;
    Integer failureCount;

    // Trailing stop
    Double entryPremium;
    Double currentPremium;
    Double highestPremium;
    Double stopPremium;
    String action;

    // Portfolio limits
    String limitType;
    Double currentValue;
    Double limitValue;
    Boolean allowed;

    Map<String, Object> metadata;
}
