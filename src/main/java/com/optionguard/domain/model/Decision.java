package com.optionguard.domain.model;

import com.optionguard.domain.enums.DecisionAction;
import com.optionguard.domain.enums.Urgency;
import com.optionguard.exception.ValidationException;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * The single actionable outcome of one monitoring cycle for one position.
 *
 * <p>Produced fresh each cycle and never mutated; it is logged, alerted on, and
 * discarded. The {@code rule} names the component or rule that produced it
 * (e.g. "TrailingStop", "StopLoss", "CircuitBreaker").
 */
@Getter
@ToString
public class Decision {

    private final DecisionAction action;
    private final Urgency urgency;
    private final String reason;
    private final String rule;
    private final Map<String, Object> metadata;
    private final LocalDateTime timestamp;

    @Builder
    private Decision(
            DecisionAction action,
            Urgency urgency,
            String reason,
            String rule,
            Map<String, Object> metadata,
            LocalDateTime timestamp) {
        ValidationException.require(action != null, "Decision action is required");
        ValidationException.require(reason != null && !reason.isBlank(), "Decision reason must not be blank");
        ValidationException.require(rule != null && !rule.isBlank(), "Decision rule must not be blank");
        this.action = action;
        this.urgency = urgency != null ? urgency : Urgency.NORMAL;
        this.reason = reason;
        this.rule = rule;
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
        this.timestamp = timestamp != null ? timestamp : LocalDateTime.now();
    }

    public static Decision hold(String reason, String rule) {
        return Decision.builder()
                .action(DecisionAction.HOLD)
                .urgency(Urgency.LOW)
                .reason(reason)
                .rule(rule)
                .build();
    }

    public boolean isHold() {
        return action == DecisionAction.HOLD;
    }
}
