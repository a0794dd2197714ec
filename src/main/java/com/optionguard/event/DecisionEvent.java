package com.optionguard.event;

import com.optionguard.domain.model.Decision;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the position monitor for every non-HOLD decision.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>NotificationService: maps action and urgency to an alert severity</li>
 * </ul>
 */
public class DecisionEvent extends ApplicationEvent {

    private final String executionId;
    private final String symbol;
    private final Decision decision;

    public DecisionEvent(Object source, String executionId, String symbol, Decision decision) {
        super(source);
        this.executionId = executionId;
        this.symbol = symbol;
        this.decision = decision;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getSymbol() {
        return symbol;
    }

    public Decision getDecision() {
        return decision;
    }
}
