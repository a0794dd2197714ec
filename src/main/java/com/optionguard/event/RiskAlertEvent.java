package com.optionguard.event;

import com.optionguard.domain.model.RiskEvent;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a WARNING or CRITICAL risk event has been appended to the log.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>NotificationService: forwards to the alerting channel</li>
 * </ul>
 */
public class RiskAlertEvent extends ApplicationEvent {

    private final RiskEvent riskEvent;

    public RiskAlertEvent(Object source, RiskEvent riskEvent) {
        super(source);
        this.riskEvent = riskEvent;
    }

    public RiskEvent getRiskEvent() {
        return riskEvent;
    }

    public RiskLevel getLevel() {
        return riskEvent.getLevel();
    }
}
