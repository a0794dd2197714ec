package com.optionguard.notification;

import com.optionguard.domain.enums.AlertSeverity;
import com.optionguard.domain.enums.DecisionAction;
import com.optionguard.domain.enums.Urgency;
import com.optionguard.domain.model.Decision;
import com.optionguard.domain.model.RiskEvent;
import com.optionguard.event.DecisionEvent;
import com.optionguard.event.RiskAlertEvent;
import com.optionguard.event.RiskLevel;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Turns decisions and risk events into {@link Alert}s and hands them to every
 * {@link AlertChannel}.
 *
 * <p>Delivery runs on the {@code eventExecutor} pool so a slow channel never delays the
 * monitoring thread. A channel failure is logged and the remaining channels still receive
 * the alert.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final List<AlertChannel> alertChannels;

    public NotificationService(List<AlertChannel> alertChannels) {
        this.alertChannels = alertChannels;
    }

    public void notify(Alert alert) {
        for (AlertChannel channel : alertChannels) {
            try {
                channel.send(alert);
            } catch (RuntimeException e) {
                log.error(
                        "Failed to send alert '{}' via {}: {}",
                        alert.getTitle(),
                        channel.getClass().getSimpleName(),
                        e.getMessage(),
                        e);
            }
        }
    }

    @Async("eventExecutor")
    @EventListener
    public void onDecision(DecisionEvent event) {
        Decision decision = event.getDecision();
        mapDecision(decision).ifPresent(severity -> notify(Alert.builder()
                .severity(severity)
                .title(String.format("%s %s (%s)", decision.getAction(), event.getSymbol(), decision.getRule()))
                .message(decision.getReason())
                .executionId(event.getExecutionId())
                .symbol(event.getSymbol())
                .build()));
    }

    @Async("eventExecutor")
    @EventListener
    public void onRiskAlert(RiskAlertEvent event) {
        RiskEvent riskEvent = event.getRiskEvent();
        notify(Alert.builder()
                .severity(mapRiskLevel(riskEvent.getLevel()))
                .title(riskEvent.getEventType().getWireValue())
                .message(riskEvent.getMessage())
                .executionId(riskEvent.getExecutionId())
                .symbol(riskEvent.getSymbol())
                .build());
    }

    /**
     * CLOSE at IMMEDIATE is critical, CLOSE at HIGH a warning, any other action
     * informational. HOLD raises no alert.
     */
    static Optional<AlertSeverity> mapDecision(Decision decision) {
        if (decision.getAction() == DecisionAction.HOLD) {
            return Optional.empty();
        }
        if (decision.getAction() == DecisionAction.CLOSE) {
            if (decision.getUrgency() == Urgency.IMMEDIATE) {
                return Optional.of(AlertSeverity.CRITICAL);
            }
            if (decision.getUrgency() == Urgency.HIGH) {
                return Optional.of(AlertSeverity.WARNING);
            }
        }
        return Optional.of(AlertSeverity.INFO);
    }

    static AlertSeverity mapRiskLevel(RiskLevel level) {
        return switch (level) {
            case INFO -> AlertSeverity.INFO;
            case WARNING -> AlertSeverity.WARNING;
            case CRITICAL -> AlertSeverity.CRITICAL;
        };
    }
}
