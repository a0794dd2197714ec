package com.optionguard.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes alerts to the application log. Used when no external transport is configured.
 */
@Component
public class LoggingAlertChannel implements AlertChannel {

    private static final Logger log = LoggerFactory.getLogger("com.optionguard.alerts");

    @Override
    public void send(Alert alert) {
        switch (alert.getSeverity()) {
            case CRITICAL -> log.error("[ALERT] {}: {}", alert.getTitle(), alert.getMessage());
            case WARNING -> log.warn("[ALERT] {}: {}", alert.getTitle(), alert.getMessage());
            case INFO -> log.info("[ALERT] {}: {}", alert.getTitle(), alert.getMessage());
        }
    }
}
