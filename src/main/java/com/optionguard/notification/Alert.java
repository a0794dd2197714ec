package com.optionguard.notification;

import com.optionguard.domain.enums.AlertSeverity;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * An operator alert derived from a decision or a risk event.
 */
@Data
@Builder
public class Alert {

    private AlertSeverity severity;
    private String title;
    private String message;

    /** Null for portfolio-wide alerts. */
    private String executionId;

    private String symbol;

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();
}
