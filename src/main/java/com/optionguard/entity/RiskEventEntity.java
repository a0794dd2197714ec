package com.optionguard.entity;

import com.optionguard.event.RiskLevel;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the risk_event table.
 *
 * <p>Event type and component are stored as their wire strings (not enum names) so the
 * persisted form stays stable if constants are renamed. Indexed by symbol and time to
 * support per-symbol audit queries. Component-specific columns are nullable.
 */
@Entity
@Table(
        name = "risk_event",
        indexes = {
            @Index(name = "idx_risk_event_symbol_ts", columnList = "symbol, timestamp"),
            @Index(name = "idx_risk_event_execution", columnList = "execution_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RiskEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false, unique = true, length = 36)
    private String eventId;

    @Column(name = "event_type", nullable = false, length = 60)
    private String eventType;

    @Column(name = "component", nullable = false, length = 30)
    private String component;

    @Enumerated(EnumType.STRING)
    @Column(name = "level", nullable = false, columnDefinition = "varchar(20)")
    private RiskLevel level;

    @Column(name = "timestamp", nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "execution_id", length = 100)
    private String executionId;

    @Column(name = "symbol", length = 20)
    private String symbol;

    @Column(name = "message", columnDefinition = "TEXT")
    private String message;

    @Column(name = "old_state", length = 20)
    private String oldState;

    @Column(name = "new_state", length = 20)
    private String newState;

    @Column(name = "failure_count")
    private Integer failureCount;

    @Column(name = "entry_premium")
    private Double entryPremium;

    @Column(name = "current_premium")
    private Double currentPremium;

    @Column(name = "highest_premium")
    private Double highestPremium;

    @Column(name = "stop_premium")
    private Double stopPremium;

    @Column(name = "action", length = 30)
    private String action;

    @Column(name = "limit_type", length = 30)
    private String limitType;

    @Column(name = "current_value")
    private Double currentValue;

    @Column(name = "limit_value")
    private Double limitValue;

    @Column(name = "allowed")
    private Boolean allowed;

    /** JSON object with event-specific extras. */
    @Column(name = "metadata", columnDefinition = "TEXT")
    private String metadata;
}
