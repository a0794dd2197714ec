package com.optionguard.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
 * JPA entity for the position_history table: one row per position per monitoring cycle.
 */
@Entity
@Table(
        name = "position_history",
        indexes = {@Index(name = "idx_position_history_symbol_ts", columnList = "symbol, recorded_at")})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionHistoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "execution_id", nullable = false, length = 100)
    private String executionId;

    @Column(name = "symbol", nullable = false, length = 20)
    private String symbol;

    @Column(name = "current_premium", nullable = false)
    private double currentPremium;

    @Column(name = "unrealized_pnl", nullable = false)
    private double unrealizedPnl;

    @Column(name = "unrealized_pnl_pct", nullable = false)
    private double unrealizedPnlPct;

    @Column(name = "recorded_at", nullable = false)
    private LocalDateTime recordedAt;
}
