package com.optionguard.domain.model;

import com.optionguard.domain.enums.StrategyType;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time view of one open position handed to the decision evaluator.
 */
@Value
@Builder
public class PositionSnapshot {

    String executionId;
    String symbol;
    StrategyType strategyType;
    int quantity;

    double entryPremium;
    double currentPremium;
    double highestPremium;
    double unrealizedPnl;

    /** Unrealized P&L as a fraction of entry value (0.5 = +50%). */
    double unrealizedPnlPct;

    long daysToExpiration;
    double delta;
    double gamma;
    double positionValue;

    LocalDateTime capturedAt;
}
