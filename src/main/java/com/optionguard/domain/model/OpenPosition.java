package com.optionguard.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * An executed strategy currently held, with its latest marks.
 *
 * <p>Premiums are per-share option prices; the position value multiplies by
 * {@link #CONTRACT_MULTIPLIER} and the contract quantity. Greeks are position-level
 * (already signed and scaled by quantity) as supplied by the position source.
 */
@Data
@Builder
public class OpenPosition {

    public static final int CONTRACT_MULTIPLIER = 100;

    private String executionId;
    private Strategy strategy;
    private int quantity;

    private double entryPremium;
    private double currentPremium;
    private double unrealizedPnl;

    private double delta;
    private double gamma;
    private double theta;
    private double vega;

    private LocalDateTime openedAt;
    private LocalDateTime markedAt;

    public String getSymbol() {
        return strategy.getSymbol();
    }

    /** Premium paid or received at entry, in account currency. */
    public double entryValue() {
        return entryPremium * CONTRACT_MULTIPLIER * quantity;
    }

    /** Current mark value of the position, in account currency. */
    public double marketValue() {
        return currentPremium * CONTRACT_MULTIPLIER * quantity;
    }
}
