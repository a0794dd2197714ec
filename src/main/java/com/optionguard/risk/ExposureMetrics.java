package com.optionguard.risk;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Notional exposure of the book in account currency.
 */
@Value
@Builder
public class ExposureMetrics {

    double totalExposure;

    /** Largest single position value. */
    double maxSinglePosition;

    /** Symbol to fraction (0-1) of total exposure held in that symbol's correlation group. */
    @Builder.Default
    Map<String, Double> correlatedExposure = Map.of();

    /** Fraction (0-1) of buying power in use. */
    double buyingPowerUsed;

    double buyingPowerAvailable;

    public double correlatedFractionFor(String symbol) {
        return correlatedExposure.getOrDefault(symbol, 0.0);
    }
}
