package com.optionguard.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Option sensitivities from the Black-Scholes valuation.
 *
 * <p>When the inputs cannot produce a valid valuation (non-positive spot, strike or
 * volatility) the UNAVAILABLE sentinel is returned. Check {@link #isAvailable()} before use.
 */
@Data
@Builder
public class Greeks {

    /** Range -1 (deep ITM put) to +1 (deep ITM call). */
    private double delta;

    private double gamma;

    /** Per-day decay. */
    private double theta;

    /** Per 1% change in implied volatility. */
    private double vega;

    /** Implied volatility as a decimal (0.20 = 20%). */
    private double iv;

    private LocalDateTime calculatedAt;

    public static final Greeks UNAVAILABLE = Greeks.builder()
            .iv(-1)
            .calculatedAt(LocalDateTime.MIN)
            .build();

    public boolean isAvailable() {
        return this != UNAVAILABLE && iv > 0;
    }
}
