package com.optionguard.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Market-wide inputs for rule evaluation on one symbol.
 */
@Value
@Builder
public class MarketContext {

    String symbol;

    /** Null when no live quote is available. */
    Double underlyingPrice;

    /** Implied-volatility rank, percentile 0-100. */
    @Builder.Default
    double ivRank = 50.0;

    /** Net portfolio delta at the time the context was captured. */
    double portfolioDelta;

    @Builder.Default
    LocalDateTime capturedAt = LocalDateTime.now();
}
