package com.optionguard.marketdata;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import lombok.Builder;
import lombok.Value;

/**
 * One expiration of an option chain as needed for strike selection.
 */
@Value
@Builder
public class OptionChain {

    String symbol;
    LocalDate expiration;
    double underlyingPrice;

    /** At-the-money implied volatility; null when not quoted. */
    Double impliedVolatility;

    /** Realised volatility of the underlying; null when unknown. */
    Double historicalVolatility;

    SensitivityProvider sensitivityProvider;

    public int daysToExpiration(LocalDate today) {
        return (int) Math.max(1, ChronoUnit.DAYS.between(today, expiration));
    }
}
