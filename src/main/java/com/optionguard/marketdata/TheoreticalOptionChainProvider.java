package com.optionguard.marketdata;

import com.optionguard.core.processor.GreeksCalculator;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback chain provider for paper trading: standard Friday expirations and
 * Black-Scholes sensitivities at a configured volatility and skew.
 */
public class TheoreticalOptionChainProvider implements OptionChainProvider {

    private static final Logger log = LoggerFactory.getLogger(TheoreticalOptionChainProvider.class);

    private final GreeksCalculator greeksCalculator;
    private final Clock clock;
    private final double volatility;
    private final double skewSlope;

    public TheoreticalOptionChainProvider(
            GreeksCalculator greeksCalculator, Clock clock, double volatility, double skewSlope) {
        this.greeksCalculator = greeksCalculator;
        this.clock = clock;
        this.volatility = volatility;
        this.skewSlope = skewSlope;
    }

    @Override
    public OptionChain getChain(String symbol, int targetDte, double underlyingPrice) {
        LocalDate today = LocalDate.now(clock);
        LocalDate expiration = today.plusDays(Math.max(1, targetDte)).with(TemporalAdjusters.nextOrSame(DayOfWeek.FRIDAY));
        double years = greeksCalculator.yearsToExpiry(expiration, today);
        log.debug("Theoretical chain for {}: expiration={}, vol={}", symbol, expiration, volatility);

        return OptionChain.builder()
                .symbol(symbol)
                .expiration(expiration)
                .underlyingPrice(underlyingPrice)
                .impliedVolatility(volatility)
                .sensitivityProvider(new BlackScholesSensitivityProvider(
                        greeksCalculator, underlyingPrice, years, volatility, skewSlope))
                .build();
    }
}
