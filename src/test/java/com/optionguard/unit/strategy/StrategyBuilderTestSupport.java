package com.optionguard.unit.strategy;

import com.optionguard.config.StrikeSelectionProperties;
import com.optionguard.core.processor.GreeksCalculator;
import com.optionguard.marketdata.BlackScholesSensitivityProvider;
import com.optionguard.marketdata.OptionChain;
import java.time.Clock;
import java.time.LocalDate;

/**
 * Theoretical SPY-like chain at 400 with 20% volatility, 45 days out, for builder tests.
 */
final class StrategyBuilderTestSupport {

    static final String SYMBOL = "SPY";
    static final double PRICE = 400.0;
    static final double VOL = 0.20;
    static final int DTE = 45;

    private StrategyBuilderTestSupport() {}

    static OptionChain chain(Clock clock, double skewSlope) {
        GreeksCalculator calculator = new GreeksCalculator(0.045, 0.0);
        LocalDate today = LocalDate.now(clock);
        LocalDate expiration = today.plusDays(DTE);
        return OptionChain.builder()
                .symbol(SYMBOL)
                .expiration(expiration)
                .underlyingPrice(PRICE)
                .impliedVolatility(VOL)
                .sensitivityProvider(new BlackScholesSensitivityProvider(
                        calculator, PRICE, calculator.yearsToExpiry(expiration, today), VOL, skewSlope))
                .build();
    }

    static StrikeSelectionProperties selectionProperties() {
        return new StrikeSelectionProperties();
    }
}
