package com.optionguard.risk;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Aggregated position-level Greeks across the whole book, plus per-symbol breakdowns.
 */
@Value
@Builder
public class PortfolioGreeks {

    double delta;
    double gamma;
    double theta;
    double vega;

    @Builder.Default
    Map<String, Double> deltaPerSymbol = Map.of();

    @Builder.Default
    Map<String, Double> gammaPerSymbol = Map.of();

    public double deltaFor(String symbol) {
        return deltaPerSymbol.getOrDefault(symbol, 0.0);
    }
}
