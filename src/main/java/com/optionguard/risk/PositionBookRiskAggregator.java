package com.optionguard.risk;

import com.optionguard.config.RiskConfig.CorrelationGroups;
import com.optionguard.domain.model.OpenPosition;
import com.optionguard.monitor.OpenPositionSource;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Sums position-level Greeks and notional exposure over the open-position book.
 *
 * <p>Exposure is the absolute mark value of each position. The correlated fraction of a
 * symbol is the share of total exposure held by all symbols in its correlation group.
 */
@Component
public class PositionBookRiskAggregator implements PortfolioRiskAggregator {

    private final OpenPositionSource openPositionSource;
    private final CorrelationGroups correlationGroups;
    private final double accountCapital;
    private final Clock clock;

    public PositionBookRiskAggregator(
            OpenPositionSource openPositionSource,
            CorrelationGroups correlationGroups,
            @Value("${optionguard.risk.account-capital:100000}") double accountCapital,
            Clock clock) {
        this.openPositionSource = openPositionSource;
        this.correlationGroups = correlationGroups;
        this.accountCapital = accountCapital;
        this.clock = clock;
    }

    @Override
    public PortfolioRiskSnapshot currentRisk() {
        return aggregate(openPositionSource.getOpenPositions());
    }

    @Override
    public PortfolioRiskSnapshot currentRiskExcluding(String executionId) {
        return aggregate(openPositionSource.getOpenPositions().stream()
                .filter(position -> !position.getExecutionId().equals(executionId))
                .toList());
    }

    private PortfolioRiskSnapshot aggregate(List<OpenPosition> positions) {
        if (positions.isEmpty()) {
            return PortfolioRiskSnapshot.builder()
                    .greeks(PortfolioGreeks.builder().build())
                    .exposure(ExposureMetrics.builder().build())
                    .calculatedAt(LocalDateTime.now(clock))
                    .build();
        }

        double delta = 0;
        double gamma = 0;
        double theta = 0;
        double vega = 0;
        double total = 0;
        double largest = 0;
        Map<String, Double> deltaPerSymbol = new HashMap<>();
        Map<String, Double> gammaPerSymbol = new HashMap<>();
        Map<String, Double> exposurePerGroup = new HashMap<>();

        for (OpenPosition position : positions) {
            String symbol = position.getSymbol();
            delta += position.getDelta();
            gamma += position.getGamma();
            theta += position.getTheta();
            vega += position.getVega();
            deltaPerSymbol.merge(symbol, position.getDelta(), Double::sum);
            gammaPerSymbol.merge(symbol, position.getGamma(), Double::sum);

            double value = Math.abs(position.marketValue());
            total += value;
            largest = Math.max(largest, value);
            exposurePerGroup.merge(correlationGroups.groupOf(symbol), value, Double::sum);
        }

        Map<String, Double> correlated = new HashMap<>();
        if (total > 0) {
            for (String symbol : deltaPerSymbol.keySet()) {
                correlated.put(symbol, exposurePerGroup.get(correlationGroups.groupOf(symbol)) / total);
            }
        }

        return PortfolioRiskSnapshot.builder()
                .greeks(PortfolioGreeks.builder()
                        .delta(delta)
                        .gamma(gamma)
                        .theta(theta)
                        .vega(vega)
                        .deltaPerSymbol(Map.copyOf(deltaPerSymbol))
                        .gammaPerSymbol(Map.copyOf(gammaPerSymbol))
                        .build())
                .exposure(ExposureMetrics.builder()
                        .totalExposure(total)
                        .maxSinglePosition(largest)
                        .correlatedExposure(Map.copyOf(correlated))
                        .buyingPowerUsed(accountCapital > 0 ? total / accountCapital : 0)
                        .buyingPowerAvailable(Math.max(0, accountCapital - total))
                        .build())
                .positionCount(positions.size())
                .symbolCount(deltaPerSymbol.size())
                .calculatedAt(LocalDateTime.now(clock))
                .build();
    }
}
