package com.optionguard.marketdata;

import com.optionguard.domain.model.MarketContext;
import com.optionguard.risk.PortfolioRiskAggregator;

/**
 * Fallback context when no market-data feed is wired: mid-range IV rank and the
 * current portfolio delta from the aggregator.
 */
public class NeutralMarketContextProvider implements MarketContextProvider {

    private final PortfolioRiskAggregator portfolioRiskAggregator;

    public NeutralMarketContextProvider(PortfolioRiskAggregator portfolioRiskAggregator) {
        this.portfolioRiskAggregator = portfolioRiskAggregator;
    }

    @Override
    public MarketContext getContext(String symbol) {
        return MarketContext.builder()
                .symbol(symbol)
                .ivRank(50.0)
                .portfolioDelta(portfolioRiskAggregator.currentRisk().getGreeks().getDelta())
                .build();
    }
}
