package com.optionguard.config;

import com.optionguard.broker.ExecutionGateway;
import com.optionguard.broker.PaperExecutionGateway;
import com.optionguard.core.processor.GreeksCalculator;
import com.optionguard.marketdata.MarketContextProvider;
import com.optionguard.marketdata.NeutralMarketContextProvider;
import com.optionguard.marketdata.OptionChainProvider;
import com.optionguard.marketdata.TheoreticalOptionChainProvider;
import com.optionguard.risk.PortfolioRiskAggregator;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default implementations of the external collaborators. A deployment that wires a real
 * market-data feed or broker declares its own bean and these step aside.
 */
@Configuration
public class CollaboratorConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean(OptionChainProvider.class)
    public OptionChainProvider theoreticalOptionChainProvider(
            GreeksCalculator greeksCalculator,
            Clock clock,
            @Value("${optionguard.pricing.default-volatility:0.20}") double volatility,
            @Value("${optionguard.pricing.skew-slope:0.5}") double skewSlope) {
        return new TheoreticalOptionChainProvider(greeksCalculator, clock, volatility, skewSlope);
    }

    @Bean
    @ConditionalOnMissingBean(MarketContextProvider.class)
    public MarketContextProvider neutralMarketContextProvider(PortfolioRiskAggregator portfolioRiskAggregator) {
        return new NeutralMarketContextProvider(portfolioRiskAggregator);
    }

    @Bean
    @ConditionalOnMissingBean(ExecutionGateway.class)
    public ExecutionGateway paperExecutionGateway() {
        return new PaperExecutionGateway();
    }
}
