package com.optionguard.config;

import com.optionguard.risk.RiskLimitsConfig;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the global {@link RiskLimitsConfig} bean from application.yml.
 *
 * <p>The exposure cap defaults to null (no cap). Correlation groups assign symbols
 * that move together to a shared group name for the correlated-exposure check.
 *
 * <p>Properties prefix: {@code optionguard.risk.*}
 */
@Configuration
public class RiskConfig {

    @Bean
    @ConfigurationProperties(prefix = "optionguard.risk")
    public CorrelationGroups correlationGroups() {
        return new CorrelationGroups();
    }

    @Bean
    public RiskLimitsConfig riskLimitsConfig(
            @Value("${optionguard.risk.max-portfolio-delta:50}") double maxPortfolioDelta,
            @Value("${optionguard.risk.max-portfolio-gamma:10}") double maxPortfolioGamma,
            @Value("${optionguard.risk.max-per-symbol-delta:20}") double maxPerSymbolDelta,
            @Value("${optionguard.risk.max-single-position-pct:0.02}") double maxSinglePositionPct,
            @Value("${optionguard.risk.max-correlated-pct:0.05}") double maxCorrelatedPct,
            @Value("${optionguard.risk.total-exposure-cap:#{null}}") Double totalExposureCap) {
        return RiskLimitsConfig.builder()
                .maxPortfolioDelta(maxPortfolioDelta)
                .maxPortfolioGamma(maxPortfolioGamma)
                .maxPerSymbolDelta(maxPerSymbolDelta)
                .maxSinglePositionPct(maxSinglePositionPct)
                .maxCorrelatedPct(maxCorrelatedPct)
                .totalExposureCap(totalExposureCap)
                .build();
    }

    /**
     * Symbol-to-group table (e.g. SPY and QQQ both in "us-large-cap"). Symbols without
     * a group are correlated only with themselves.
     */
    public static class CorrelationGroups {

        private Map<String, String> correlationGroups = Map.of();

        public Map<String, String> getCorrelationGroups() {
            return correlationGroups;
        }

        public void setCorrelationGroups(Map<String, String> correlationGroups) {
            this.correlationGroups = correlationGroups;
        }

        public String groupOf(String symbol) {
            return correlationGroups.getOrDefault(symbol, symbol);
        }
    }
}
