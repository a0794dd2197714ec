package com.optionguard.risk;

/**
 * Supplies the current aggregated portfolio risk on demand.
 */
public interface PortfolioRiskAggregator {

    PortfolioRiskSnapshot currentRisk();

    /**
     * Aggregated risk of every open position except {@code executionId}. Used to check a
     * roll, which replaces that position's exposure instead of adding to it.
     */
    PortfolioRiskSnapshot currentRiskExcluding(String executionId);
}
