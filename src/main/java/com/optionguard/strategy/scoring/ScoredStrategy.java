package com.optionguard.strategy.scoring;

import com.optionguard.domain.model.Strategy;
import com.optionguard.domain.model.StrategyAnalysis;

/**
 * A built candidate together with its analysis.
 */
public record ScoredStrategy(Strategy strategy, StrategyAnalysis analysis) {

    public double score() {
        return analysis.getScore();
    }
}
