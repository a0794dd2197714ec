package com.optionguard.strategy.builder;

import com.optionguard.domain.model.Strategy;

/**
 * Assembles a fully specified {@link Strategy} from market state and build parameters.
 *
 * @param <P> parameter set for the strategy family
 */
public interface StrategyBuilder<P> {

    /**
     * @throws com.optionguard.exception.NoDataException if the chain or a sensitivity is missing
     * @throws com.optionguard.exception.StrategyBuildException if no strike satisfies the
     *     structural constraints
     */
    Strategy build(String symbol, double underlyingPrice, P params);
}
