package com.optionguard.strategy.scoring;

import com.optionguard.config.StrategyProperties;
import com.optionguard.domain.enums.SpreadDirection;
import com.optionguard.domain.model.Strategy;
import com.optionguard.exception.BaseException;
import com.optionguard.strategy.builder.IronCondorBuilder;
import com.optionguard.strategy.builder.IronCondorParams;
import com.optionguard.strategy.builder.VerticalSpreadBuilder;
import com.optionguard.strategy.builder.VerticalSpreadParams;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds the candidate strategies for a symbol, scores them and orders them best first.
 *
 * <p>Ordering is a stable sort on score: candidates with equal scores keep the order
 * they were built in (iron condor, bull put, bear call).
 */
@Service
public class StrategyRanker {

    private static final Logger log = LoggerFactory.getLogger(StrategyRanker.class);

    private final IronCondorBuilder ironCondorBuilder;
    private final VerticalSpreadBuilder verticalSpreadBuilder;
    private final StrategyScorer strategyScorer;
    private final StrategyProperties strategyProperties;

    public StrategyRanker(
            IronCondorBuilder ironCondorBuilder,
            VerticalSpreadBuilder verticalSpreadBuilder,
            StrategyScorer strategyScorer,
            StrategyProperties strategyProperties) {
        this.ironCondorBuilder = ironCondorBuilder;
        this.verticalSpreadBuilder = verticalSpreadBuilder;
        this.strategyScorer = strategyScorer;
        this.strategyProperties = strategyProperties;
    }

    /**
     * Descending by score; returns a new list.
     */
    public List<ScoredStrategy> rank(List<ScoredStrategy> candidates) {
        List<ScoredStrategy> ranked = new ArrayList<>(candidates);
        ranked.sort(Comparator.comparingDouble(ScoredStrategy::score).reversed());
        return ranked;
    }

    /**
     * Builds an iron condor and both credit verticals for {@code symbol}, skipping any
     * candidate that cannot be built, then scores and ranks the rest.
     *
     * @return ranked candidates, empty when none could be built
     */
    public List<ScoredStrategy> buildAndRank(String symbol, double underlyingPrice, double ivRank) {
        List<ScoredStrategy> scored = new ArrayList<>();
        tryBuild(symbol, "iron condor", () -> ironCondorBuilder.build(symbol, underlyingPrice, ironCondorParams()))
                .forEach(s -> scored.add(new ScoredStrategy(s, strategyScorer.analyze(s, ivRank))));
        for (SpreadDirection direction : List.of(SpreadDirection.BULL_PUT, SpreadDirection.BEAR_CALL)) {
            tryBuild(
                            symbol,
                            direction.name(),
                            () -> verticalSpreadBuilder.build(symbol, underlyingPrice, verticalParams(direction)))
                    .forEach(s -> scored.add(new ScoredStrategy(s, strategyScorer.analyze(s, ivRank))));
        }

        List<ScoredStrategy> ranked = rank(scored);
        if (ranked.isEmpty()) {
            log.warn("No strategy candidates could be built for {}", symbol);
        } else {
            ScoredStrategy top = ranked.get(0);
            log.info(
                    "Ranked {} candidates for {}: best {} ({}) score {}",
                    ranked.size(),
                    symbol,
                    top.strategy().getId(),
                    top.strategy().getType(),
                    top.score());
        }
        return ranked;
    }

    private List<Strategy> tryBuild(String symbol, String label, Supplier<Strategy> builder) {
        try {
            return List.of(builder.get());
        } catch (BaseException e) {
            log.warn("Skipping {} candidate for {}: [{}] {}", label, symbol, e.getErrorCode(), e.getMessage());
            return List.of();
        }
    }

    private IronCondorParams ironCondorParams() {
        return IronCondorParams.builder()
                .putWidth(strategyProperties.getWingWidth())
                .callWidth(strategyProperties.getWingWidth())
                .daysToExpiration(strategyProperties.getTargetDte())
                .deltaTarget(strategyProperties.getIronCondorDelta())
                .quantity(strategyProperties.getQuantity())
                .useSkew(strategyProperties.isUseSkew())
                .build();
    }

    private VerticalSpreadParams verticalParams(SpreadDirection direction) {
        return VerticalSpreadParams.builder()
                .direction(direction)
                .width(strategyProperties.getSpreadWidth())
                .daysToExpiration(strategyProperties.getTargetDte())
                .deltaTarget(strategyProperties.getVerticalDelta())
                .quantity(strategyProperties.getQuantity())
                .build();
    }
}
