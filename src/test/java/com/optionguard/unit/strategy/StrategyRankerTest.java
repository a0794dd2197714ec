package com.optionguard.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.optionguard.config.StrategyProperties;
import com.optionguard.domain.enums.LegAction;
import com.optionguard.domain.enums.OptionRight;
import com.optionguard.domain.enums.SpreadDirection;
import com.optionguard.domain.enums.StrategyType;
import com.optionguard.domain.model.Strategy;
import com.optionguard.domain.model.StrategyAnalysis;
import com.optionguard.exception.NoDataException;
import com.optionguard.exception.StrategyBuildException;
import com.optionguard.strategy.builder.IronCondorBuilder;
import com.optionguard.strategy.builder.IronCondorParams;
import com.optionguard.strategy.builder.VerticalSpreadBuilder;
import com.optionguard.strategy.builder.VerticalSpreadParams;
import com.optionguard.strategy.scoring.ScoredStrategy;
import com.optionguard.strategy.scoring.StrategyRanker;
import com.optionguard.strategy.scoring.StrategyScorer;
import com.optionguard.unit.Fixtures;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatcher;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StrategyRankerTest {

    @Mock
    private IronCondorBuilder ironCondorBuilder;

    @Mock
    private VerticalSpreadBuilder verticalSpreadBuilder;

    private StrategyRanker ranker;

    @BeforeEach
    void setUp() {
        ranker = new StrategyRanker(
                ironCondorBuilder, verticalSpreadBuilder, new StrategyScorer(Clock.systemUTC()), new StrategyProperties());
    }

    private static ScoredStrategy scored(String id, double score) {
        Strategy strategy = Fixtures.ironCondor(id, "SPY", 30);
        return new ScoredStrategy(
                strategy,
                StrategyAnalysis.builder().strategyId(id).score(score).build());
    }

    private static Strategy vertical(String id, OptionRight right, double sold, double bought, double shortDelta) {
        LocalDate expiry = Fixtures.expiryInDays(45);
        return Strategy.builder()
                .id(id)
                .symbol("SPY")
                .type(StrategyType.VERTICAL_SPREAD)
                .legs(List.of(
                        Fixtures.leg(right, Math.min(sold, bought), sold < bought ? LegAction.SELL : LegAction.BUY, expiry),
                        Fixtures.leg(right, Math.max(sold, bought), sold < bought ? LegAction.BUY : LegAction.SELL, expiry)))
                .metadata(Map.of("short_delta", shortDelta))
                .build();
    }

    private static ArgumentMatcher<VerticalSpreadParams> direction(SpreadDirection direction) {
        return params -> params != null && params.getDirection() == direction;
    }

    @Test
    @DisplayName("Ranking is descending by score")
    void descending() {
        List<ScoredStrategy> ranked = ranker.rank(List.of(scored("A", 40), scored("B", 70), scored("C", 55)));

        assertThat(ranked).extracting(s -> s.strategy().getId()).containsExactly("B", "C", "A");
    }

    @Test
    @DisplayName("Equal scores keep their input order")
    void stableOnTies() {
        List<ScoredStrategy> ranked = ranker.rank(List.of(scored("A", 50), scored("B", 60), scored("C", 50)));

        assertThat(ranked).extracting(s -> s.strategy().getId()).containsExactly("B", "A", "C");
    }

    @Test
    @DisplayName("A candidate that fails to build is skipped and the rest are ranked")
    void skipsFailedCandidate() {
        when(ironCondorBuilder.build(eq("SPY"), eq(400.0), any(IronCondorParams.class)))
                .thenThrow(new StrategyBuildException("short put above short call"));
        when(verticalSpreadBuilder.build(eq("SPY"), eq(400.0), argThat(direction(SpreadDirection.BULL_PUT))))
                .thenReturn(vertical("VS-PUT", OptionRight.PUT, 380, 375, -0.10));
        when(verticalSpreadBuilder.build(eq("SPY"), eq(400.0), argThat(direction(SpreadDirection.BEAR_CALL))))
                .thenReturn(vertical("VS-CALL", OptionRight.CALL, 420, 425, 0.20));

        List<ScoredStrategy> ranked = ranker.buildAndRank("SPY", 400.0, 50);

        assertThat(ranked).extracting(s -> s.strategy().getId()).containsExactly("VS-PUT", "VS-CALL");
        assertThat(ranked.get(0).score()).isGreaterThan(ranked.get(1).score());
    }

    @Test
    @DisplayName("No buildable candidate yields an empty ranking")
    void allFail() {
        when(ironCondorBuilder.build(eq("SPY"), eq(400.0), any(IronCondorParams.class)))
                .thenThrow(new NoDataException("no chain"));
        when(verticalSpreadBuilder.build(eq("SPY"), eq(400.0), any(VerticalSpreadParams.class)))
                .thenThrow(new NoDataException("no chain"));

        assertThat(ranker.buildAndRank("SPY", 400.0, 50)).isEmpty();
    }
}
