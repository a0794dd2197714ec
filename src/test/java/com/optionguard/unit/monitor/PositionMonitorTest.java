package com.optionguard.unit.monitor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.optionguard.config.RiskConfig.CorrelationGroups;
import com.optionguard.config.TrailingStopProperties;
import com.optionguard.domain.enums.DecisionAction;
import com.optionguard.domain.enums.StrategyStatus;
import com.optionguard.domain.enums.Urgency;
import com.optionguard.domain.model.Decision;
import com.optionguard.domain.model.MarketContext;
import com.optionguard.domain.model.OpenPosition;
import com.optionguard.domain.model.PositionSnapshot;
import com.optionguard.domain.model.Strategy;
import com.optionguard.event.DecisionEvent;
import com.optionguard.exception.NoDataException;
import com.optionguard.marketdata.MarketContextProvider;
import com.optionguard.monitor.DecisionEvaluator;
import com.optionguard.monitor.OpenPositionSource;
import com.optionguard.monitor.PositionMonitor;
import com.optionguard.observability.PositionHistoryWriter;
import com.optionguard.observability.RiskEventLog;
import com.optionguard.risk.LimitCheckResult;
import com.optionguard.risk.PortfolioRiskAggregator;
import com.optionguard.risk.PortfolioRiskLimiter;
import com.optionguard.risk.PortfolioRiskSnapshot;
import com.optionguard.risk.PositionBookRiskAggregator;
import com.optionguard.risk.RiskLimitsConfig;
import com.optionguard.risk.RiskViolation;
import com.optionguard.risk.TradingCircuitBreaker;
import com.optionguard.risk.TradingPermission;
import com.optionguard.risk.TrailingStop;
import com.optionguard.risk.TrailingStopManager;
import com.optionguard.strategy.builder.StrategyHealthChecker;
import com.optionguard.strategy.builder.StrategyValidator;
import com.optionguard.unit.Fixtures;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class PositionMonitorTest {

    @Mock
    private OpenPositionSource openPositionSource;

    @Mock
    private TradingCircuitBreaker tradingCircuitBreaker;

    @Mock
    private PortfolioRiskLimiter portfolioRiskLimiter;

    @Mock
    private PortfolioRiskAggregator portfolioRiskAggregator;

    @Mock
    private DecisionEvaluator decisionEvaluator;

    @Mock
    private MarketContextProvider marketContextProvider;

    @Mock
    private PositionHistoryWriter positionHistoryWriter;

    @Mock
    private RiskEventLog riskEventLog;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    @Captor
    private ArgumentCaptor<List<PositionSnapshot>> historyCaptor;

    private TrailingStopManager trailingStopManager;
    private PositionMonitor positionMonitor;

    private final PortfolioRiskSnapshot risk = PortfolioRiskSnapshot.empty();

    @BeforeEach
    void setUp() {
        trailingStopManager = new TrailingStopManager(riskEventLog);
        positionMonitor = new PositionMonitor(
                openPositionSource,
                trailingStopManager,
                new TrailingStopProperties(),
                tradingCircuitBreaker,
                portfolioRiskLimiter,
                portfolioRiskAggregator,
                decisionEvaluator,
                marketContextProvider,
                new StrategyHealthChecker(new StrategyValidator()),
                positionHistoryWriter,
                riskEventLog,
                applicationEventPublisher,
                Clock.systemDefaultZone());
    }

    private OpenPosition position(String id, String symbol, double entry, double current) {
        return Fixtures.position(id, Fixtures.ironCondor(id, symbol, 30), entry, current);
    }

    private void givenRiskAndPermission(TradingPermission permission) {
        when(portfolioRiskAggregator.currentRisk()).thenReturn(risk);
        when(tradingCircuitBreaker.isTradingAllowed()).thenReturn(permission);
    }

    private void givenRuleDecision(Decision decision) {
        when(marketContextProvider.getContext(anyString()))
                .thenAnswer(inv -> MarketContext.builder().symbol(inv.getArgument(0)).build());
        when(decisionEvaluator.evaluate(any(PositionSnapshot.class), any(MarketContext.class))).thenReturn(decision);
    }

    private static Decision roll() {
        return Decision.builder()
                .action(DecisionAction.ROLL)
                .urgency(Urgency.NORMAL)
                .reason("14 days to expiration, inside the 21-day roll window")
                .rule("ExpirationRoll")
                .build();
    }

    // ==============================
    // TRAILING STOP
    // ==============================

    @Nested
    @DisplayName("Trailing stop")
    class TrailingStops {

        @Test
        @DisplayName("A triggered stop closes immediately and skips the rules")
        void triggerShortCircuits() {
            givenRiskAndPermission(TradingPermission.allow("Circuit breaker CLOSED"));
            positionMonitor.enableTrailingStop("EX-1", 1.00, null);
            trailingStopManager.update("EX-1", 1.03);
            trailingStopManager.update("EX-1", 1.05);

            Decision decision = positionMonitor.monitorPosition(position("EX-1", "SPY", 1.00, 1.03));

            assertThat(decision.getAction()).isEqualTo(DecisionAction.CLOSE);
            assertThat(decision.getUrgency()).isEqualTo(Urgency.IMMEDIATE);
            assertThat(decision.getRule()).isEqualTo(PositionMonitor.RULE_TRAILING_STOP);
            assertThat(decision.getReason()).startsWith("Trailing stop triggered at ");
            verify(decisionEvaluator, never()).evaluate(any(), any());
            verify(riskEventLog).logDecision("EX-1", "SPY", decision);
            assertThat(decision.getMetadata()).containsEntry("highest_premium", 1.05);
            assertThat(trailingStopManager.get("EX-1")).isEmpty();
        }

        @Test
        @DisplayName("Enabling without a config uses the configured defaults")
        void enableWithDefaults() {
            TrailingStop stop = positionMonitor.enableTrailingStop("EX-2", 2.00, null);

            assertThat(stop.getConfig().getActivationPct()).isEqualTo(2.0);
            assertThat(trailingStopManager.get("EX-2")).containsSame(stop);
            assertThat(positionMonitor.disableTrailingStop("EX-2")).isTrue();
            assertThat(trailingStopManager.get("EX-2")).isEmpty();
        }
    }

    // ==============================
    // RULES AND GATING
    // ==============================

    @Nested
    @DisplayName("Rules and gating")
    class Gating {

        @Test
        @DisplayName("A broken strategy closes at high urgency")
        void brokenStrategy() {
            givenRiskAndPermission(TradingPermission.allow("ok"));
            Strategy unfilled = Fixtures.ironCondor("EX-3", "SPY", 30)
                    .withStatus(StrategyStatus.OPEN);
            OpenPosition position = OpenPosition.builder()
                    .executionId("EX-3")
                    .strategy(unfilled)
                    .quantity(1)
                    .entryPremium(1.0)
                    .currentPremium(1.0)
                    .build();

            Decision decision = positionMonitor.monitorPosition(position);

            assertThat(decision.getAction()).isEqualTo(DecisionAction.CLOSE);
            assertThat(decision.getUrgency()).isEqualTo(Urgency.HIGH);
            assertThat(decision.getRule()).isEqualTo(PositionMonitor.RULE_BROKEN_STRATEGY);
            verify(decisionEvaluator, never()).evaluate(any(), any());
        }

        @Test
        @DisplayName("An open breaker turns a roll into a hold")
        void breakerBlocksRoll() {
            givenRiskAndPermission(TradingPermission.deny("Circuit breaker OPEN after 3 failures"));
            givenRuleDecision(roll());

            Decision decision = positionMonitor.monitorPosition(position("EX-4", "SPY", 1.0, 1.0));

            assertThat(decision.getAction()).isEqualTo(DecisionAction.HOLD);
            assertThat(decision.getUrgency()).isEqualTo(Urgency.LOW);
            assertThat(decision.getRule()).isEqualTo(PositionMonitor.RULE_CIRCUIT_BREAKER);
            assertThat(decision.getReason()).isEqualTo("ROLL blocked: Circuit breaker OPEN after 3 failures");
            assertThat(decision.getMetadata())
                    .containsEntry("blocked_action", "ROLL")
                    .containsEntry("blocked_rule", "ExpirationRoll");
            verify(portfolioRiskLimiter, never()).checkEntry(anyString(), anyDouble(), anyDouble(), any());
        }

        @Test
        @DisplayName("A limiter rejection turns a roll into a hold")
        void limiterBlocksRoll() {
            givenRiskAndPermission(TradingPermission.allow("ok"));
            givenRuleDecision(roll());
            PortfolioRiskSnapshot withoutPosition = PortfolioRiskSnapshot.empty();
            when(portfolioRiskAggregator.currentRiskExcluding("EX-5")).thenReturn(withoutPosition);
            when(portfolioRiskLimiter.checkEntry(eq("SPY"), anyDouble(), anyDouble(), eq(withoutPosition)))
                    .thenReturn(LimitCheckResult.reject(RiskViolation.of(
                            PortfolioRiskLimiter.PORTFOLIO_DELTA, "Portfolio delta would exceed limit: 55.0 > 50.0", 55, 50)));

            Decision decision = positionMonitor.monitorPosition(position("EX-5", "SPY", 1.0, 1.0));

            assertThat(decision.getAction()).isEqualTo(DecisionAction.HOLD);
            assertThat(decision.getRule()).isEqualTo(PositionMonitor.RULE_RISK_LIMITER);
            assertThat(decision.getReason()).contains("55.0 > 50.0");
        }

        @Test
        @DisplayName("A close is never gated")
        void closeNotGated() {
            givenRiskAndPermission(TradingPermission.deny("Circuit breaker OPEN after 3 failures"));
            Decision close = Decision.builder()
                    .action(DecisionAction.CLOSE)
                    .urgency(Urgency.NORMAL)
                    .reason("Profit target reached")
                    .rule("TakeProfit")
                    .build();
            givenRuleDecision(close);

            Decision decision = positionMonitor.monitorPosition(position("EX-6", "SPY", 1.0, 0.2));

            assertThat(decision).isSameAs(close);
        }
    }

    // ==============================
    // ROLL AGAINST THE REAL LIMITER
    // ==============================

    @Nested
    @DisplayName("Roll gating with the position book")
    class RollAgainstBook {

        private PositionMonitor bookMonitor;

        @BeforeEach
        void setUp() {
            RiskLimitsConfig limits = RiskLimitsConfig.builder()
                    .maxPortfolioDelta(50.0)
                    .maxPerSymbolDelta(40.0)
                    .maxSinglePositionPct(1.0)
                    .maxCorrelatedPct(1.0)
                    .build();
            bookMonitor = new PositionMonitor(
                    openPositionSource,
                    trailingStopManager,
                    new TrailingStopProperties(),
                    tradingCircuitBreaker,
                    new PortfolioRiskLimiter(limits, riskEventLog),
                    new PositionBookRiskAggregator(openPositionSource, new CorrelationGroups(), 100_000, Clock.systemUTC()),
                    decisionEvaluator,
                    marketContextProvider,
                    new StrategyHealthChecker(new StrategyValidator()),
                    positionHistoryWriter,
                    riskEventLog,
                    applicationEventPublisher,
                    Clock.systemDefaultZone());
            when(tradingCircuitBreaker.isTradingAllowed()).thenReturn(TradingPermission.allow("ok"));
            givenRuleDecision(roll());
        }

        private OpenPosition withDelta(String id, String symbol, double delta) {
            OpenPosition position = position(id, symbol, 1.0, 1.0);
            position.setDelta(delta);
            return position;
        }

        @Test
        @DisplayName("A rolled position does not count against itself")
        void rollReplacesOwnExposure() {
            when(openPositionSource.getOpenPositions()).thenReturn(List.of(withDelta("EX-R", "SPY", 30)));

            Map<String, Decision> decisions = bookMonitor.monitorPositions();

            assertThat(decisions.get("EX-R").getAction()).isEqualTo(DecisionAction.ROLL);
            assertThat(decisions.get("EX-R").getRule()).isEqualTo("ExpirationRoll");
        }

        @Test
        @DisplayName("The rest of the book still counts toward a roll")
        void otherPositionsStillCount() {
            when(openPositionSource.getOpenPositions())
                    .thenReturn(List.of(withDelta("EX-R", "SPY", 30), withDelta("EX-S", "QQQ", 25)));

            Map<String, Decision> decisions = bookMonitor.monitorPositions();

            // 25 + 30 against a limit of 50 from either side
            assertThat(decisions.values()).allSatisfy(decision -> {
                assertThat(decision.getAction()).isEqualTo(DecisionAction.HOLD);
                assertThat(decision.getRule()).isEqualTo(PositionMonitor.RULE_RISK_LIMITER);
                assertThat(decision.getReason()).contains("55.0 > 50.0");
            });
            assertThat(decisions).hasSize(2);
        }
    }

    // ==============================
    // CYCLE
    // ==============================

    @Nested
    @DisplayName("Monitoring cycle")
    class Cycle {

        @Test
        @DisplayName("An empty book does no work")
        void emptyBook() {
            when(openPositionSource.getOpenPositions()).thenReturn(List.of());

            assertThat(positionMonitor.monitorPositions()).isEmpty();
            verify(portfolioRiskAggregator, never()).currentRisk();
            verify(positionHistoryWriter, never()).write(anyList());
        }

        @Test
        @DisplayName("A failing position is skipped and the rest are decided")
        void failureIsolation() {
            when(openPositionSource.getOpenPositions())
                    .thenReturn(List.of(position("EX-A", "SPY", 1.0, 1.0), position("EX-B", "QQQ", 1.0, 1.0)));
            givenRiskAndPermission(TradingPermission.allow("ok"));
            when(marketContextProvider.getContext("SPY")).thenThrow(new NoDataException("no quote for SPY"));
            when(marketContextProvider.getContext("QQQ"))
                    .thenReturn(MarketContext.builder().symbol("QQQ").build());
            when(decisionEvaluator.evaluate(any(PositionSnapshot.class), any(MarketContext.class)))
                    .thenReturn(Decision.hold("No rule triggered", "Default"));

            Map<String, Decision> decisions = positionMonitor.monitorPositions();

            assertThat(decisions).containsOnlyKeys("EX-B");
            verify(portfolioRiskLimiter).checkPortfolioHealth(risk);
            verify(positionHistoryWriter, times(1)).write(historyCaptor.capture());
            assertThat(historyCaptor.getValue()).extracting(PositionSnapshot::getExecutionId).containsExactly("EX-B");
            verify(applicationEventPublisher, times(1)).publishEvent(any(DecisionEvent.class));
        }

        @Test
        @DisplayName("Snapshots carry P&L percent and days to expiration")
        void snapshotFields() {
            when(openPositionSource.getOpenPositions()).thenReturn(List.of(position("EX-C", "SPY", 2.0, 1.0)));
            givenRiskAndPermission(TradingPermission.allow("ok"));
            givenRuleDecision(Decision.hold("No rule triggered", "Default"));

            positionMonitor.monitorPositions();

            verify(positionHistoryWriter).write(historyCaptor.capture());
            PositionSnapshot snapshot = historyCaptor.getValue().get(0);
            // entry value 200, P&L (2.0 - 1.0) * 100 = 100
            assertThat(snapshot.getUnrealizedPnlPct()).isEqualTo(0.5);
            assertThat(snapshot.getDaysToExpiration()).isEqualTo(30);
            assertThat(snapshot.getPositionValue()).isEqualTo(100.0);
        }
    }
}
