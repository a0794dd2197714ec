package com.optionguard.monitor;

import com.optionguard.config.TrailingStopProperties;
import com.optionguard.domain.enums.DecisionAction;
import com.optionguard.domain.enums.Urgency;
import com.optionguard.domain.model.Decision;
import com.optionguard.domain.model.MarketContext;
import com.optionguard.domain.model.OpenPosition;
import com.optionguard.domain.model.PositionSnapshot;
import com.optionguard.domain.model.StrategyHealth;
import com.optionguard.event.DecisionEvent;
import com.optionguard.marketdata.MarketContextProvider;
import com.optionguard.observability.PositionHistoryWriter;
import com.optionguard.observability.RiskEventLog;
import com.optionguard.risk.LimitCheckResult;
import com.optionguard.risk.PortfolioRiskAggregator;
import com.optionguard.risk.PortfolioRiskLimiter;
import com.optionguard.risk.PortfolioRiskSnapshot;
import com.optionguard.risk.TradingCircuitBreaker;
import com.optionguard.risk.TradingPermission;
import com.optionguard.risk.TrailingStop;
import com.optionguard.risk.TrailingStopConfig;
import com.optionguard.risk.TrailingStopManager;
import com.optionguard.risk.TrailingStopUpdate;
import com.optionguard.strategy.builder.StrategyHealthChecker;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Produces one {@link Decision} per open position per monitoring cycle.
 *
 * <p>Per position, in order:
 * <ol>
 *   <li>Trailing stop update. A TRIGGER closes at IMMEDIATE urgency and skips every
 *       other check.</li>
 *   <li>Structural health. A broken strategy closes at HIGH urgency.</li>
 *   <li>Rule evaluation by the {@link DecisionEvaluator}.</li>
 *   <li>Gating: a decision that adds exposure (ROLL, ENTER) becomes HOLD when the circuit
 *       breaker refuses trading or the portfolio limiter rejects the position. CLOSE is
 *       never gated.</li>
 * </ol>
 *
 * <p>Each decision is written to the {@link RiskEventLog} and published as a
 * {@link DecisionEvent}. Once per cycle the portfolio health check runs and the marks of
 * all monitored positions go to position history. A failure on one position is logged
 * and the cycle continues with the next.
 */
@Service
public class PositionMonitor {

    private static final Logger log = LoggerFactory.getLogger(PositionMonitor.class);

    public static final String RULE_TRAILING_STOP = "TrailingStop";
    public static final String RULE_BROKEN_STRATEGY = "BrokenStrategy";
    public static final String RULE_CIRCUIT_BREAKER = "CircuitBreaker";
    public static final String RULE_RISK_LIMITER = "PortfolioRiskLimiter";

    private final OpenPositionSource openPositionSource;
    private final TrailingStopManager trailingStopManager;
    private final TrailingStopProperties trailingStopProperties;
    private final TradingCircuitBreaker tradingCircuitBreaker;
    private final PortfolioRiskLimiter portfolioRiskLimiter;
    private final PortfolioRiskAggregator portfolioRiskAggregator;
    private final DecisionEvaluator decisionEvaluator;
    private final MarketContextProvider marketContextProvider;
    private final StrategyHealthChecker strategyHealthChecker;
    private final PositionHistoryWriter positionHistoryWriter;
    private final RiskEventLog riskEventLog;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public PositionMonitor(
            OpenPositionSource openPositionSource,
            TrailingStopManager trailingStopManager,
            TrailingStopProperties trailingStopProperties,
            TradingCircuitBreaker tradingCircuitBreaker,
            PortfolioRiskLimiter portfolioRiskLimiter,
            PortfolioRiskAggregator portfolioRiskAggregator,
            DecisionEvaluator decisionEvaluator,
            MarketContextProvider marketContextProvider,
            StrategyHealthChecker strategyHealthChecker,
            PositionHistoryWriter positionHistoryWriter,
            RiskEventLog riskEventLog,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.openPositionSource = openPositionSource;
        this.trailingStopManager = trailingStopManager;
        this.trailingStopProperties = trailingStopProperties;
        this.tradingCircuitBreaker = tradingCircuitBreaker;
        this.portfolioRiskLimiter = portfolioRiskLimiter;
        this.portfolioRiskAggregator = portfolioRiskAggregator;
        this.decisionEvaluator = decisionEvaluator;
        this.marketContextProvider = marketContextProvider;
        this.strategyHealthChecker = strategyHealthChecker;
        this.positionHistoryWriter = positionHistoryWriter;
        this.riskEventLog = riskEventLog;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    // ========================
    // MONITORING CYCLE
    // ========================

    /**
     * Runs one monitoring cycle over every open position.
     *
     * @return decisions keyed by execution id, in position order; positions whose
     *     evaluation failed are absent
     */
    public Map<String, Decision> monitorPositions() {
        List<OpenPosition> positions = openPositionSource.getOpenPositions();
        if (positions.isEmpty()) {
            log.debug("No open positions to monitor");
            return Map.of();
        }

        PortfolioRiskSnapshot risk = portfolioRiskAggregator.currentRisk();
        runHealthCheck(risk);
        TradingPermission permission = tradingCircuitBreaker.isTradingAllowed();

        Map<String, Decision> decisions = new LinkedHashMap<>();
        List<PositionSnapshot> history = new ArrayList<>();
        for (OpenPosition position : positions) {
            try {
                MonitoredPosition result = evaluate(position, risk, permission);
                history.add(result.snapshot());
                decisions.put(position.getExecutionId(), result.decision());
            } catch (RuntimeException e) {
                log.error("Failed to monitor position {}: {}", position.getExecutionId(), e.getMessage(), e);
            }
        }

        positionHistoryWriter.write(history);
        long actionable = decisions.values().stream().filter(d -> !d.isHold()).count();
        log.info("Monitoring cycle complete: {} positions, {} actionable decisions", decisions.size(), actionable);
        return decisions;
    }

    /**
     * Evaluates a single position outside the scheduled cycle, against fresh portfolio
     * risk and breaker state. Position history is written for it as well.
     */
    public Decision monitorPosition(OpenPosition position) {
        MonitoredPosition result = evaluate(
                position, portfolioRiskAggregator.currentRisk(), tradingCircuitBreaker.isTradingAllowed());
        positionHistoryWriter.write(List.of(result.snapshot()));
        return result.decision();
    }

    // ========================
    // TRAILING STOPS
    // ========================

    /**
     * Opts a position into trailing-stop protection.
     *
     * @param config null for the configured defaults
     */
    public TrailingStop enableTrailingStop(String executionId, double entryPremium, TrailingStopConfig config) {
        TrailingStopConfig effective = config != null ? config : trailingStopProperties.toConfig();
        return trailingStopManager.add(executionId, entryPremium, effective);
    }

    public boolean disableTrailingStop(String executionId) {
        return trailingStopManager.remove(executionId);
    }

    // ---- per-position evaluation ----

    private MonitoredPosition evaluate(OpenPosition position, PortfolioRiskSnapshot risk, TradingPermission permission) {
        String executionId = position.getExecutionId();
        Optional<TrailingStopUpdate> stopUpdate = trailingStopManager.get(executionId).isPresent()
                ? Optional.of(trailingStopManager.update(executionId, position.getCurrentPremium()))
                : Optional.empty();

        PositionSnapshot snapshot = snapshot(position);
        Decision decision;
        if (stopUpdate.isPresent() && stopUpdate.get().isTriggered()) {
            decision = trailingStopClose(position, stopUpdate.get());
            trailingStopManager.remove(executionId);
        } else {
            decision = evaluateRules(position, snapshot, risk, permission);
        }

        record(position, decision);
        return new MonitoredPosition(snapshot, decision);
    }

    private Decision evaluateRules(
            OpenPosition position, PositionSnapshot snapshot, PortfolioRiskSnapshot risk, TradingPermission permission) {
        StrategyHealth health = strategyHealthChecker.check(position.getStrategy());
        if (health.isBroken()) {
            return Decision.builder()
                    .action(DecisionAction.CLOSE)
                    .urgency(Urgency.HIGH)
                    .reason("Strategy broken: " + health.getReason())
                    .rule(RULE_BROKEN_STRATEGY)
                    .metadata(Map.of("strategy_id", position.getStrategy().getId()))
                    .build();
        }

        MarketContext context = marketContextProvider.getContext(position.getSymbol());
        Decision decision = decisionEvaluator.evaluate(snapshot, context);
        return gate(decision, snapshot, risk, permission);
    }

    private Decision gate(
            Decision decision, PositionSnapshot snapshot, PortfolioRiskSnapshot risk, TradingPermission permission) {
        if (!decision.getAction().addsExposure()) {
            return decision;
        }
        if (!permission.allowed()) {
            return blocked(decision, RULE_CIRCUIT_BREAKER, permission.reason());
        }
        // A roll replaces the position it closes, so its own exposure leaves the base
        PortfolioRiskSnapshot base = decision.getAction() == DecisionAction.ROLL
                ? portfolioRiskAggregator.currentRiskExcluding(snapshot.getExecutionId())
                : risk;
        LimitCheckResult limitCheck = portfolioRiskLimiter.checkEntry(
                snapshot.getSymbol(), snapshot.getDelta(), snapshot.getPositionValue(), base);
        if (!limitCheck.allowed()) {
            return blocked(decision, RULE_RISK_LIMITER, limitCheck.reason().orElse("limit rejected"));
        }
        return decision;
    }

    private Decision blocked(Decision original, String rule, String reason) {
        log.warn("{} by {} blocked: {}", original.getAction(), original.getRule(), reason);
        return Decision.builder()
                .action(DecisionAction.HOLD)
                .urgency(Urgency.LOW)
                .reason(String.format("%s blocked: %s", original.getAction(), reason))
                .rule(rule)
                .metadata(Map.of(
                        "blocked_action", original.getAction().name(),
                        "blocked_rule", original.getRule(),
                        "blocked_reason", original.getReason()))
                .build();
    }

    private Decision trailingStopClose(OpenPosition position, TrailingStopUpdate update) {
        TrailingStop stop = trailingStopManager.get(position.getExecutionId()).orElseThrow();
        return Decision.builder()
                .action(DecisionAction.CLOSE)
                .urgency(Urgency.IMMEDIATE)
                .reason(String.format(
                        "Trailing stop triggered at %.2f (current premium: %.2f)",
                        update.stopPremium(),
                        position.getCurrentPremium()))
                .rule(RULE_TRAILING_STOP)
                .metadata(Map.of(
                        "stop_premium", update.stopPremium(),
                        "current_premium", position.getCurrentPremium(),
                        "highest_premium", stop.getHighestPremium(),
                        "entry_premium", stop.getEntryPremium()))
                .build();
    }

    private PositionSnapshot snapshot(OpenPosition position) {
        double entryValue = position.entryValue();
        double highest = trailingStopManager.get(position.getExecutionId())
                .map(TrailingStop::getHighestPremium)
                .orElse(Math.max(position.getEntryPremium(), position.getCurrentPremium()));
        long dte = ChronoUnit.DAYS.between(LocalDate.now(clock), position.getStrategy().getExpiration());

        return PositionSnapshot.builder()
                .executionId(position.getExecutionId())
                .symbol(position.getSymbol())
                .strategyType(position.getStrategy().getType())
                .quantity(position.getQuantity())
                .entryPremium(position.getEntryPremium())
                .currentPremium(position.getCurrentPremium())
                .highestPremium(highest)
                .unrealizedPnl(position.getUnrealizedPnl())
                .unrealizedPnlPct(entryValue != 0 ? position.getUnrealizedPnl() / Math.abs(entryValue) : 0)
                .daysToExpiration(dte)
                .delta(position.getDelta())
                .gamma(position.getGamma())
                .positionValue(Math.abs(position.marketValue()))
                .capturedAt(LocalDateTime.now(clock))
                .build();
    }

    private void runHealthCheck(PortfolioRiskSnapshot risk) {
        try {
            portfolioRiskLimiter.checkPortfolioHealth(risk);
        } catch (RuntimeException e) {
            log.error("Portfolio health check failed: {}", e.getMessage(), e);
        }
    }

    private void record(OpenPosition position, Decision decision) {
        if (!decision.isHold()) {
            log.info(
                    "Decision for {} ({}): {} [{}] by {}: {}",
                    position.getExecutionId(),
                    position.getSymbol(),
                    decision.getAction(),
                    decision.getUrgency(),
                    decision.getRule(),
                    decision.getReason());
        }
        riskEventLog.logDecision(position.getExecutionId(), position.getSymbol(), decision);
        applicationEventPublisher.publishEvent(
                new DecisionEvent(this, position.getExecutionId(), position.getSymbol(), decision));
    }

    private record MonitoredPosition(PositionSnapshot snapshot, Decision decision) {}
}
