package com.optionguard.strategy.scoring;

import com.optionguard.domain.enums.LegAction;
import com.optionguard.domain.enums.OptionRight;
import com.optionguard.domain.enums.StrategyType;
import com.optionguard.domain.model.Leg;
import com.optionguard.domain.model.OpenPosition;
import com.optionguard.domain.model.Strategy;
import com.optionguard.domain.model.StrategyAnalysis;
import com.optionguard.exception.StrategyBuildException;
import com.optionguard.exception.ValidationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Risk/reward metrics and a composite 0-100 score for one candidate strategy.
 *
 * <p><b>Credit and max risk.</b> A {@code credit} metadata entry (quoted net credit for the
 * whole position) is used when present, with max risk = width - credit. Without quotes a
 * credit structure is assumed to collect 100 per
 * contract and risk half of its widest wing. A debit vertical is assumed to cost half its
 * width; the {@code credit} field then carries the maximum reward.
 *
 * <p><b>Metrics.</b>
 * <ul>
 *   <li>POS = 100 - |short delta| x 100</li>
 *   <li>expected return = credit x POS - max risk x (1 - POS)</li>
 *   <li>expected return % = expected return / max risk x 100</li>
 * </ul>
 *
 * <p>Money amounts are carried as {@link BigDecimal} at two decimal places. Ratios,
 * percentages and scores stay {@code double}.
 *
 * <p><b>Score weights.</b> Risk/reward 30% (full marks at ratio 3 or below, zero at 10),
 * POS 30% (zero at 50%, full at 80%), expected return % 25% (full at 20%), IV rank 15%
 * (full inside 25-75, reduced above 75, lowest below 25).
 */
@Component
public class StrategyScorer {

    private static final Logger log = LoggerFactory.getLogger(StrategyScorer.class);

    public static final BigDecimal ESTIMATED_CREDIT_PER_CONTRACT = BigDecimal.valueOf(100);
    static final BigDecimal WIDTH_FRACTION = new BigDecimal("0.5");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    static final double DEFAULT_SHORT_DELTA = 0.20;

    private static final double RR_WEIGHT = 0.30;
    private static final double POS_WEIGHT = 0.30;
    private static final double ER_WEIGHT = 0.25;
    private static final double IV_WEIGHT = 0.15;

    private final Clock clock;

    public StrategyScorer(Clock clock) {
        this.clock = clock;
    }

    public StrategyAnalysis analyze(Strategy strategy, double ivRank) {
        int quantity = strategy.getLegs().stream().mapToInt(Leg::getQuantity).max().orElse(1);
        BigDecimal multiplier = BigDecimal.valueOf((long) OpenPosition.CONTRACT_MULTIPLIER * quantity);

        BigDecimal credit;
        BigDecimal maxRisk;
        if (strategy.getType() == StrategyType.CUSTOM) {
            credit = requireMetadata(strategy, "credit");
            maxRisk = requireMetadata(strategy, "max_risk");
        } else {
            BigDecimal width = BigDecimal.valueOf(widestWing(strategy)).multiply(multiplier);
            double quotedCredit = strategy.metadataDouble("credit", Double.NaN);
            if (!Double.isNaN(quotedCredit)) {
                credit = BigDecimal.valueOf(quotedCredit);
                maxRisk = width.subtract(credit);
            } else if (isDebitVertical(strategy)) {
                BigDecimal debit = width.multiply(WIDTH_FRACTION);
                maxRisk = debit;
                credit = width.subtract(debit);
            } else {
                credit = ESTIMATED_CREDIT_PER_CONTRACT.multiply(BigDecimal.valueOf(quantity));
                maxRisk = width.multiply(BigDecimal.ONE.subtract(WIDTH_FRACTION));
            }
        }

        double shortDelta = shortDelta(strategy);
        double pos = 100.0 - shortDelta * 100.0;
        BigDecimal p = BigDecimal.valueOf(pos).divide(HUNDRED, 6, RoundingMode.HALF_UP);
        BigDecimal expectedReturn = credit.multiply(p).subtract(maxRisk.multiply(BigDecimal.ONE.subtract(p)));
        double expectedReturnPct = maxRisk.signum() > 0
                ? expectedReturn.multiply(HUNDRED).divide(maxRisk, 6, RoundingMode.HALF_UP).doubleValue()
                : 0.0;
        double riskReward = credit.signum() > 0
                ? maxRisk.divide(credit, 6, RoundingMode.HALF_UP).doubleValue()
                : Double.POSITIVE_INFINITY;

        double score = RR_WEIGHT * riskRewardScore(riskReward)
                + POS_WEIGHT * probabilityScore(pos)
                + ER_WEIGHT * expectedReturnScore(expectedReturnPct)
                + IV_WEIGHT * ivRankScore(ivRank);

        StrategyAnalysis analysis = StrategyAnalysis.builder()
                .strategyId(strategy.getId())
                .symbol(strategy.getSymbol())
                .strategyType(strategy.getType())
                .credit(money(credit))
                .maxRisk(money(maxRisk))
                .riskRewardRatio(Double.isInfinite(riskReward) ? riskReward : round(riskReward, 2))
                .probabilityOfSuccess(round(pos, 1))
                .expectedReturn(money(expectedReturn))
                .expectedReturnPct(round(expectedReturnPct, 2))
                .ivRank(ivRank)
                .score(round(score, 1))
                .analyzedAt(LocalDateTime.now(clock))
                .build();

        log.debug(
                "Scored {}: credit={}, maxRisk={}, R/R={}, POS={}%, ER={}%, score={}",
                strategy.getId(),
                analysis.getCredit(),
                analysis.getMaxRisk(),
                analysis.getRiskRewardRatio(),
                analysis.getProbabilityOfSuccess(),
                analysis.getExpectedReturnPct(),
                analysis.getScore());
        return analysis;
    }

    // ---- component scores, each 0-100 ----

    /** Full marks at a risk/reward ratio of 3 or below, falling linearly to zero at 10. */
    public static double riskRewardScore(double ratio) {
        if (Double.isInfinite(ratio) || Double.isNaN(ratio)) {
            return 0.0;
        }
        return clamp(100.0 - (ratio - 3.0) * 100.0 / 7.0);
    }

    /** Zero at 50% probability of success or below, full at 80% and above. */
    public static double probabilityScore(double pos) {
        return clamp((pos - 50.0) * 100.0 / 30.0);
    }

    /** Full marks at an expected return of 20% of max risk. */
    public static double expectedReturnScore(double expectedReturnPct) {
        return clamp(expectedReturnPct * 5.0);
    }

    public static double ivRankScore(double ivRank) {
        if (ivRank >= 25 && ivRank <= 75) {
            return 100.0;
        }
        return ivRank > 75 ? 75.0 : 25.0;
    }

    // ---- structure helpers ----

    private double widestWing(Strategy strategy) {
        List<Leg> legs = strategy.getLegs();
        if (strategy.getType() == StrategyType.IRON_CONDOR) {
            double putWidth = pairWidth(legs, OptionRight.PUT);
            double callWidth = pairWidth(legs, OptionRight.CALL);
            return Math.max(putWidth, callWidth);
        }
        return Math.abs(legs.get(0).getStrike() - legs.get(1).getStrike());
    }

    private double pairWidth(List<Leg> legs, OptionRight right) {
        double[] strikes = legs.stream()
                .filter(leg -> leg.getRight() == right)
                .mapToDouble(Leg::getStrike)
                .toArray();
        if (strikes.length != 2) {
            throw new ValidationException("Iron condor needs two " + right + " legs, found " + strikes.length);
        }
        return Math.abs(strikes[0] - strikes[1]);
    }

    /** A vertical is a debit spread when the bought leg is nearer the money. */
    private boolean isDebitVertical(Strategy strategy) {
        if (strategy.getType() != StrategyType.VERTICAL_SPREAD) {
            return false;
        }
        Leg bought = strategy.getLegs().stream()
                .filter(leg -> leg.getAction() == LegAction.BUY)
                .findFirst()
                .orElseThrow(() -> new ValidationException("Vertical spread has no bought leg"));
        Leg sold = strategy.getShortLegs().stream()
                .findFirst()
                .orElseThrow(() -> new ValidationException("Vertical spread has no sold leg"));
        return bought.getRight().isCall()
                ? bought.getStrike() < sold.getStrike()
                : bought.getStrike() > sold.getStrike();
    }

    private double shortDelta(Strategy strategy) {
        double fallback = strategy.metadataDouble("delta_target", DEFAULT_SHORT_DELTA);
        if (strategy.getType() == StrategyType.IRON_CONDOR) {
            double put = Math.abs(strategy.metadataDouble("short_put_delta", fallback));
            double call = Math.abs(strategy.metadataDouble("short_call_delta", fallback));
            return Math.max(put, call);
        }
        return Math.abs(strategy.metadataDouble("short_delta", fallback));
    }

    private BigDecimal requireMetadata(Strategy strategy, String key) {
        double value = strategy.metadataDouble(key, Double.NaN);
        if (Double.isNaN(value)) {
            throw new StrategyBuildException(
                    "Custom strategy " + strategy.getId() + " needs numeric '" + key + "' metadata to be scored",
                    Map.of("strategyId", strategy.getId(), "missingKey", key));
        }
        return BigDecimal.valueOf(value);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    private static double round(double value, int places) {
        double factor = Math.pow(10, places);
        return Math.round(value * factor) / factor;
    }
}
