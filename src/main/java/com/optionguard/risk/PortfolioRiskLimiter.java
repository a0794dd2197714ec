package com.optionguard.risk;

import com.optionguard.observability.RiskEventLog;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Portfolio-wide exposure gate for new and existing positions.
 *
 * <p>Three operations:
 * <ul>
 *   <li>{@link #checkEntry}: six ordered checks, stops at the first breach</li>
 *   <li>{@link #checkPortfolioHealth}: every check against the current book, all breaches returned</li>
 *   <li>{@link #remainingCapacity}: per-symbol headroom on each dimension</li>
 * </ul>
 *
 * <p>Concentration and correlated-exposure ratios include the new position in the
 * denominator. On an empty book both ratios are 100%, so a first position is admitted only
 * when the corresponding limit is 1.0.
 */
@Service
public class PortfolioRiskLimiter {

    private static final Logger log = LoggerFactory.getLogger(PortfolioRiskLimiter.class);

    public static final String PORTFOLIO_DELTA = "PORTFOLIO_DELTA";
    public static final String PORTFOLIO_GAMMA = "PORTFOLIO_GAMMA";
    public static final String SYMBOL_DELTA = "SYMBOL_DELTA";
    public static final String CONCENTRATION = "CONCENTRATION";
    public static final String CORRELATED_EXPOSURE = "CORRELATED_EXPOSURE";
    public static final String EXPOSURE_CAP = "EXPOSURE_CAP";

    private final RiskLimitsConfig limits;
    private final RiskEventLog riskEventLog;

    public PortfolioRiskLimiter(RiskLimitsConfig limits, RiskEventLog riskEventLog) {
        this.limits = limits;
        this.riskEventLog = riskEventLog;
    }

    // ========================
    // ENTRY CHECK
    // ========================

    /**
     * Validates a prospective position against the current portfolio.
     *
     * @param symbol        underlying symbol of the new position
     * @param proposedDelta position-level delta the new position would add
     * @param positionValue notional value of the new position
     * @param snapshot      current aggregated portfolio risk
     * @return allowed, or rejected with the first breached limit
     */
    public LimitCheckResult checkEntry(
            String symbol, double proposedDelta, double positionValue, PortfolioRiskSnapshot snapshot) {
        PortfolioGreeks greeks = snapshot.getGreeks();
        ExposureMetrics exposure = snapshot.getExposure();

        Optional<RiskViolation> violation = checkPortfolioDelta(greeks.getDelta() + proposedDelta)
                .or(() -> checkPortfolioGamma(greeks.getGamma()))
                .or(() -> checkSymbolDelta(symbol, greeks.deltaFor(symbol) + proposedDelta))
                .or(() -> checkConcentration(positionValue, exposure.getTotalExposure()))
                .or(() -> checkCorrelated(
                        symbol, exposure.correlatedFractionFor(symbol), positionValue, exposure.getTotalExposure()))
                .or(() -> checkExposureCap(exposure.getTotalExposure() + positionValue));

        if (violation.isPresent()) {
            RiskViolation v = violation.get();
            log.warn("Entry rejected for {}: {}", symbol, v.getMessage());
            riskEventLog.logLimitCheck(symbol, false, v);
            return LimitCheckResult.reject(v);
        }

        log.debug("Entry allowed for {}: delta={}, value={}", symbol, proposedDelta, positionValue);
        riskEventLog.logLimitCheck(symbol, true, null);
        return LimitCheckResult.allow();
    }

    // ========================
    // PASSIVE HEALTH CHECK
    // ========================

    /**
     * Runs every limit against the current portfolio with nothing added and returns
     * all breaches. Per-symbol checks run once for every symbol in the snapshot.
     */
    public List<RiskViolation> checkPortfolioHealth(PortfolioRiskSnapshot snapshot) {
        PortfolioGreeks greeks = snapshot.getGreeks();
        ExposureMetrics exposure = snapshot.getExposure();
        double total = exposure.getTotalExposure();

        List<RiskViolation> warnings = new ArrayList<>();
        checkPortfolioDelta(greeks.getDelta()).ifPresent(warnings::add);
        checkPortfolioGamma(greeks.getGamma()).ifPresent(warnings::add);
        for (Map.Entry<String, Double> entry : greeks.getDeltaPerSymbol().entrySet()) {
            checkSymbolDelta(entry.getKey(), entry.getValue()).ifPresent(warnings::add);
        }
        if (total > 0) {
            double largestPct = exposure.getMaxSinglePosition() / total;
            if (largestPct > limits.getMaxSinglePositionPct()) {
                warnings.add(RiskViolation.of(
                        CONCENTRATION,
                        format(
                                "Largest position concentration exceeds limit: %.2f%% > %.2f%%",
                                largestPct * 100,
                                limits.getMaxSinglePositionPct() * 100),
                        largestPct,
                        limits.getMaxSinglePositionPct()));
            }
        }
        for (Map.Entry<String, Double> entry : exposure.getCorrelatedExposure().entrySet()) {
            if (entry.getValue() > limits.getMaxCorrelatedPct()) {
                warnings.add(RiskViolation.of(
                        CORRELATED_EXPOSURE,
                        format(
                                "Correlated exposure for %s exceeds limit: %.2f%% > %.2f%%",
                                entry.getKey(),
                                entry.getValue() * 100,
                                limits.getMaxCorrelatedPct() * 100),
                        entry.getValue(),
                        limits.getMaxCorrelatedPct()));
            }
        }
        checkExposureCap(total).ifPresent(warnings::add);

        for (RiskViolation warning : warnings) {
            log.warn("Portfolio health warning: {}", warning);
            riskEventLog.logLimitWarning(warning);
        }
        return warnings;
    }

    // ========================
    // CAPACITY
    // ========================

    /**
     * Headroom for {@code symbol}: how much delta and notional exposure can still be added
     * before any limit binds. Every dimension is clamped at zero.
     */
    public RemainingCapacity remainingCapacity(String symbol, PortfolioRiskSnapshot snapshot) {
        PortfolioGreeks greeks = snapshot.getGreeks();
        ExposureMetrics exposure = snapshot.getExposure();
        double total = exposure.getTotalExposure();

        double deltaRoom = Math.max(0, limits.getMaxPortfolioDelta() - Math.abs(greeks.getDelta()));
        double symbolDeltaRoom = Math.max(0, limits.getMaxPerSymbolDelta() - Math.abs(greeks.deltaFor(symbol)));

        double exposureRoom = Double.POSITIVE_INFINITY;
        // A limit of 1.0 never binds
        double p = limits.getMaxSinglePositionPct();
        if (p < 1) {
            // v / (total + v) <= p  =>  v <= p * total / (1 - p)
            exposureRoom = Math.min(exposureRoom, p * total / (1 - p));
        }
        double q = limits.getMaxCorrelatedPct();
        if (q < 1) {
            // (c * total + v) / (total + v) <= q  =>  v <= (q - c) * total / (1 - q)
            double c = exposure.correlatedFractionFor(symbol);
            exposureRoom = Math.min(exposureRoom, (q - c) * total / (1 - q));
        }
        if (limits.getTotalExposureCap().isPresent()) {
            exposureRoom = Math.min(exposureRoom, limits.getTotalExposureCap().get() - total);
        }

        return new RemainingCapacity(symbol, deltaRoom, symbolDeltaRoom, Math.max(0, exposureRoom));
    }

    public RiskLimitsConfig getLimits() {
        return limits;
    }

    // ---- individual checks ----

    private Optional<RiskViolation> checkPortfolioDelta(double resultingDelta) {
        if (Math.abs(resultingDelta) > limits.getMaxPortfolioDelta()) {
            return Optional.of(RiskViolation.of(
                    PORTFOLIO_DELTA,
                    format(
                            "Portfolio delta would exceed limit: %.1f > %.1f",
                            Math.abs(resultingDelta),
                            limits.getMaxPortfolioDelta()),
                    Math.abs(resultingDelta),
                    limits.getMaxPortfolioDelta()));
        }
        return Optional.empty();
    }

    private Optional<RiskViolation> checkPortfolioGamma(double gamma) {
        if (Math.abs(gamma) > limits.getMaxPortfolioGamma()) {
            return Optional.of(RiskViolation.of(
                    PORTFOLIO_GAMMA,
                    format("Portfolio gamma exceeds limit: %.1f > %.1f", Math.abs(gamma), limits.getMaxPortfolioGamma()),
                    Math.abs(gamma),
                    limits.getMaxPortfolioGamma()));
        }
        return Optional.empty();
    }

    private Optional<RiskViolation> checkSymbolDelta(String symbol, double resultingDelta) {
        if (Math.abs(resultingDelta) > limits.getMaxPerSymbolDelta()) {
            return Optional.of(RiskViolation.of(
                    SYMBOL_DELTA,
                    format(
                            "Delta for %s would exceed limit: %.1f > %.1f",
                            symbol,
                            Math.abs(resultingDelta),
                            limits.getMaxPerSymbolDelta()),
                    Math.abs(resultingDelta),
                    limits.getMaxPerSymbolDelta()));
        }
        return Optional.empty();
    }

    private Optional<RiskViolation> checkConcentration(double positionValue, double totalExposure) {
        if (totalExposure + positionValue <= 0) {
            return Optional.empty();
        }
        double concentration = positionValue / (totalExposure + positionValue);
        if (concentration > limits.getMaxSinglePositionPct()) {
            return Optional.of(RiskViolation.of(
                    CONCENTRATION,
                    format(
                            "Position concentration would exceed limit: %.2f%% > %.2f%%",
                            concentration * 100,
                            limits.getMaxSinglePositionPct() * 100),
                    concentration,
                    limits.getMaxSinglePositionPct()));
        }
        return Optional.empty();
    }

    private Optional<RiskViolation> checkCorrelated(
            String symbol, double correlatedFraction, double positionValue, double totalExposure) {
        if (totalExposure + positionValue <= 0) {
            return Optional.empty();
        }
        double correlated = (correlatedFraction * totalExposure + positionValue) / (totalExposure + positionValue);
        if (correlated > limits.getMaxCorrelatedPct()) {
            return Optional.of(RiskViolation.of(
                    CORRELATED_EXPOSURE,
                    format(
                            "Correlated exposure for %s would exceed limit: %.2f%% > %.2f%%",
                            symbol,
                            correlated * 100,
                            limits.getMaxCorrelatedPct() * 100),
                    correlated,
                    limits.getMaxCorrelatedPct()));
        }
        return Optional.empty();
    }

    private Optional<RiskViolation> checkExposureCap(double resultingExposure) {
        Optional<Double> cap = limits.getTotalExposureCap();
        if (cap.isPresent() && resultingExposure > cap.get()) {
            return Optional.of(RiskViolation.of(
                    EXPOSURE_CAP,
                    format("Total exposure would exceed cap: %.2f > %.2f", resultingExposure, cap.get()),
                    resultingExposure,
                    cap.get()));
        }
        return Optional.empty();
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
