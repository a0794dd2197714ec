package com.optionguard.strategy.selection;

import com.optionguard.config.StrikeSelectionProperties;
import com.optionguard.domain.enums.OptionRight;
import com.optionguard.exception.NoDataException;
import com.optionguard.exception.ValidationException;
import com.optionguard.marketdata.SensitivityProvider;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds the listed strike whose delta is closest to a target.
 *
 * <p>The search seeds one standard deviation out of the money (below the underlying for
 * puts, above for calls), then walks one strike increment per probe:
 * <ul>
 *   <li>|delta| above target: the strike is too close to the money, step away from the
 *       underlying (up for calls, down for puts)</li>
 *   <li>|delta| below target: step toward the underlying</li>
 * </ul>
 *
 * <p>It stops on the first strike within tolerance, on a revisited strike, or when the
 * probe budget runs out. Without convergence the closest strike seen is returned with a
 * warning. A probe that fails is logged and skipped; only a search that never observes
 * a delta fails, with {@link NoDataException}.
 */
@Component
public class StrikeSelector {

    private static final Logger log = LoggerFactory.getLogger(StrikeSelector.class);

    private final StrikeSelectionProperties properties;

    public StrikeSelector(StrikeSelectionProperties properties) {
        this.properties = properties;
    }

    /**
     * @param symbol            underlying symbol, for logging
     * @param underlyingPrice   current underlying price
     * @param targetSensitivity unsigned target delta in (0, 1)
     * @param right             CALL or PUT
     * @param daysToExpiration  calendar days to the chosen expiration
     * @param impliedVol        at-the-money implied volatility, may be null
     * @param historicalVol     realised volatility, may be null
     * @param provider          per-strike delta source for the chosen expiration
     * @throws NoDataException if no probe returned a delta
     */
    public StrikeSelectionResult select(
            String symbol,
            double underlyingPrice,
            double targetSensitivity,
            OptionRight right,
            int daysToExpiration,
            Double impliedVol,
            Double historicalVol,
            SensitivityProvider provider) {
        ValidationException.require(underlyingPrice > 0, "Underlying price must be positive, got " + underlyingPrice);
        ValidationException.require(
                targetSensitivity > 0 && targetSensitivity < 1,
                "Target sensitivity must be in (0, 1), got " + targetSensitivity);
        ValidationException.require(daysToExpiration > 0, "Days to expiration must be positive, got " + daysToExpiration);

        double volatility = resolveVolatility(symbol, impliedVol, historicalVol);
        double interval = StrikeLadder.interval(underlyingPrice);
        double sigmaMove = StrikeLadder.oneSigmaMove(underlyingPrice, volatility, daysToExpiration);
        double seed = right.isCall() ? underlyingPrice + sigmaMove : underlyingPrice - sigmaMove;
        double strike = Math.max(interval, StrikeLadder.round(seed, interval));

        log.debug(
                "Strike search {} {}: target={}, price={}, vol={}, sigmaMove={}, seed={}",
                symbol,
                right,
                targetSensitivity,
                underlyingPrice,
                volatility,
                sigmaMove,
                strike);

        Set<Double> visited = new HashSet<>();
        StrikeSelectionResult best = null;
        int probes = 0;
        // Until a delta is observed, keep stepping away from the money
        boolean towardMoney = false;

        while (probes < properties.getMaxIterations()) {
            if (!visited.add(strike)) {
                log.debug("Strike search {} {}: revisited {}, stopping", symbol, right, strike);
                break;
            }
            probes++;

            try {
                double sensitivity = provider.getSensitivity(strike, right);
                double error = Math.abs(Math.abs(sensitivity) - targetSensitivity);
                log.debug("Probe {}: strike={}, delta={}, error={}", probes, strike, sensitivity, error);

                if (best == null || error < best.error()) {
                    best = new StrikeSelectionResult(
                            strike, sensitivity, error, probes, error <= properties.getTolerance());
                }
                if (error <= properties.getTolerance()) {
                    return new StrikeSelectionResult(strike, sensitivity, error, probes, true);
                }
                towardMoney = Math.abs(sensitivity) < targetSensitivity;
            } catch (RuntimeException e) {
                log.warn("No delta for {} {} at strike {}: {}", symbol, right, strike, e.getMessage());
            }

            double next = nextStrike(strike, interval, right, towardMoney);
            if (next <= 0) {
                log.debug("Strike search {} {}: reached the bottom of the ladder", symbol, right);
                break;
            }
            strike = next;
        }

        if (best == null) {
            throw new NoDataException(
                    String.format("No sensitivity data for %s %s after %d probes", symbol, right, probes),
                    Map.of("symbol", symbol, "right", right.name(), "probes", probes));
        }

        log.warn(
                "Strike search for {} {} did not converge: target={}, best strike={} with delta={} (error {})",
                symbol,
                right,
                targetSensitivity,
                best.strike(),
                best.sensitivity(),
                best.error());
        return new StrikeSelectionResult(best.strike(), best.sensitivity(), best.error(), probes, false);
    }

    /**
     * Implied volatility if known, else historical, else the configured default.
     */
    public double resolveVolatility(String symbol, Double impliedVol, Double historicalVol) {
        if (impliedVol != null && impliedVol > 0) {
            return impliedVol;
        }
        if (historicalVol != null && historicalVol > 0) {
            return historicalVol;
        }
        log.warn(
                "No implied or historical volatility for {}, using default {}",
                symbol,
                properties.getDefaultVolatility());
        return properties.getDefaultVolatility();
    }

    private double nextStrike(double strike, double interval, OptionRight right, boolean towardMoney) {
        // Calls move toward the money by lowering the strike, puts by raising it
        boolean stepUp = right.isCall() != towardMoney;
        return stepUp ? strike + interval : strike - interval;
    }
}
