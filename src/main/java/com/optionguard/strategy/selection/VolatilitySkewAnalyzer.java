package com.optionguard.strategy.selection;

import com.optionguard.config.StrikeSelectionProperties;
import com.optionguard.domain.enums.OptionRight;
import com.optionguard.marketdata.SensitivityProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Measures put/call volatility skew and leans the delta targets toward the richer side.
 *
 * <p>The skew ratio is put IV over call IV at strikes one standard deviation either side
 * of the underlying. A ratio above 1 means puts are expensive: the put target is widened
 * by {@code min(maxSkewAdjustment, ratio - 1)}, so the short put sits closer to the money
 * and collects more of that premium. A ratio below 1 widens the call target the same
 * way using {@code 1/ratio - 1}. Adjusted targets never exceed {@code maxAdjustedTarget}.
 */
@Component
public class VolatilitySkewAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(VolatilitySkewAnalyzer.class);

    public static final double NEUTRAL_SKEW = 1.0;

    private final StrikeSelectionProperties properties;

    public VolatilitySkewAnalyzer(StrikeSelectionProperties properties) {
        this.properties = properties;
    }

    /**
     * Put/call IV ratio at +/- one standard deviation. Falls back to {@link #NEUTRAL_SKEW}
     * when either side has no usable volatility.
     */
    public double skewRatio(double underlyingPrice, int daysToExpiration, double volatility, SensitivityProvider provider) {
        double interval = StrikeLadder.interval(underlyingPrice);
        double sigmaMove = StrikeLadder.oneSigmaMove(underlyingPrice, volatility, daysToExpiration);
        double putStrike = Math.max(interval, StrikeLadder.round(underlyingPrice - sigmaMove, interval));
        double callStrike = StrikeLadder.round(underlyingPrice + sigmaMove, interval);

        try {
            double putIv = provider.getImpliedVol(putStrike, OptionRight.PUT);
            double callIv = provider.getImpliedVol(callStrike, OptionRight.CALL);
            if (putIv <= 0 || callIv <= 0) {
                log.warn("Non-positive IV at skew strikes (put {}={}, call {}={}), assuming no skew",
                        putStrike, putIv, callStrike, callIv);
                return NEUTRAL_SKEW;
            }
            double ratio = putIv / callIv;
            log.debug("Skew ratio {} (put {} IV {}, call {} IV {})", ratio, putStrike, putIv, callStrike, callIv);
            return ratio;
        } catch (RuntimeException e) {
            log.warn("Could not measure skew at strikes {}/{}: {}, assuming no skew", putStrike, callStrike, e.getMessage());
            return NEUTRAL_SKEW;
        }
    }

    /**
     * Splits one base target into put and call targets according to the skew ratio.
     */
    public SkewAdjustedTargets adjustTargets(double baseTarget, double skewRatio) {
        double putTarget = baseTarget;
        double callTarget = baseTarget;
        if (skewRatio > NEUTRAL_SKEW) {
            putTarget = widen(baseTarget, skewRatio - 1.0);
        } else if (skewRatio > 0 && skewRatio < NEUTRAL_SKEW) {
            callTarget = widen(baseTarget, 1.0 / skewRatio - 1.0);
        }
        if (putTarget != baseTarget || callTarget != baseTarget) {
            log.info("Skew {} adjusted delta targets: put {} -> {}, call {} -> {}",
                    String.format("%.3f", skewRatio), baseTarget, putTarget, baseTarget, callTarget);
        }
        return new SkewAdjustedTargets(putTarget, callTarget, skewRatio);
    }

    private double widen(double target, double excess) {
        double adjustment = Math.min(properties.getMaxSkewAdjustment(), excess);
        return Math.min(properties.getMaxAdjustedTarget(), target * (1.0 + adjustment));
    }
}
