package com.optionguard.risk;

import com.optionguard.exception.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Percent thresholds of a trailing stop. All three must be positive and the trailing
 * distance must be strictly smaller than the activation move, otherwise the stop would
 * sit at or below entry the moment it arms.
 */
@Getter
@ToString
@EqualsAndHashCode
public class TrailingStopConfig {

    public static final TrailingStopConfig DEFAULT = new TrailingStopConfig(2.0, 1.5, 0.5);

    private final double activationPct;
    private final double trailingPct;
    private final double minMovePct;

    public TrailingStopConfig(double activationPct, double trailingPct, double minMovePct) {
        ValidationException.require(activationPct > 0, "activationPct must be positive, got " + activationPct);
        ValidationException.require(trailingPct > 0, "trailingPct must be positive, got " + trailingPct);
        ValidationException.require(minMovePct > 0, "minMovePct must be positive, got " + minMovePct);
        ValidationException.require(
                trailingPct < activationPct,
                String.format(
                        "trailingPct (%.2f) must be less than activationPct (%.2f)", trailingPct, activationPct));
        this.activationPct = activationPct;
        this.trailingPct = trailingPct;
        this.minMovePct = minMovePct;
    }
}
