package com.optionguard.risk;

import com.optionguard.domain.enums.TrailingStopAction;
import com.optionguard.domain.enums.TrailingStopState;
import com.optionguard.exception.ValidationException;
import lombok.Getter;

/**
 * Per-position trailing stop on option premium.
 *
 * <p>State machine:
 * <pre>
 *   INACTIVE --(peak &gt;= entry * (1 + activation%))--&gt; ACTIVE --(premium &lt;= stop)--&gt; TRIGGERED
 *       ^                                                  |
 *       +-------------------------- reset() ---------------+
 * </pre>
 *
 * <p>While ACTIVE the stop trails the peak at {@code trailingPct} below it, but is only
 * moved when the new level differs from the current one by at least {@code minMovePct}.
 * TRIGGERED is terminal until {@link #reset()}: further updates keep reporting TRIGGER
 * at the stop level that fired.
 *
 * <p>Not thread-safe. Each instance is owned by the monitor iteration of one position.
 */
@Getter
public class TrailingStop {

    private final double entryPremium;
    private final TrailingStopConfig config;

    private double highestPremium;
    private Double stopPremium;
    private boolean active;
    private boolean triggered;

    public TrailingStop(double entryPremium, TrailingStopConfig config) {
        ValidationException.require(entryPremium > 0, "Entry premium must be positive, got " + entryPremium);
        ValidationException.require(config != null, "Trailing stop config is required");
        this.entryPremium = entryPremium;
        this.config = config;
        this.highestPremium = entryPremium;
    }

    public TrailingStop(double entryPremium) {
        this(entryPremium, TrailingStopConfig.DEFAULT);
    }

    /**
     * Applies one monitoring-cycle observation of the position's premium.
     *
     * @param currentPremium latest mark premium, strictly positive
     * @return the action taken and the resulting stop level
     * @throws ValidationException if the premium is not positive
     */
    public TrailingStopUpdate update(double currentPremium) {
        ValidationException.require(currentPremium > 0, "Current premium must be positive, got " + currentPremium);

        if (triggered) {
            return new TrailingStopUpdate(TrailingStopAction.TRIGGER, stopPremium);
        }

        if (currentPremium > highestPremium) {
            highestPremium = currentPremium;
        }

        if (!active) {
            double movePct = (highestPremium - entryPremium) / entryPremium * 100.0;
            if (movePct >= config.getActivationPct()) {
                active = true;
                stopPremium = trailFrom(highestPremium);
                return new TrailingStopUpdate(TrailingStopAction.ACTIVATE, stopPremium);
            }
            return new TrailingStopUpdate(TrailingStopAction.HOLD, null);
        }

        if (currentPremium <= stopPremium) {
            triggered = true;
            return new TrailingStopUpdate(TrailingStopAction.TRIGGER, stopPremium);
        }

        double candidate = trailFrom(highestPremium);
        double changePct = Math.abs(candidate - stopPremium) / stopPremium * 100.0;
        if (changePct >= config.getMinMovePct()) {
            stopPremium = candidate;
            return new TrailingStopUpdate(TrailingStopAction.UPDATE, stopPremium);
        }
        return new TrailingStopUpdate(TrailingStopAction.HOLD, stopPremium);
    }

    /** Clears activation and the stop, and drops the peak back to the entry premium. */
    public void reset() {
        highestPremium = entryPremium;
        stopPremium = null;
        active = false;
        triggered = false;
    }

    public TrailingStopState getState() {
        if (triggered) {
            return TrailingStopState.TRIGGERED;
        }
        return active ? TrailingStopState.ACTIVE : TrailingStopState.INACTIVE;
    }

    private double trailFrom(double peak) {
        return peak * (1.0 - config.getTrailingPct() / 100.0);
    }
}
