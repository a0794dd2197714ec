package com.optionguard.strategy.selection;

/**
 * Outcome of one strike search.
 *
 * @param strike      chosen strike
 * @param sensitivity observed signed delta at that strike
 * @param error       absolute distance between |sensitivity| and the target
 * @param iterations  number of strikes probed
 * @param converged   whether {@code error} is within tolerance
 */
public record StrikeSelectionResult(
        double strike, double sensitivity, double error, int iterations, boolean converged) {}
