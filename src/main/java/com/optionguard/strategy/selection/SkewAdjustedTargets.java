package com.optionguard.strategy.selection;

/**
 * Per-side target sensitivities after volatility-skew adjustment.
 */
public record SkewAdjustedTargets(double putTarget, double callTarget, double skewRatio) {}
