package com.optionguard.risk;

/**
 * Headroom left before each limit binds, clamped at zero. {@code exposure} is
 * {@link Double#POSITIVE_INFINITY} when no exposure-based limit can bind.
 */
public record RemainingCapacity(String symbol, double portfolioDelta, double symbolDelta, double exposure) {}
