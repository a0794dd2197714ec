package com.optionguard.domain.enums;

/**
 * Multi-leg structures the builder can produce. The expected leg count is used to
 * validate a strategy at construction; CUSTOM accepts any non-empty leg list.
 */
public enum StrategyType {
    IRON_CONDOR(4, "IC"),
    VERTICAL_SPREAD(2, "VS"),
    CUSTOM(0, "CU");

    private final int requiredLegCount;
    private final String idPrefix;

    StrategyType(int requiredLegCount, String idPrefix) {
        this.requiredLegCount = requiredLegCount;
        this.idPrefix = idPrefix;
    }

    /** Fixed leg count for the structure, or 0 when any non-empty count is allowed. */
    public int getRequiredLegCount() {
        return requiredLegCount;
    }

    public String getIdPrefix() {
        return idPrefix;
    }
}
