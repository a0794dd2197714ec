package com.optionguard.domain.model;

import java.util.Optional;
import lombok.Getter;

/**
 * Structural health of an open strategy: either intact, or broken with a reason.
 *
 * <p>A strategy becomes broken when the broker no longer holds every leg as built,
 * typically after early assignment strips a leg's contract id. Computed once per
 * check by {@code StrategyHealthChecker}.
 */
@Getter
public class StrategyHealth {

    private static final StrategyHealth INTACT = new StrategyHealth(false, null);

    private final boolean broken;
    private final String reason;

    private StrategyHealth(boolean broken, String reason) {
        this.broken = broken;
        this.reason = reason;
    }

    public static StrategyHealth intact() {
        return INTACT;
    }

    public static StrategyHealth broken(String reason) {
        return new StrategyHealth(true, reason);
    }

    public boolean isIntact() {
        return !broken;
    }

    public Optional<String> brokenReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public String toString() {
        return broken ? "Broken(" + reason + ")" : "Intact";
    }
}
