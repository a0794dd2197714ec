package com.optionguard.risk;

import java.util.Optional;

/**
 * Outcome of a pre-entry portfolio limit check. A rejection is a business outcome,
 * not an error: it carries the first breached limit and never throws.
 */
public record LimitCheckResult(boolean allowed, RiskViolation violation) {

    private static final LimitCheckResult ALLOWED = new LimitCheckResult(true, null);

    public static LimitCheckResult allow() {
        return ALLOWED;
    }

    public static LimitCheckResult reject(RiskViolation violation) {
        return new LimitCheckResult(false, violation);
    }

    public Optional<String> reason() {
        return Optional.ofNullable(violation).map(RiskViolation::getMessage);
    }
}
