package com.optionguard.risk;

import lombok.Builder;
import lombok.Getter;

/**
 * A single breached portfolio limit.
 *
 * <p>The code names the limit (PORTFOLIO_DELTA, PORTFOLIO_GAMMA, SYMBOL_DELTA,
 * CONCENTRATION, CORRELATED_EXPOSURE, EXPOSURE_CAP); the message is the human-readable
 * comparison, e.g. "Portfolio delta would exceed limit: 55.0 &gt; 50.0".
 */
@Getter
@Builder
public class RiskViolation {

    private final String code;
    private final String message;
    private final double currentValue;
    private final double limitValue;

    public static RiskViolation of(String code, String message, double currentValue, double limitValue) {
        return RiskViolation.builder()
                .code(code)
                .message(message)
                .currentValue(currentValue)
                .limitValue(limitValue)
                .build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
