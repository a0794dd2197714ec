package com.optionguard.strategy.builder;

import com.optionguard.exception.ValidationException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Build parameters for an iron condor.
 */
@Getter
@ToString
public class IronCondorParams {

    private final double putWidth;
    private final double callWidth;
    private final int daysToExpiration;
    private final double deltaTarget;
    private final int quantity;

    /** Put/call IV ratio; null to measure it from the chain (or skip when skew is disabled). */
    private final Double skewRatio;

    private final boolean useSkew;

    @Builder
    private IronCondorParams(
            Double putWidth,
            Double callWidth,
            Integer daysToExpiration,
            Double deltaTarget,
            Integer quantity,
            Double skewRatio,
            Boolean useSkew) {
        this.putWidth = putWidth != null ? putWidth : 10.0;
        this.callWidth = callWidth != null ? callWidth : 10.0;
        this.daysToExpiration = daysToExpiration != null ? daysToExpiration : 45;
        this.deltaTarget = deltaTarget != null ? deltaTarget : 0.16;
        this.quantity = quantity != null ? quantity : 1;
        this.skewRatio = skewRatio;
        this.useSkew = useSkew == null || useSkew;

        ValidationException.require(this.putWidth > 0, "Put wing width must be positive");
        ValidationException.require(this.callWidth > 0, "Call wing width must be positive");
        ValidationException.require(this.daysToExpiration > 0, "Days to expiration must be positive");
        ValidationException.require(
                this.deltaTarget > 0 && this.deltaTarget < 1, "Delta target must be in (0, 1)");
        ValidationException.require(this.quantity > 0, "Quantity must be positive");
        ValidationException.require(skewRatio == null || skewRatio > 0, "Skew ratio must be positive");
    }
}
