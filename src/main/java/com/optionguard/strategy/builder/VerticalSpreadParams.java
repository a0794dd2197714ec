package com.optionguard.strategy.builder;

import com.optionguard.domain.enums.SpreadDirection;
import com.optionguard.exception.ValidationException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Build parameters for a two-leg vertical spread.
 *
 * <p>The delta target picks the leg closest to the money: the sold leg of a credit
 * spread, the bought leg of a debit spread. The other leg sits {@code width} further
 * out of the money.
 */
@Getter
@ToString
public class VerticalSpreadParams {

    private final SpreadDirection direction;
    private final double width;
    private final int daysToExpiration;
    private final double deltaTarget;
    private final int quantity;

    @Builder
    private VerticalSpreadParams(
            SpreadDirection direction, Double width, Integer daysToExpiration, Double deltaTarget, Integer quantity) {
        ValidationException.require(direction != null, "Spread direction is required");
        this.direction = direction;
        this.width = width != null ? width : 5.0;
        this.daysToExpiration = daysToExpiration != null ? daysToExpiration : 45;
        this.deltaTarget = deltaTarget != null ? deltaTarget : (direction.isCredit() ? 0.20 : 0.40);
        this.quantity = quantity != null ? quantity : 1;

        ValidationException.require(this.width > 0, "Spread width must be positive");
        ValidationException.require(this.daysToExpiration > 0, "Days to expiration must be positive");
        ValidationException.require(
                this.deltaTarget > 0 && this.deltaTarget < 1, "Delta target must be in (0, 1)");
        ValidationException.require(this.quantity > 0, "Quantity must be positive");
    }
}
