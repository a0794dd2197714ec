package com.optionguard.domain.model;

import com.optionguard.domain.enums.LegAction;
import com.optionguard.domain.enums.OptionRight;
import com.optionguard.exception.ValidationException;
import java.time.LocalDate;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A single option leg of a multi-leg strategy.
 *
 * <p>Quantity is always positive; direction comes from {@link #getAction()}. The
 * expiration must be strictly after {@code createdOn}, the date the leg is created (today
 * on the system clock when not given). Legs are immutable;
 * once the broker fills a leg, {@link #withContractId(String)} returns a copy carrying
 * the broker contract id.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Leg {

    private final OptionRight right;
    private final double strike;
    private final int quantity;
    private final LegAction action;
    private final LocalDate expiration;

    /** Broker contract id, null until the leg is filled. */
    private final String contractId;

    @EqualsAndHashCode.Exclude
    private final LocalDate createdOn;

    @Builder(toBuilder = true)
    private Leg(
            OptionRight right,
            double strike,
            int quantity,
            LegAction action,
            LocalDate expiration,
            String contractId,
            LocalDate createdOn) {
        ValidationException.require(right != null, "Leg right is required");
        ValidationException.require(action != null, "Leg action is required");
        ValidationException.require(strike > 0, "Strike must be positive, got " + strike);
        ValidationException.require(quantity > 0, "Quantity must be positive, got " + quantity);
        ValidationException.require(expiration != null, "Expiration is required");
        LocalDate today = createdOn != null ? createdOn : LocalDate.now();
        ValidationException.require(
                expiration.isAfter(today), "Expiration must be after " + today + ", got " + expiration);
        this.right = right;
        this.strike = strike;
        this.quantity = quantity;
        this.action = action;
        this.expiration = expiration;
        this.contractId = contractId;
        this.createdOn = today;
    }

    public Leg withContractId(String contractId) {
        return toBuilder().contractId(contractId).build();
    }

    public boolean isShort() {
        return action == LegAction.SELL;
    }

    /** Quantity signed by direction: positive for bought legs, negative for sold legs. */
    public int signedQuantity() {
        return isShort() ? -quantity : quantity;
    }
}
