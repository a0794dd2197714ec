package com.optionguard.broker;

import com.optionguard.domain.model.Leg;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * A multi-leg order as handed to the {@link ExecutionGateway}.
 *
 * <p>{@code limitPrice} is the net premium per share: positive for a debit, negative for
 * a credit. Null places the order at market.
 */
@Data
@Builder
public class OrderTicket {

    /** Strategy this order opens, closes or rolls. */
    private String strategyId;

    private String symbol;
    private List<Leg> legs;
    private Double limitPrice;

    /** Groups the orders of one roll (close + open) for tracing. */
    private String correlationId;
}
