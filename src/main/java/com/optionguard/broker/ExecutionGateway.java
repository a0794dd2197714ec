package com.optionguard.broker;

import com.optionguard.domain.enums.OrderStatus;

/**
 * Brokerage order interface. Every automated order goes through
 * {@link com.optionguard.oms.GuardedExecutionService}, which consults the circuit breaker
 * and reports the outcome of each call to it.
 */
public interface ExecutionGateway {

    /**
     * @return the broker-assigned order id
     * @throws com.optionguard.exception.ExecutionGatewayException if the broker rejects the
     *     order or is unavailable
     */
    String placeOrder(OrderTicket ticket);

    /**
     * @throws com.optionguard.exception.ExecutionGatewayException if the order is unknown or
     *     can no longer be cancelled
     */
    void cancelOrder(String orderId);

    /**
     * @throws com.optionguard.exception.ExecutionGatewayException if the order is unknown
     */
    OrderStatus getOrderStatus(String orderId);
}
