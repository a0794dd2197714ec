package com.optionguard.broker;

import com.optionguard.domain.enums.OrderStatus;
import com.optionguard.exception.ExecutionGatewayException;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory gateway for paper trading. Market orders fill immediately; limit orders
 * rest as PENDING until cancelled.
 */
public class PaperExecutionGateway implements ExecutionGateway {

    private static final Logger log = LoggerFactory.getLogger(PaperExecutionGateway.class);

    private final Map<String, OrderStatus> orders = new ConcurrentHashMap<>();

    @Override
    public String placeOrder(OrderTicket ticket) {
        if (ticket.getLegs() == null || ticket.getLegs().isEmpty()) {
            throw new ExecutionGatewayException("Order for " + ticket.getStrategyId() + " has no legs");
        }
        String orderId = "PAPER-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
        OrderStatus status = ticket.getLimitPrice() == null ? OrderStatus.FILLED : OrderStatus.PENDING;
        orders.put(orderId, status);
        log.info(
                "Paper order {} {} for strategy {} ({} legs, limit {})",
                orderId,
                status,
                ticket.getStrategyId(),
                ticket.getLegs().size(),
                ticket.getLimitPrice());
        return orderId;
    }

    @Override
    public void cancelOrder(String orderId) {
        OrderStatus status = getOrderStatus(orderId);
        if (status != OrderStatus.PENDING) {
            throw new ExecutionGatewayException("Cannot cancel order " + orderId + " in status " + status);
        }
        orders.put(orderId, OrderStatus.CANCELLED);
        log.info("Paper order {} cancelled", orderId);
    }

    @Override
    public OrderStatus getOrderStatus(String orderId) {
        OrderStatus status = orders.get(orderId);
        if (status == null) {
            throw new ExecutionGatewayException("Unknown order " + orderId);
        }
        return status;
    }
}
