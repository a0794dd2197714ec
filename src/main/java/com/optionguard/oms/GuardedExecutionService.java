package com.optionguard.oms;

import com.optionguard.broker.ExecutionGateway;
import com.optionguard.broker.OrderTicket;
import com.optionguard.domain.enums.OrderStatus;
import com.optionguard.exception.CircuitBreakerOpenException;
import com.optionguard.risk.TradingCircuitBreaker;
import com.optionguard.risk.TradingPermission;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for automated order actions.
 *
 * <p>Order placement and cancellation are refused with {@link CircuitBreakerOpenException}
 * while the breaker is OPEN. Every gateway call, including status queries, reports its
 * outcome to the {@link TradingCircuitBreaker}; failures are rethrown to the caller,
 * which owns any retry.
 */
@Service
public class GuardedExecutionService {

    private static final Logger log = LoggerFactory.getLogger(GuardedExecutionService.class);

    private final ExecutionGateway executionGateway;
    private final TradingCircuitBreaker tradingCircuitBreaker;

    public GuardedExecutionService(ExecutionGateway executionGateway, TradingCircuitBreaker tradingCircuitBreaker) {
        this.executionGateway = executionGateway;
        this.tradingCircuitBreaker = tradingCircuitBreaker;
    }

    public String placeOrder(OrderTicket ticket) {
        requireTradingAllowed("place order for " + ticket.getStrategyId());
        String orderId = guarded("placeOrder", () -> executionGateway.placeOrder(ticket));
        log.info("Order {} placed for strategy {}", orderId, ticket.getStrategyId());
        return orderId;
    }

    public void cancelOrder(String orderId) {
        requireTradingAllowed("cancel order " + orderId);
        guarded("cancelOrder", () -> {
            executionGateway.cancelOrder(orderId);
            return null;
        });
        log.info("Order {} cancelled", orderId);
    }

    public OrderStatus getOrderStatus(String orderId) {
        return guarded("getOrderStatus", () -> executionGateway.getOrderStatus(orderId));
    }

    private void requireTradingAllowed(String action) {
        TradingPermission permission = tradingCircuitBreaker.isTradingAllowed();
        if (!permission.allowed()) {
            log.warn("Refused to {}: {}", action, permission.reason());
            throw new CircuitBreakerOpenException(permission.reason());
        }
    }

    private <T> T guarded(String operation, Supplier<T> call) {
        T result;
        try {
            result = call.get();
        } catch (RuntimeException e) {
            log.error("Execution gateway {} failed: {}", operation, e.getMessage(), e);
            tradingCircuitBreaker.recordFailure(operation + ": " + e.getMessage());
            throw e;
        }
        tradingCircuitBreaker.recordSuccess();
        return result;
    }
}
