package com.optionguard.monitor;

import com.optionguard.domain.enums.StrategyStatus;
import com.optionguard.domain.model.OpenPosition;
import com.optionguard.exception.ResourceNotFoundException;
import com.optionguard.exception.ValidationException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default {@link OpenPositionSource}: positions are registered on fill and marked by the
 * market-data side. Iteration follows opening order.
 */
@Component
public class InMemoryPositionBook implements OpenPositionSource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPositionBook.class);

    private final Map<String, OpenPosition> positions = new LinkedHashMap<>();
    private final Clock clock;

    public InMemoryPositionBook(Clock clock) {
        this.clock = clock;
    }

    public synchronized void open(OpenPosition position) {
        ValidationException.require(position.getExecutionId() != null, "Execution id is required");
        ValidationException.require(position.getQuantity() > 0, "Quantity must be positive");
        ValidationException.require(position.getEntryPremium() > 0, "Entry premium must be positive");
        if (positions.containsKey(position.getExecutionId())) {
            throw new ValidationException("Position already open: " + position.getExecutionId());
        }
        if (position.getStrategy().getStatus() != StrategyStatus.OPEN) {
            position.setStrategy(position.getStrategy().withStatus(StrategyStatus.OPEN));
        }
        if (position.getOpenedAt() == null) {
            position.setOpenedAt(LocalDateTime.now(clock));
        }
        positions.put(position.getExecutionId(), position);
        log.info("Position opened: {} {} x{} @ {}",
                position.getExecutionId(), position.getSymbol(), position.getQuantity(), position.getEntryPremium());
    }

    /**
     * Records the latest mark for a position.
     *
     * @throws ResourceNotFoundException if the position is not open
     */
    public synchronized void mark(String executionId, double currentPremium, double unrealizedPnl) {
        ValidationException.require(currentPremium > 0, "Premium must be positive, got " + currentPremium);
        OpenPosition position = positions.get(executionId);
        if (position == null) {
            throw new ResourceNotFoundException("Position", executionId);
        }
        position.setCurrentPremium(currentPremium);
        position.setUnrealizedPnl(unrealizedPnl);
        position.setMarkedAt(LocalDateTime.now(clock));
    }

    public synchronized Optional<OpenPosition> close(String executionId) {
        OpenPosition removed = positions.remove(executionId);
        if (removed != null) {
            log.info("Position closed: {}", executionId);
        }
        return Optional.ofNullable(removed);
    }

    @Override
    public synchronized List<OpenPosition> getOpenPositions() {
        return new ArrayList<>(positions.values());
    }

    @Override
    public synchronized Optional<OpenPosition> findByExecutionId(String executionId) {
        return Optional.ofNullable(positions.get(executionId));
    }
}
