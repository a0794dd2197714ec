package com.optionguard.observability;

import com.optionguard.config.RiskEventLogProperties;
import com.optionguard.domain.enums.CircuitState;
import com.optionguard.domain.model.Decision;
import com.optionguard.domain.model.RiskEvent;
import com.optionguard.event.RiskAlertEvent;
import com.optionguard.event.RiskEventType;
import com.optionguard.event.RiskLevel;
import com.optionguard.risk.RiskViolation;
import com.optionguard.risk.TrailingStop;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Buffered, append-only log of risk state transitions and rejections.
 *
 * <p>Events are queued in memory and written to the {@link RiskEventStore} in one batch
 * when the buffer reaches {@code batchSize}, on the periodic flush, or on
 * {@link #close()} during shutdown. A failed write puts the batch back at the head of the
 * buffer, in order, for the next attempt. The buffer holds at most {@code maxBuffered}
 * events; past that the oldest are dropped and logged as an error. Events still buffered
 * when the process dies without a graceful shutdown are lost.
 *
 * <p>WARNING and CRITICAL events are also published as {@link RiskAlertEvent} for the
 * alerting channel.
 */
@Service
public class RiskEventLog {

    private static final Logger log = LoggerFactory.getLogger(RiskEventLog.class);

    private final RiskEventStore riskEventStore;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;
    private final int batchSize;
    private final int maxBuffered;

    private final Deque<RiskEvent> buffer = new ArrayDeque<>();
    private volatile boolean closed = false;
    private long droppedCount = 0;

    public RiskEventLog(
            RiskEventStore riskEventStore,
            RiskEventLogProperties properties,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.riskEventStore = riskEventStore;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
        this.batchSize = properties.getBatchSize();
        this.maxBuffered = Math.max(properties.getMaxBuffered(), properties.getBatchSize());
    }

    /**
     * Appends an event to the buffer, flushing when the size threshold is reached.
     * After {@link #close()} every event is written through immediately.
     */
    public void record(RiskEvent event) {
        int pending;
        int dropped;
        synchronized (buffer) {
            buffer.addLast(event);
            dropped = trimOldest();
            pending = buffer.size();
        }
        logDropped(dropped);

        if (event.getLevel() != RiskLevel.INFO && event.getEventType() != RiskEventType.DECISION) {
            applicationEventPublisher.publishEvent(new RiskAlertEvent(this, event));
        }

        if (closed || pending >= batchSize) {
            flush();
        }
    }

    /**
     * Writes all buffered events in one batch.
     *
     * @return the number of events written; 0 when the buffer was empty or the write failed
     */
    public int flush() {
        List<RiskEvent> batch;
        synchronized (buffer) {
            if (buffer.isEmpty()) {
                return 0;
            }
            batch = new ArrayList<>(buffer);
            buffer.clear();
        }

        try {
            riskEventStore.append(batch);
            log.debug("Flushed {} risk events", batch.size());
            return batch.size();
        } catch (RuntimeException e) {
            log.error("Failed to persist {} risk events, keeping them buffered: {}", batch.size(), e.getMessage(), e);
            int dropped;
            synchronized (buffer) {
                for (int i = batch.size() - 1; i >= 0; i--) {
                    buffer.addFirst(batch.get(i));
                }
                dropped = trimOldest();
            }
            logDropped(dropped);
            return 0;
        }
    }

    @Scheduled(
            fixedDelayString = "${optionguard.event-log.flush-interval-ms:5000}",
            initialDelayString = "${optionguard.event-log.flush-interval-ms:5000}")
    public void scheduledFlush() {
        flush();
    }

    /**
     * Final flush at shutdown. Events recorded afterwards are written through.
     */
    public void close() {
        closed = true;
        int written = flush();
        int remaining = getPendingCount();
        if (remaining > 0) {
            log.error("Risk event log closed with {} unwritten events", remaining);
        } else {
            log.info("Risk event log closed, {} events flushed", written);
        }
    }

    public int getPendingCount() {
        synchronized (buffer) {
            return buffer.size();
        }
    }

    // ========================
    // CIRCUIT BREAKER
    // ========================

    public void logCircuitBreakerStateChange(
            CircuitState oldState, CircuitState newState, int failureCount, String reason) {
        RiskLevel level = switch (newState) {
            case OPEN -> RiskLevel.CRITICAL;
            case HALF_OPEN -> RiskLevel.WARNING;
            case CLOSED -> RiskLevel.INFO;
        };
        record(base(RiskEventType.CB_STATE_CHANGE, level)
                .oldState(oldState.name())
                .newState(newState.name())
                .failureCount(failureCount)
                .message(reason)
                .build());
    }

    public void logCircuitBreakerFailure(CircuitState state, int failureCount, String reason) {
        record(base(RiskEventType.CB_FAILURE, RiskEventType.CB_FAILURE.getDefaultLevel())
                .oldState(state.name())
                .newState(state.name())
                .failureCount(failureCount)
                .message(reason)
                .build());
    }

    public void logCircuitBreakerSuccess(CircuitState state, int failureCount) {
        record(base(RiskEventType.CB_SUCCESS, RiskEventType.CB_SUCCESS.getDefaultLevel())
                .oldState(state.name())
                .newState(state.name())
                .failureCount(failureCount)
                .message("Success recorded")
                .build());
    }

    public void logCircuitBreakerReset(CircuitState previousState, int failureCount) {
        record(base(RiskEventType.CB_MANUAL_RESET, RiskEventType.CB_MANUAL_RESET.getDefaultLevel())
                .oldState(previousState.name())
                .newState(CircuitState.CLOSED.name())
                .failureCount(failureCount)
                .message("Manual reset")
                .build());
    }

    // ========================
    // TRAILING STOP
    // ========================

    public void logTrailingStop(RiskEventType eventType, String executionId, TrailingStop stop, Double currentPremium) {
        record(base(eventType, eventType.getDefaultLevel())
                .executionId(executionId)
                .entryPremium(stop.getEntryPremium())
                .currentPremium(currentPremium)
                .highestPremium(stop.getHighestPremium())
                .stopPremium(stop.getStopPremium())
                .action(eventType.name())
                .newState(stop.getState().name())
                .message(String.format("Trailing stop %s for %s", stop.getState(), executionId))
                .build());
    }

    // ========================
    // PORTFOLIO LIMITS
    // ========================

    /**
     * Records an entry check outcome; {@code violation} is null when the entry was allowed.
     */
    public void logLimitCheck(String symbol, boolean allowed, RiskViolation violation) {
        RiskEventType type = allowed ? RiskEventType.PL_CHECK : RiskEventType.PL_REJECTION;
        RiskEvent.RiskEventBuilder builder = base(type, type.getDefaultLevel())
                .symbol(symbol)
                .allowed(allowed);
        if (violation != null) {
            builder.limitType(violation.getCode())
                    .currentValue(violation.getCurrentValue())
                    .limitValue(violation.getLimitValue())
                    .message(violation.getMessage());
        } else {
            builder.message("Entry allowed for " + symbol);
        }
        record(builder.build());
    }

    public void logLimitWarning(RiskViolation violation) {
        record(base(RiskEventType.PL_WARNING, RiskEventType.PL_WARNING.getDefaultLevel())
                .limitType(violation.getCode())
                .currentValue(violation.getCurrentValue())
                .limitValue(violation.getLimitValue())
                .allowed(false)
                .message(violation.getMessage())
                .build());
    }

    // ========================
    // DECISIONS
    // ========================

    public void logDecision(String executionId, String symbol, Decision decision) {
        record(base(RiskEventType.DECISION, RiskLevel.INFO)
                .executionId(executionId)
                .symbol(symbol)
                .action(decision.getAction().name())
                .message(decision.getReason())
                .metadata(Map.of(
                        "rule", decision.getRule(),
                        "urgency", decision.getUrgency().name(),
                        "details", decision.getMetadata()))
                .build());
    }

    /** Total events discarded because the buffer was full. */
    public long getDroppedCount() {
        synchronized (buffer) {
            return droppedCount;
        }
    }

    // Caller holds the buffer lock
    private int trimOldest() {
        int dropped = 0;
        while (buffer.size() > maxBuffered) {
            buffer.pollFirst();
            dropped++;
        }
        droppedCount += dropped;
        return dropped;
    }

    private void logDropped(int dropped) {
        if (dropped > 0) {
            log.error("Risk event buffer full ({} events), dropped {} oldest events", maxBuffered, dropped);
        }
    }

    private RiskEvent.RiskEventBuilder base(RiskEventType type, RiskLevel level) {
        return RiskEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(type)
                .component(type.getComponent())
                .level(level)
                .timestamp(LocalDateTime.now(clock));
    }
}
