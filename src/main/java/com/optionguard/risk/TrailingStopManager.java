package com.optionguard.risk;

import com.optionguard.domain.enums.TrailingStopAction;
import com.optionguard.event.RiskEventType;
import com.optionguard.exception.ResourceNotFoundException;
import com.optionguard.exception.ValidationException;
import com.optionguard.observability.RiskEventLog;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Registry of trailing stops keyed by execution id.
 *
 * <p>A stop is added when a position opts in at entry and removed when the position
 * closes. Every lifecycle step except HOLD is written to the {@link RiskEventLog}.
 */
@Service
public class TrailingStopManager {

    private static final Logger log = LoggerFactory.getLogger(TrailingStopManager.class);

    private final RiskEventLog riskEventLog;
    private final Map<String, TrailingStop> stops = new ConcurrentHashMap<>();

    public TrailingStopManager(RiskEventLog riskEventLog) {
        this.riskEventLog = riskEventLog;
    }

    /**
     * Registers a new trailing stop for a position.
     *
     * @throws ValidationException if the execution already has a stop, or the premium or config is invalid
     */
    public TrailingStop add(String executionId, double entryPremium, TrailingStopConfig config) {
        ValidationException.require(executionId != null && !executionId.isBlank(), "Execution id is required");
        if (stops.containsKey(executionId)) {
            throw new ValidationException("Trailing stop already exists for execution " + executionId);
        }
        TrailingStop stop = new TrailingStop(entryPremium, config);
        stops.put(executionId, stop);

        log.info(
                "Trailing stop added: executionId={}, entry={}, activation={}%, trailing={}%",
                executionId,
                entryPremium,
                config.getActivationPct(),
                config.getTrailingPct());
        riskEventLog.logTrailingStop(RiskEventType.TS_ADD, executionId, stop, null);
        return stop;
    }

    /**
     * Applies the latest premium to one position's stop.
     *
     * @throws ResourceNotFoundException if the execution has no stop
     */
    public TrailingStopUpdate update(String executionId, double currentPremium) {
        TrailingStop stop = get(executionId)
                .orElseThrow(() -> new ResourceNotFoundException("TrailingStop", executionId));
        boolean wasTriggered = stop.isTriggered();
        TrailingStopUpdate result = stop.update(currentPremium);
        recordTransition(executionId, stop, result, currentPremium, wasTriggered);
        return result;
    }

    /**
     * Updates every registered stop that has a premium in {@code currentPremiums}.
     * Stops without a premium are skipped; a failure on one stop is logged and the
     * rest are still processed.
     *
     * @return results for the stops that were updated
     */
    public Map<String, TrailingStopUpdate> updateStops(Map<String, Double> currentPremiums) {
        Map<String, TrailingStopUpdate> results = new LinkedHashMap<>();
        for (Map.Entry<String, TrailingStop> entry : stops.entrySet()) {
            String executionId = entry.getKey();
            Double premium = currentPremiums.get(executionId);
            if (premium == null) {
                log.debug("No premium for execution {}, skipping trailing stop update", executionId);
                continue;
            }
            try {
                boolean wasTriggered = entry.getValue().isTriggered();
                TrailingStopUpdate result = entry.getValue().update(premium);
                recordTransition(executionId, entry.getValue(), result, premium, wasTriggered);
                results.put(executionId, result);
            } catch (RuntimeException e) {
                log.error("Failed to update trailing stop for execution {}: {}", executionId, e.getMessage(), e);
            }
        }
        return results;
    }

    public Optional<TrailingStop> get(String executionId) {
        return Optional.ofNullable(stops.get(executionId));
    }

    public boolean remove(String executionId) {
        TrailingStop removed = stops.remove(executionId);
        if (removed == null) {
            return false;
        }
        log.info("Trailing stop removed: executionId={}", executionId);
        riskEventLog.logTrailingStop(RiskEventType.TS_REMOVE, executionId, removed, null);
        return true;
    }

    public Map<String, TrailingStop> getAll() {
        return Collections.unmodifiableMap(stops);
    }

    /**
     * Manual override: returns the stop to INACTIVE with the peak back at entry.
     *
     * @throws ResourceNotFoundException if the execution has no stop
     */
    public void resetStop(String executionId) {
        TrailingStop stop = get(executionId)
                .orElseThrow(() -> new ResourceNotFoundException("TrailingStop", executionId));
        stop.reset();
        log.warn("Trailing stop reset: executionId={}", executionId);
        riskEventLog.logTrailingStop(RiskEventType.TS_RESET, executionId, stop, null);
    }

    private void recordTransition(
            String executionId,
            TrailingStop stop,
            TrailingStopUpdate result,
            double currentPremium,
            boolean wasTriggered) {
        RiskEventType eventType = toEventType(result.action());
        // A triggered stop keeps reporting TRIGGER until the position closes; record it once
        if (eventType == null || wasTriggered) {
            return;
        }
        log.info(
                "Trailing stop {}: executionId={}, premium={}, peak={}, stop={}",
                result.action(),
                executionId,
                currentPremium,
                stop.getHighestPremium(),
                result.stopPremium());
        riskEventLog.logTrailingStop(eventType, executionId, stop, currentPremium);
    }

    private RiskEventType toEventType(TrailingStopAction action) {
        return switch (action) {
            case ACTIVATE -> RiskEventType.TS_ACTIVATE;
            case UPDATE -> RiskEventType.TS_UPDATE;
            case TRIGGER -> RiskEventType.TS_TRIGGER;
            case HOLD -> null;
        };
    }
}
