package com.optionguard.observability;

import com.optionguard.domain.model.RiskEvent;
import java.util.List;

/**
 * Append-only sink for risk event batches. Implementations must either persist the
 * whole batch or throw, so the caller can keep the batch for the next attempt.
 */
public interface RiskEventStore {

    void append(List<RiskEvent> events);
}
