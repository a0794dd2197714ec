package com.optionguard.monitor;

import com.optionguard.domain.model.OpenPosition;
import java.util.List;
import java.util.Optional;

/**
 * Source of the positions currently held, with their latest marks.
 */
public interface OpenPositionSource {

    List<OpenPosition> getOpenPositions();

    Optional<OpenPosition> findByExecutionId(String executionId);
}
