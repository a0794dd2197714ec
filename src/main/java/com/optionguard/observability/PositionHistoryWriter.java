package com.optionguard.observability;

import com.optionguard.domain.model.PositionSnapshot;
import com.optionguard.entity.PositionHistoryEntity;
import com.optionguard.mapper.PositionHistoryMapper;
import com.optionguard.repository.jpa.PositionHistoryJpaRepository;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes per-cycle unrealized P&amp;L estimates of monitored positions to position_history
 * for later analysis. A failed write is logged and the monitoring cycle carries on;
 * history is analytical data, not state.
 */
@Service
public class PositionHistoryWriter {

    private static final Logger log = LoggerFactory.getLogger(PositionHistoryWriter.class);

    private final PositionHistoryJpaRepository positionHistoryJpaRepository;
    private final PositionHistoryMapper positionHistoryMapper = Mappers.getMapper(PositionHistoryMapper.class);

    public PositionHistoryWriter(PositionHistoryJpaRepository positionHistoryJpaRepository) {
        this.positionHistoryJpaRepository = positionHistoryJpaRepository;
    }

    /**
     * @return true if the rows were written
     */
    public boolean write(List<PositionSnapshot> snapshots) {
        if (snapshots.isEmpty()) {
            return true;
        }
        try {
            List<PositionHistoryEntity> entities =
                    snapshots.stream().map(positionHistoryMapper::toEntity).toList();
            positionHistoryJpaRepository.saveAll(entities);
            log.debug("Wrote {} position history rows", entities.size());
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to write {} position history rows: {}", snapshots.size(), e.getMessage(), e);
            return false;
        }
    }
}
