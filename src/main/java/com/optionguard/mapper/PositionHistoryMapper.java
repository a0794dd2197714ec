package com.optionguard.mapper;

import com.optionguard.domain.model.PositionSnapshot;
import com.optionguard.entity.PositionHistoryEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * Maps a monitoring snapshot to a position_history row.
 */
@Mapper
public interface PositionHistoryMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(source = "capturedAt", target = "recordedAt")
    PositionHistoryEntity toEntity(PositionSnapshot snapshot);
}
