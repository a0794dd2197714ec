package com.optionguard.repository.jpa;

import com.optionguard.entity.PositionHistoryEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PositionHistoryJpaRepository extends JpaRepository<PositionHistoryEntity, Long> {

    List<PositionHistoryEntity> findByExecutionIdOrderByRecordedAtAsc(String executionId);
}
