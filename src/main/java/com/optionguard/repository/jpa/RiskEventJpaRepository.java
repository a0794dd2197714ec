package com.optionguard.repository.jpa;

import com.optionguard.entity.RiskEventEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the risk_event table. Written in batches by the risk event log;
 * queried by execution, symbol and time range for audit and recovery.
 */
@Repository
public interface RiskEventJpaRepository extends JpaRepository<RiskEventEntity, Long> {

    List<RiskEventEntity> findByExecutionIdOrderByTimestampAsc(String executionId);

    List<RiskEventEntity> findByComponentOrderByTimestampDesc(String component);

    @Query("SELECT e FROM RiskEventEntity e WHERE e.symbol = :symbol "
            + "AND e.timestamp BETWEEN :from AND :to ORDER BY e.timestamp ASC")
    List<RiskEventEntity> findBySymbolAndRange(
            @Param("symbol") String symbol, @Param("from") LocalDateTime from, @Param("to") LocalDateTime to);
}
