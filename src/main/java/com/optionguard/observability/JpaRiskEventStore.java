package com.optionguard.observability;

import com.optionguard.domain.model.RiskEvent;
import com.optionguard.entity.RiskEventEntity;
import com.optionguard.mapper.RiskEventMapper;
import com.optionguard.repository.jpa.RiskEventJpaRepository;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link RiskEventStore} backed by the risk_event table. A batch is written in one
 * transaction so a failure leaves nothing half-written.
 */
@Component
public class JpaRiskEventStore implements RiskEventStore {

    private final RiskEventJpaRepository riskEventJpaRepository;
    private final RiskEventMapper riskEventMapper = Mappers.getMapper(RiskEventMapper.class);

    public JpaRiskEventStore(RiskEventJpaRepository riskEventJpaRepository) {
        this.riskEventJpaRepository = riskEventJpaRepository;
    }

    @Override
    @Transactional
    public void append(List<RiskEvent> events) {
        List<RiskEventEntity> entities = riskEventMapper.toEntityList(events);
        riskEventJpaRepository.saveAll(entities);
    }

    /** Events for one execution in the order they happened. */
    @Transactional(readOnly = true)
    public List<RiskEvent> findByExecutionId(String executionId) {
        return riskEventMapper.toDomainList(riskEventJpaRepository.findByExecutionIdOrderByTimestampAsc(executionId));
    }
}
