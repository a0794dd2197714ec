package com.optionguard.unit.recovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.optionguard.monitor.PositionMonitorScheduler;
import com.optionguard.observability.RiskEventLog;
import com.optionguard.recovery.GracefulShutdownService;
import com.optionguard.risk.TradingCircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GracefulShutdownServiceTest {

    @Mock
    private PositionMonitorScheduler positionMonitorScheduler;

    @Mock
    private TradingCircuitBreaker tradingCircuitBreaker;

    @Mock
    private RiskEventLog riskEventLog;

    private GracefulShutdownService service;

    @BeforeEach
    void setUp() {
        service = new GracefulShutdownService(positionMonitorScheduler, tradingCircuitBreaker, riskEventLog);
    }

    @Test
    @DisplayName("Monitoring stops before the risk event log is flushed")
    void shutdownOrder() {
        service.start();
        assertThat(service.isRunning()).isTrue();

        service.stop();

        InOrder order = inOrder(positionMonitorScheduler, tradingCircuitBreaker, riskEventLog);
        order.verify(positionMonitorScheduler).stop();
        order.verify(tradingCircuitBreaker).getStatus();
        order.verify(riskEventLog).close();
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    @DisplayName("A failing step is logged and the service still reports stopped")
    void failureDuringShutdown() {
        service.start();
        doThrow(new IllegalStateException("scheduler stuck")).when(positionMonitorScheduler).stop();

        service.stop();

        verify(riskEventLog, never()).close();
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Stops ahead of the default lifecycle phase")
    void phase() {
        assertThat(service.getPhase()).isEqualTo(Integer.MAX_VALUE - 1);
        assertThat(service.isAutoStartup()).isTrue();
    }
}
