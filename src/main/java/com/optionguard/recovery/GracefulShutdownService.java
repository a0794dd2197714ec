package com.optionguard.recovery;

import com.optionguard.monitor.PositionMonitorScheduler;
import com.optionguard.observability.RiskEventLog;
import com.optionguard.risk.TradingCircuitBreaker;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Ensures orderly shutdown: stop monitoring, then flush the risk event log.
 *
 * <p>Implements {@link SmartLifecycle} with a high phase value so it runs BEFORE the
 * datasource and scheduler shut down. The sequence:
 * <ol>
 *   <li>Stop the monitoring loop (a cycle already running completes)</li>
 *   <li>Log the circuit breaker state for the next start</li>
 *   <li>Close the risk event log, flushing every buffered event</li>
 * </ol>
 *
 * <p>Open positions are left as they are. No exit orders are placed during shutdown.
 */
@Service
public class GracefulShutdownService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownService.class);

    private final PositionMonitorScheduler positionMonitorScheduler;
    private final TradingCircuitBreaker tradingCircuitBreaker;
    private final RiskEventLog riskEventLog;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public GracefulShutdownService(
            PositionMonitorScheduler positionMonitorScheduler,
            TradingCircuitBreaker tradingCircuitBreaker,
            RiskEventLog riskEventLog) {
        this.positionMonitorScheduler = positionMonitorScheduler;
        this.tradingCircuitBreaker = tradingCircuitBreaker;
        this.riskEventLog = riskEventLog;
    }

    @Override
    public void start() {
        running.set(true);
        log.info("GracefulShutdownService started");
    }

    @Override
    public void stop() {
        log.info("Graceful shutdown initiated...");
        try {
            positionMonitorScheduler.stop();
            log.info("Circuit breaker at shutdown: {}", tradingCircuitBreaker.getStatus());
            riskEventLog.close();
            log.info("Graceful shutdown completed successfully");
        } catch (RuntimeException e) {
            log.error("Error during graceful shutdown", e);
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Higher phase stops earlier
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
