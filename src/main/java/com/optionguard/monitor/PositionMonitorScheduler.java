package com.optionguard.monitor;

import com.optionguard.config.MonitorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives {@link PositionMonitor#monitorPositions()} on a fixed delay. Stopping takes effect
 * at the start of the next cycle; a running cycle always completes.
 */
@Component
public class PositionMonitorScheduler {

    private static final Logger log = LoggerFactory.getLogger(PositionMonitorScheduler.class);

    private final PositionMonitor positionMonitor;
    private final MonitorProperties monitorProperties;

    private volatile boolean stopped = false;

    public PositionMonitorScheduler(PositionMonitor positionMonitor, MonitorProperties monitorProperties) {
        this.positionMonitor = positionMonitor;
        this.monitorProperties = monitorProperties;
    }

    @Scheduled(
            fixedDelayString = "${optionguard.monitor.interval-ms:30000}",
            initialDelayString = "${optionguard.monitor.interval-ms:30000}")
    public void runCycle() {
        if (stopped || !monitorProperties.isEnabled()) {
            return;
        }
        try {
            positionMonitor.monitorPositions();
        } catch (RuntimeException e) {
            log.error("Monitoring cycle failed: {}", e.getMessage(), e);
        }
    }

    public void stop() {
        stopped = true;
        log.info("Position monitoring stopped");
    }

    public boolean isStopped() {
        return stopped;
    }
}
