package com.company.sladashboard.scheduled;

import com.company.sladashboard.bus.DashboardWebSocketHandler;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Pings bus sessions and closes the idle ones.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "sladashboard.bus.heartbeat.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class BusHeartbeatJob {

    private final DashboardWebSocketHandler webSocketHandler;
    private final MeterRegistry meterRegistry;

    @Scheduled(fixedDelayString = "${sladashboard.bus.heartbeat-interval-ms:30000}",
            initialDelayString = "${sladashboard.bus.heartbeat-interval-ms:30000}")
    public void sendHeartbeats() {
        if (webSocketHandler.getSessionCount() == 0) {
            return;
        }
        try {
            webSocketHandler.sendHeartbeats();
            log.debug("Heartbeat sent to {} bus sessions", webSocketHandler.getSessionCount());
        } catch (Exception e) {
            log.error("Bus heartbeat failed", e);
            meterRegistry.counter("sla.bus.heartbeat.failures").increment();
        }
    }
}
