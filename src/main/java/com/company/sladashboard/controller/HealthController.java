package com.company.sladashboard.controller;

import com.company.sladashboard.bus.DashboardWebSocketHandler;
import com.company.sladashboard.cache.DataCache;
import com.company.sladashboard.domain.enums.CacheState;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Health check endpoints")
@RequiredArgsConstructor
public class HealthController {

    private final DataCache dataCache;
    private final DashboardWebSocketHandler webSocketHandler;
    private final Clock clock;

    @GetMapping
    @Operation(summary = "Health check", description = "UP once a snapshot is being served")
    public ResponseEntity<Map<String, Object>> health() {
        CacheState state = dataCache.getState();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", state.isServing() ? "UP" : "STARTING");
        response.put("timestamp", clock.instant());
        response.put("service", "sla-dashboard-service");
        response.put("version", "1.0.0");
        response.put("cacheState", state);
        response.put("busSessions", webSocketHandler.getSessionCount());

        HttpStatus status = state.isServing() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(response);
    }
}
