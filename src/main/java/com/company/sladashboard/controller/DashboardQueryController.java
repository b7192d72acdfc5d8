package com.company.sladashboard.controller;

import com.company.sladashboard.config.SlaDashboardProperties;
import com.company.sladashboard.domain.SlaEntity;
import com.company.sladashboard.domain.Team;
import com.company.sladashboard.domain.Tenant;
import com.company.sladashboard.dto.response.DashboardSummaryResponse;
import com.company.sladashboard.invalidation.CacheKeys;
import com.company.sladashboard.service.DashboardQueryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.TimeUnit;

@RestController
@RequestMapping("/api/v1/dashboard")
@Tag(name = "Dashboard", description = "Snapshot-backed dashboard reads")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class DashboardQueryController {

    private final DashboardQueryService queryService;
    private final SlaDashboardProperties properties;
    private final MeterRegistry meterRegistry;

    @GetMapping("/summary")
    @Operation(
            summary = "Compliance summary for a tenant or team",
            description = "The default 30-day range is served from precomputed metrics; other ranges are computed on demand"
    )
    @PreAuthorize("hasAnyRole('UI_READER', 'ADMIN')")
    public ResponseEntity<DashboardSummaryResponse> getSummary(
            @RequestParam String tenant,
            @RequestParam(required = false) Long teamId,
            @Parameter(description = "First day, inclusive (UTC)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @Parameter(description = "Last day, inclusive (UTC)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        DashboardSummaryResponse response = queryService.getSummary(tenant, teamId, startDate, endDate);

        meterRegistry.counter("api.dashboard.summary.requests",
                "range", response.getRange(),
                "precomputed", String.valueOf(response.isPrecomputed())
        ).increment();

        return ResponseEntity.ok()
                .cacheControl(cacheControl(CacheKeys.DASHBOARD_SUMMARY))
                .body(response);
    }

    @GetMapping("/entities")
    @Operation(summary = "Entities for a tenant, optionally one team")
    @PreAuthorize("hasAnyRole('UI_READER', 'ADMIN')")
    public ResponseEntity<List<SlaEntity>> getEntities(
            @RequestParam(required = false) String tenant,
            @RequestParam(required = false) Long teamId) {

        return ResponseEntity.ok()
                .cacheControl(cacheControl(CacheKeys.ENTITIES))
                .body(queryService.getEntities(tenant, teamId));
    }

    @GetMapping("/teams")
    @Operation(summary = "Teams owning entities in a tenant, or all teams")
    @PreAuthorize("hasAnyRole('UI_READER', 'ADMIN')")
    public ResponseEntity<List<Team>> getTeams(@RequestParam(required = false) String tenant) {
        return ResponseEntity.ok()
                .cacheControl(cacheControl(CacheKeys.TEAMS))
                .body(queryService.getTeams(tenant));
    }

    @GetMapping("/tenants")
    @Operation(summary = "All tenants")
    @PreAuthorize("hasAnyRole('UI_READER', 'ADMIN')")
    public ResponseEntity<List<Tenant>> getTenants() {
        return ResponseEntity.ok()
                .cacheControl(cacheControl(CacheKeys.TENANTS))
                .body(queryService.getTenants());
    }

    private CacheControl cacheControl(String resourceType) {
        Duration maxAge = properties.getHttp().maxAgeFor(resourceType);
        if (maxAge.isZero()) {
            return CacheControl.noCache();
        }
        return CacheControl.maxAge(maxAge.toSeconds(), TimeUnit.SECONDS).cachePrivate();
    }
}
