package com.company.sladashboard.controller;

import com.company.sladashboard.cache.DataCache;
import com.company.sladashboard.domain.CacheStatus;
import com.company.sladashboard.domain.EntityChange;
import com.company.sladashboard.dto.request.IncrementalUpdateRequest;
import com.company.sladashboard.dto.response.RefreshResponse;
import com.company.sladashboard.exception.EntityNotFoundException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/cache")
@Tag(name = "Cache", description = "Server cache status and maintenance")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class CacheAdminController {

    private final DataCache dataCache;

    @GetMapping("/status")
    @Operation(summary = "Current snapshot status")
    @PreAuthorize("hasAnyRole('UI_READER', 'ADMIN')")
    public ResponseEntity<CacheStatus> getStatus() {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(dataCache.getCacheStatus());
    }

    @PostMapping("/refresh")
    @Operation(
            summary = "Force a full refresh",
            description = "Reloads the snapshot from the store and restarts the scheduled refresh cycle"
    )
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<RefreshResponse> refresh() {
        log.info("Forced cache refresh requested");
        CacheStatus status = dataCache.forceRefresh();
        return ResponseEntity.ok(new RefreshResponse("Cache refreshed", status));
    }

    @PostMapping("/incremental-update")
    @Operation(summary = "Apply a single entity change from the SLA poller")
    @PreAuthorize("hasAnyRole('EDITOR', 'ADMIN')")
    public ResponseEntity<EntityChange> incrementalUpdate(@Valid @RequestBody IncrementalUpdateRequest request) {
        EntityChange change = dataCache.applyIncrementalUpdate(request)
                .orElseThrow(() -> new EntityNotFoundException("Entity",
                        request.getEntityName() + " (" + request.getEntityType() + ", team " + request.getTeamName() + ")"));
        return ResponseEntity.ok(change);
    }

    @GetMapping("/recent-changes")
    @Operation(summary = "Incremental changes inside the retention window, newest first")
    @PreAuthorize("hasAnyRole('UI_READER', 'ADMIN')")
    public ResponseEntity<List<EntityChange>> getRecentChanges(
            @RequestParam(required = false) String tenant,
            @RequestParam(required = false) String team) {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noCache())
                .body(dataCache.getRecentChanges(tenant, team));
    }
}
