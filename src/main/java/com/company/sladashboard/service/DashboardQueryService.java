package com.company.sladashboard.service;

import com.company.sladashboard.cache.CacheSnapshot;
import com.company.sladashboard.cache.DataCache;
import com.company.sladashboard.config.SlaDashboardProperties;
import com.company.sladashboard.domain.DashboardMetrics;
import com.company.sladashboard.domain.SlaEntity;
import com.company.sladashboard.domain.Team;
import com.company.sladashboard.domain.Tenant;
import com.company.sladashboard.domain.enums.PredefinedRange;
import com.company.sladashboard.dto.response.DashboardSummaryResponse;
import com.company.sladashboard.exception.TenantNotFoundException;
import com.company.sladashboard.util.DateRanges;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Dashboard reads served from the data cache. The default range comes from the
 * snapshot's precomputed metrics; any other range is aggregated on demand.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DashboardQueryService {

    private final DataCache dataCache;
    private final SlaDashboardProperties properties;
    private final Clock clock;

    public DashboardSummaryResponse getSummary(String tenantName, Long teamId,
                                               LocalDate startDate, LocalDate endDate) {
        CacheSnapshot snapshot = dataCache.getSnapshot();
        if (!snapshot.hasTenant(tenantName)) {
            throw new TenantNotFoundException(tenantName);
        }

        int defaultDays = properties.getCache().getDefaultRangeDays();
        LocalDate today = DateRanges.today(clock);
        PredefinedRange range = DateRanges.classify(startDate, endDate, today, defaultDays);

        LocalDate start = startDate != null ? startDate : DateRanges.defaultRangeStart(today, defaultDays);
        LocalDate end = endDate != null ? endDate : today;

        DashboardMetrics metrics;
        boolean precomputed = range == PredefinedRange.LAST_30_DAYS;
        if (precomputed) {
            metrics = teamId != null
                    ? dataCache.getTeamMetrics(tenantName, teamId).orElse(DashboardMetrics.empty())
                    : dataCache.getMetrics(tenantName).orElse(DashboardMetrics.empty());
        } else {
            log.debug("Computing {} metrics for tenant {} ({} to {})", range.getLabel(), tenantName, start, end);
            metrics = dataCache.calculateMetricsForDateRange(tenantName, teamId, start, end);
        }

        return DashboardSummaryResponse.builder()
                .tenant(tenantName)
                .teamId(teamId)
                .range(range.getLabel())
                .startDate(start)
                .endDate(end)
                .metrics(metrics)
                .precomputed(precomputed)
                .snapshotVersion(snapshot.getVersion())
                .lastUpdated(snapshot.getLastUpdated())
                .build();
    }

    public List<SlaEntity> getEntities(String tenantName, Long teamId) {
        if (tenantName == null) {
            return dataCache.getAllEntities();
        }
        requireTenant(tenantName);
        return teamId != null
                ? dataCache.getEntitiesByTeam(tenantName, teamId)
                : dataCache.getEntitiesByTenant(tenantName);
    }

    public List<Team> getTeams(String tenantName) {
        if (tenantName == null) {
            return dataCache.getAllTeams();
        }
        requireTenant(tenantName);
        return dataCache.getTeamsByTenant(tenantName);
    }

    public List<Tenant> getTenants() {
        return dataCache.getAllTenants();
    }

    private void requireTenant(String tenantName) {
        if (!dataCache.getSnapshot().hasTenant(tenantName)) {
            throw new TenantNotFoundException(tenantName);
        }
    }
}
