package com.company.sladashboard.dto.response;

import com.company.sladashboard.domain.DashboardMetrics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardSummaryResponse {
    private String tenant;
    private Long teamId;
    private String range;
    private LocalDate startDate;
    private LocalDate endDate;
    private DashboardMetrics metrics;

    // True when served from the snapshot's precomputed metrics
    private boolean precomputed;

    private long snapshotVersion;
    private Instant lastUpdated;
}
