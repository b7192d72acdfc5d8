package com.company.sladashboard.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Compliance summary over a set of entities. Compliance values are percentages
 * rounded half-up to one decimal; every value is 0 when the set is empty.
 */
@Value
@Builder
@Jacksonized
public class DashboardMetrics {

    private static final DashboardMetrics EMPTY = DashboardMetrics.builder()
            .overallCompliance(0.0)
            .tablesCompliance(0.0)
            .dagsCompliance(0.0)
            .entitiesCount(0)
            .tablesCount(0)
            .dagsCount(0)
            .build();

    double overallCompliance;
    double tablesCompliance;
    double dagsCompliance;
    int entitiesCount;
    int tablesCount;
    int dagsCount;

    public static DashboardMetrics empty() {
        return EMPTY;
    }
}
