package com.company.sladashboard.service;

import com.company.sladashboard.domain.DashboardMetrics;
import com.company.sladashboard.domain.SlaEntity;
import com.company.sladashboard.domain.enums.EntityType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Pure compliance aggregation over a set of entities.
 * Entities without a current SLA count as 0, values outside 0-100 are clamped.
 */
@Component
public class MetricsAggregator {

    private static final int COMPLIANCE_SCALE = 1;

    public DashboardMetrics computeMetrics(Collection<SlaEntity> entities) {
        if (entities == null || entities.isEmpty()) {
            return DashboardMetrics.empty();
        }

        double overallSum = 0;
        double tablesSum = 0;
        double dagsSum = 0;
        int tables = 0;
        int dags = 0;

        for (SlaEntity entity : entities) {
            double sla = clamp(entity.getCurrentSla());
            overallSum += sla;
            if (entity.getType() == EntityType.DAG) {
                dagsSum += sla;
                dags++;
            } else if (entity.getType() == EntityType.TABLE) {
                tablesSum += sla;
                tables++;
            }
        }

        return DashboardMetrics.builder()
                .overallCompliance(meanOf(overallSum, entities.size()))
                .tablesCompliance(meanOf(tablesSum, tables))
                .dagsCompliance(meanOf(dagsSum, dags))
                .entitiesCount(entities.size())
                .tablesCount(tables)
                .dagsCount(dags)
                .build();
    }

    /**
     * Round a compliance percentage half-up to one decimal place.
     */
    public static double roundCompliance(double value) {
        return BigDecimal.valueOf(value)
                .setScale(COMPLIANCE_SCALE, RoundingMode.HALF_UP)
                .doubleValue();
    }

    private static double meanOf(double sum, int count) {
        if (count == 0) {
            return 0.0;
        }
        return roundCompliance(sum / count);
    }

    private static double clamp(Double sla) {
        if (sla == null || sla.isNaN()) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, sla));
    }
}
