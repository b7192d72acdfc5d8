package com.company.sladashboard.cache;

import com.company.sladashboard.domain.DashboardMetrics;
import com.company.sladashboard.domain.EntityChange;
import com.company.sladashboard.domain.SlaEntity;
import com.company.sladashboard.domain.Team;
import com.company.sladashboard.domain.Tenant;
import com.company.sladashboard.service.MetricsAggregator;
import lombok.Getter;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Immutable, versioned view of the whole dashboard dataset.
 * Precomputed metrics are derived from the entity list at construction, so they
 * always describe exactly the entities held by the same snapshot.
 */
@Getter
public final class CacheSnapshot {

    private final long version;
    private final List<SlaEntity> entities;
    private final List<Team> teams;
    private final List<Tenant> tenants;
    private final Map<String, DashboardMetrics> metricsByTenant;
    private final Map<String, Map<Long, DashboardMetrics>> metricsByTeam;
    private final List<EntityChange> recentChanges;
    private final Instant lastUpdated;

    private CacheSnapshot(long version,
                          List<SlaEntity> entities,
                          List<Team> teams,
                          List<Tenant> tenants,
                          Map<String, DashboardMetrics> metricsByTenant,
                          Map<String, Map<Long, DashboardMetrics>> metricsByTeam,
                          List<EntityChange> recentChanges,
                          Instant lastUpdated) {
        this.version = version;
        this.entities = entities;
        this.teams = teams;
        this.tenants = tenants;
        this.metricsByTenant = metricsByTenant;
        this.metricsByTeam = metricsByTeam;
        this.recentChanges = recentChanges;
        this.lastUpdated = lastUpdated;
    }

    public static CacheSnapshot build(long version,
                                      List<SlaEntity> entities,
                                      List<Team> teams,
                                      List<Tenant> tenants,
                                      List<EntityChange> recentChanges,
                                      Instant lastUpdated,
                                      MetricsAggregator aggregator) {
        List<SlaEntity> entityList = List.copyOf(entities);

        Map<String, List<SlaEntity>> byTenant = new LinkedHashMap<>();
        for (Tenant tenant : tenants) {
            byTenant.put(tenant.getName(), new ArrayList<>());
        }
        for (SlaEntity entity : entityList) {
            if (entity.getTenantName() != null) {
                byTenant.computeIfAbsent(entity.getTenantName(), k -> new ArrayList<>()).add(entity);
            }
        }

        Map<String, DashboardMetrics> tenantMetrics = new LinkedHashMap<>();
        Map<String, Map<Long, DashboardMetrics>> teamMetrics = new LinkedHashMap<>();

        byTenant.forEach((tenantName, tenantEntities) -> {
            tenantMetrics.put(tenantName, aggregator.computeMetrics(tenantEntities));

            Map<Long, List<SlaEntity>> byTeam = tenantEntities.stream()
                    .filter(e -> e.getTeamId() != null)
                    .collect(Collectors.groupingBy(SlaEntity::getTeamId, LinkedHashMap::new, Collectors.toList()));

            Map<Long, DashboardMetrics> perTeam = new LinkedHashMap<>();
            byTeam.forEach((teamId, teamEntities) -> perTeam.put(teamId, aggregator.computeMetrics(teamEntities)));
            teamMetrics.put(tenantName, Collections.unmodifiableMap(perTeam));
        });

        return new CacheSnapshot(
                version,
                entityList,
                List.copyOf(teams),
                List.copyOf(tenants),
                Collections.unmodifiableMap(tenantMetrics),
                Collections.unmodifiableMap(teamMetrics),
                List.copyOf(recentChanges),
                lastUpdated
        );
    }

    public List<SlaEntity> entitiesForTenant(String tenantName) {
        return entities.stream()
                .filter(e -> e.belongsTo(tenantName))
                .collect(Collectors.toList());
    }

    public List<SlaEntity> entitiesForTeam(String tenantName, Long teamId) {
        return entities.stream()
                .filter(e -> e.belongsTo(tenantName) && Objects.equals(e.getTeamId(), teamId))
                .collect(Collectors.toList());
    }

    /**
     * Teams owning at least one entity of the tenant.
     */
    public List<Team> teamsForTenant(String tenantName) {
        Set<Long> teamIds = entities.stream()
                .filter(e -> e.belongsTo(tenantName))
                .map(SlaEntity::getTeamId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());

        return teams.stream()
                .filter(t -> teamIds.contains(t.getId()))
                .collect(Collectors.toList());
    }

    public Optional<Team> findTeamByName(String teamName) {
        return teams.stream()
                .filter(t -> Objects.equals(t.getName(), teamName))
                .findFirst();
    }

    public boolean hasTenant(String tenantName) {
        return metricsByTenant.containsKey(tenantName);
    }
}
