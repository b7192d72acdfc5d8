package com.company.sladashboard.invalidation;

import com.company.sladashboard.exception.InvalidationUnregisteredException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.function.Function;

import static com.company.sladashboard.invalidation.CacheKeys.*;

/**
 * Single registry of which cache keys each write scenario invalidates.
 * <p>
 * Resolution is pure and deterministic. When a parameter needed for a precise key is
 * missing, the rule falls back to the broader key of the same family rather than skipping it.
 * A scenario without a rule is a programming error: strict mode throws
 * {@link InvalidationUnregisteredException}, lenient mode invalidates everything.
 */
@Slf4j
public class InvalidationCatalog {

    private final Map<InvalidationScenario, Function<InvalidationParams, List<String>>> rules;
    private final boolean strict;
    private final Counter unregisteredCounter;

    public InvalidationCatalog(boolean strict) {
        this(strict, null);
    }

    public InvalidationCatalog(boolean strict, MeterRegistry meterRegistry) {
        this(defaultRules(), strict, meterRegistry);
    }

    InvalidationCatalog(Map<InvalidationScenario, Function<InvalidationParams, List<String>>> rules,
                        boolean strict,
                        MeterRegistry meterRegistry) {
        this.rules = Collections.unmodifiableMap(new EnumMap<>(rules));
        this.strict = strict;
        this.unregisteredCounter = meterRegistry != null
                ? Counter.builder("sla.invalidation.unregistered")
                    .description("Scenarios resolved without a registered invalidation rule")
                    .register(meterRegistry)
                : null;
    }

    public List<String> resolve(InvalidationScenario scenario, InvalidationParams params) {
        Function<InvalidationParams, List<String>> rule = scenario != null ? rules.get(scenario) : null;
        if (rule == null) {
            return unregistered(String.valueOf(scenario));
        }
        List<String> keys = rule.apply(params != null ? params : InvalidationParams.none());
        log.debug("Resolved {} to keys {}", scenario, keys);
        return keys;
    }

    public List<String> resolve(String scenarioName, InvalidationParams params) {
        Optional<InvalidationScenario> scenario = InvalidationScenario.fromName(scenarioName);
        if (scenario.isEmpty()) {
            return unregistered(scenarioName);
        }
        return resolve(scenario.get(), params);
    }

    public boolean isRegistered(InvalidationScenario scenario) {
        return rules.containsKey(scenario);
    }

    public boolean isStrict() {
        return strict;
    }

    private List<String> unregistered(String scenarioName) {
        if (unregisteredCounter != null) {
            unregisteredCounter.increment();
        }
        if (strict) {
            throw new InvalidationUnregisteredException(scenarioName);
        }
        log.warn("No invalidation rule for scenario {}, invalidating all keys", scenarioName);
        return List.of(ALL);
    }

    // ============================================================
    // Rules
    // ============================================================

    static Map<InvalidationScenario, Function<InvalidationParams, List<String>>> defaultRules() {
        Map<InvalidationScenario, Function<InvalidationParams, List<String>>> rules =
                new EnumMap<>(InvalidationScenario.class);

        rules.put(InvalidationScenario.ENTITY_CREATED, p -> keys(
                entitiesForTeam(p), entitiesForTenant(p),
                TEAMS,
                summaryFor(p), teamDashboardFor(p)));

        rules.put(InvalidationScenario.ENTITY_UPDATED, p -> keys(
                entitiesForTeam(p), entitiesForTenant(p),
                detailsFor(p), historyFor(p),
                summaryFor(p), teamDashboardFor(p)));

        rules.put(InvalidationScenario.ENTITY_DELETED, p -> keys(
                entitiesForTeam(p), entitiesForTenant(p),
                detailsFor(p), historyFor(p),
                TEAMS,
                summaryFor(p), teamDashboardFor(p)));

        rules.put(InvalidationScenario.TEAM_CREATED, p -> keys(
                TEAMS, DASHBOARD_SUMMARY));

        rules.put(InvalidationScenario.TEAM_UPDATED, p -> keys(
                TEAMS,
                teamDetailsFor(p), teamMembersFor(p),
                teamDashboardFor(p), DASHBOARD_SUMMARY));

        rules.put(InvalidationScenario.TEAM_MEMBER_ADDED, p -> keys(
                teamMembersFor(p), teamDetailsFor(p), TEAMS, USERS));

        rules.put(InvalidationScenario.TEAM_MEMBER_REMOVED, p -> keys(
                teamMembersFor(p), teamDetailsFor(p), TEAMS));

        rules.put(InvalidationScenario.TENANT_CREATED, p -> keys(
                TENANTS));

        // Entities and teams are scoped by tenant name, so a tenant update touches every tenant view.
        rules.put(InvalidationScenario.TENANT_UPDATED, p -> keys(
                TENANTS, TEAMS, ENTITIES, DASHBOARD_SUMMARY, TEAM_DASHBOARD));

        rules.put(InvalidationScenario.TASK_CREATED, p -> keys(
                tasksFor(p), dagDetailsFor(p)));

        rules.put(InvalidationScenario.TASK_UPDATED, p -> keys(
                tasksFor(p), dagDetailsFor(p)));

        rules.put(InvalidationScenario.TASK_DELETED, p -> keys(
                tasksFor(p), dagDetailsFor(p)));

        // Team aggregates may depend on task counts.
        rules.put(InvalidationScenario.TASK_PRIORITY_CHANGED, p -> keys(
                tasksFor(p), dagDetailsFor(p), teamDashboardFor(p)));

        return rules;
    }

    private static List<String> keys(String... keys) {
        return List.copyOf(new LinkedHashSet<>(Arrays.asList(keys)));
    }

    private static String entitiesForTeam(InvalidationParams p) {
        return p.getTeamId() != null ? entitiesByTeam(p.getTeamId()) : ENTITIES;
    }

    private static String entitiesForTenant(InvalidationParams p) {
        return p.getTenantName() != null ? entitiesByTenant(p.getTenantName()) : ENTITIES;
    }

    private static String detailsFor(InvalidationParams p) {
        return p.getEntityId() != null ? entityDetails(p.getEntityId()) : ENTITY_DETAILS;
    }

    private static String historyFor(InvalidationParams p) {
        return p.getEntityId() != null ? entityHistory(p.getEntityId()) : ENTITY_HISTORY;
    }

    private static String summaryFor(InvalidationParams p) {
        return p.getTenantName() != null ? dashboardSummary(p.getTenantName()) : DASHBOARD_SUMMARY;
    }

    private static String teamDashboardFor(InvalidationParams p) {
        return p.getTeamId() != null ? teamDashboard(p.getTeamId()) : TEAM_DASHBOARD;
    }

    private static String teamDetailsFor(InvalidationParams p) {
        return p.getTeamName() != null ? teamDetails(p.getTeamName()) : TEAM_DETAILS;
    }

    private static String teamMembersFor(InvalidationParams p) {
        return p.getTeamName() != null ? teamMembers(p.getTeamName()) : TEAM_MEMBERS;
    }

    private static String tasksFor(InvalidationParams p) {
        return p.getDagId() != null ? tasksByDag(p.getDagId()) : TASKS;
    }

    private static String dagDetailsFor(InvalidationParams p) {
        return p.getDagId() != null ? entityDetails(p.getDagId()) : ENTITY_DETAILS;
    }
}
