package com.company.sladashboard.invalidation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical cache key vocabulary shared by the server bus and the client cache.
 * <p>
 * A key is a resource type followed by {@code name=value} parameter segments, joined by {@code /},
 * e.g. {@code tasks/dagId=7} or {@code dashboard-summary/tenant=Data Engineering}.
 * Parameters are always written in canonical order: {@code tenant} first, then the rest by name,
 * so {@code team-dashboard/tenant=Acme/teamId=5} is the only spelling of that key.
 * <p>
 * Two keys match when they name the same resource type and one key's parameters are a subset of
 * the other's; {@link #ALL} matches every key. A bus key {@code team-dashboard/teamId=5} therefore
 * covers the client entry {@code team-dashboard/tenant=Acme/teamId=5}.
 */
public final class CacheKeys {

    public static final String ALL = "*";
    public static final String SEPARATOR = "/";

    public static final String ENTITIES = "entities";
    public static final String ENTITY_DETAILS = "entity-details";
    public static final String ENTITY_HISTORY = "entity-history";
    public static final String TEAMS = "teams";
    public static final String TEAM_DETAILS = "team-details";
    public static final String TEAM_MEMBERS = "team-members";
    public static final String TENANTS = "tenants";
    public static final String USERS = "users";
    public static final String DASHBOARD_SUMMARY = "dashboard-summary";
    public static final String TEAM_DASHBOARD = "team-dashboard";
    public static final String TASKS = "tasks";

    public static final String PARAM_TENANT = "tenant";
    public static final String PARAM_TEAM = "team";
    public static final String PARAM_TEAM_ID = "teamId";
    public static final String PARAM_ID = "id";
    public static final String PARAM_DAG_ID = "dagId";

    private static final Comparator<String> PARAM_ORDER = Comparator
            .comparing((String name) -> !PARAM_TENANT.equals(name))
            .thenComparing(Comparator.naturalOrder());

    private CacheKeys() {
    }

    public static String key(String resourceType, Object... nameValuePairs) {
        if (nameValuePairs.length % 2 != 0) {
            throw new IllegalArgumentException("Key parameters must be name/value pairs");
        }
        Map<String, String> params = new TreeMap<>(PARAM_ORDER);
        for (int i = 0; i < nameValuePairs.length; i += 2) {
            params.put(String.valueOf(nameValuePairs[i]), String.valueOf(nameValuePairs[i + 1]));
        }
        return join(resourceType, params);
    }

    /**
     * Rewrites a key with its parameters in canonical order. {@link #ALL} and empty keys are returned as given.
     */
    public static String canonical(String key) {
        if (key == null || key.isEmpty() || ALL.equals(key)) {
            return key;
        }
        List<String> segments = segments(key);
        return join(segments.get(0), params(segments));
    }

    public static String teamDashboard(String tenantName, long teamId) {
        return key(TEAM_DASHBOARD, PARAM_TENANT, tenantName, PARAM_TEAM_ID, teamId);
    }

    public static String entitiesByTenant(String tenantName) {
        return key(ENTITIES, PARAM_TENANT, tenantName);
    }

    public static String entitiesByTeam(long teamId) {
        return key(ENTITIES, PARAM_TEAM_ID, teamId);
    }

    public static String entityDetails(long entityId) {
        return key(ENTITY_DETAILS, PARAM_ID, entityId);
    }

    public static String entityHistory(long entityId) {
        return key(ENTITY_HISTORY, PARAM_ID, entityId);
    }

    public static String teamDetails(String teamName) {
        return key(TEAM_DETAILS, PARAM_TEAM, teamName);
    }

    public static String teamMembers(String teamName) {
        return key(TEAM_MEMBERS, PARAM_TEAM, teamName);
    }

    public static String dashboardSummary(String tenantName) {
        return key(DASHBOARD_SUMMARY, PARAM_TENANT, tenantName);
    }

    public static String teamDashboard(long teamId) {
        return key(TEAM_DASHBOARD, PARAM_TEAM_ID, teamId);
    }

    public static String tasksByDag(long dagId) {
        return key(TASKS, PARAM_DAG_ID, dagId);
    }

    public static List<String> segments(String key) {
        if (key == null || key.isEmpty()) {
            return List.of();
        }
        return new ArrayList<>(Arrays.asList(key.split(SEPARATOR, -1)));
    }

    /**
     * True when either key is {@link #ALL}, or both name the same resource type and one key's
     * parameters are a subset of the other's. Parameter order is irrelevant.
     */
    public static boolean matches(String first, String second) {
        if (ALL.equals(first) || ALL.equals(second)) {
            return true;
        }
        List<String> a = segments(first);
        List<String> b = segments(second);
        if (a.isEmpty() || b.isEmpty() || !a.get(0).equals(b.get(0))) {
            return false;
        }
        Map<String, String> paramsA = params(a);
        Map<String, String> paramsB = params(b);
        return paramsB.entrySet().containsAll(paramsA.entrySet())
                || paramsA.entrySet().containsAll(paramsB.entrySet());
    }

    // A segment without '=' is kept whole as a parameter name with an empty value.
    private static Map<String, String> params(List<String> segments) {
        Map<String, String> params = new TreeMap<>(PARAM_ORDER);
        for (String segment : segments.subList(1, segments.size())) {
            int eq = segment.indexOf('=');
            if (eq < 0) {
                params.put(segment, "");
            } else {
                params.put(segment.substring(0, eq), segment.substring(eq + 1));
            }
        }
        return params;
    }

    private static String join(String resourceType, Map<String, String> params) {
        StringBuilder key = new StringBuilder(resourceType);
        params.forEach((name, value) -> {
            key.append(SEPARATOR).append(name);
            if (!value.isEmpty()) {
                key.append('=').append(value);
            }
        });
        return key.toString();
    }
}
