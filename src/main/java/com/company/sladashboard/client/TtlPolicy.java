package com.company.sladashboard.client;

import com.company.sladashboard.invalidation.CacheKeys;
import lombok.Getter;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Time-to-live per resource type. Types without an override use the default.
 */
@Getter
public class TtlPolicy {

    public static final Duration DEFAULT_TTL = Duration.ofHours(6);

    private final Duration defaultTtl;
    private final Map<String, Duration> overrides;

    public TtlPolicy(Duration defaultTtl, Map<String, Duration> overrides) {
        this.defaultTtl = defaultTtl;
        this.overrides = Map.copyOf(overrides);
    }

    /**
     * Six hours for snapshot-backed data; five minutes for tasks and dashboard aggregates,
     * which the dashboard polls.
     */
    public static TtlPolicy defaults() {
        return new TtlPolicy(DEFAULT_TTL, Map.of(
                CacheKeys.TASKS, Duration.ofMinutes(5),
                CacheKeys.DASHBOARD_SUMMARY, Duration.ofMinutes(5),
                CacheKeys.TEAM_DASHBOARD, Duration.ofMinutes(5)
        ));
    }

    public Duration ttlFor(String resourceType) {
        return overrides.getOrDefault(resourceType, defaultTtl);
    }

    public TtlPolicy withOverride(String resourceType, Duration ttl) {
        Map<String, Duration> copy = new HashMap<>(overrides);
        copy.put(resourceType, ttl);
        return new TtlPolicy(defaultTtl, copy);
    }
}
