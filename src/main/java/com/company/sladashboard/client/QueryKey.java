package com.company.sladashboard.client;

import com.company.sladashboard.invalidation.CacheKeys;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical key of a client cache entry: resource type plus parameters, in the same
 * {@code resource/name=value} form the invalidation bus uses. Parsing normalises parameter
 * order, so {@code team-dashboard/teamId=5/tenant=Acme} and {@code team-dashboard/tenant=Acme/teamId=5}
 * are the same key.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class QueryKey {

    private final String resourceType;
    private final Map<String, String> params;

    @EqualsAndHashCode.Include
    private final String canonical;

    private QueryKey(String resourceType, Map<String, String> params, String canonical) {
        this.resourceType = resourceType;
        this.params = Collections.unmodifiableMap(params);
        this.canonical = canonical;
    }

    public static QueryKey of(String resourceType, Object... nameValuePairs) {
        return parse(CacheKeys.key(resourceType, nameValuePairs));
    }

    public static QueryKey parse(String key) {
        String canonical = CacheKeys.canonical(key);
        List<String> segments = CacheKeys.segments(canonical);
        if (segments.isEmpty() || segments.get(0).isEmpty()) {
            throw new IllegalArgumentException("Empty query key");
        }

        Map<String, String> params = new LinkedHashMap<>();
        for (String segment : segments.subList(1, segments.size())) {
            int eq = segment.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Malformed key segment '" + segment + "' in " + key);
            }
            params.put(segment.substring(0, eq), segment.substring(eq + 1));
        }
        return new QueryKey(segments.get(0), params, canonical);
    }

    public String param(String name) {
        return params.get(name);
    }

    public Long longParam(String name) {
        String value = params.get(name);
        return value != null ? Long.valueOf(value) : null;
    }

    /**
     * True when an invalidated bus key covers this entry, or this entry covers it.
     */
    public boolean matches(String cacheKey) {
        return CacheKeys.matches(canonical, cacheKey);
    }

    @Override
    public String toString() {
        return canonical;
    }
}
