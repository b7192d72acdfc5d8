package com.company.sladashboard.config;

import com.company.sladashboard.cache.DataCache;
import com.company.sladashboard.domain.CacheStatus;
import com.company.sladashboard.domain.enums.CacheState;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.function.ToDoubleFunction;

/**
 * Snapshot gauges for the server data cache. Refresh timers and bus counters
 * are registered by the components that own them.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final DataCache dataCache;

    @Bean
    public MeterBinder dataCacheMetrics() {
        return (reg) -> {
            statusGauge(reg, "sla.cache.entities", "Entities in the current snapshot",
                    CacheStatus::getEntitiesCount);
            statusGauge(reg, "sla.cache.teams", "Teams in the current snapshot",
                    CacheStatus::getTeamsCount);
            statusGauge(reg, "sla.cache.tenants", "Tenants in the current snapshot",
                    CacheStatus::getTenantsCount);
            statusGauge(reg, "sla.cache.version", "Version of the installed snapshot",
                    CacheStatus::getVersion);

            Gauge.builder("sla.cache.age.seconds", dataCache, DataCache::getAgeSeconds)
                    .description("Seconds since the current snapshot was loaded")
                    .baseUnit("seconds")
                    .register(reg);

            // 1 while reads are served from a snapshot
            Gauge.builder("sla.cache.serving", dataCache, cache -> cache.getState().isServing() ? 1 : 0)
                    .description("Whether the cache has a snapshot to serve")
                    .register(reg);

            for (CacheState state : CacheState.values()) {
                Gauge.builder("sla.cache.state", dataCache, cache -> cache.getState() == state ? 1 : 0)
                        .tag("state", state.name().toLowerCase())
                        .register(reg);
            }

            log.info("Data cache metrics registered");
        };
    }

    private void statusGauge(MeterRegistry registry, String name, String description,
                             ToDoubleFunction<CacheStatus> value) {
        Gauge.builder(name, dataCache, cache -> value.applyAsDouble(cache.getCacheStatus()))
                .description(description)
                .register(registry);
    }
}
