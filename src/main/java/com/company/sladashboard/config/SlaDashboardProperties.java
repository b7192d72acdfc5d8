package com.company.sladashboard.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings under {@code sladashboard.*}. Override via {@code application.yml} or
 * environment variables, e.g. {@code SLADASHBOARD_CACHE_REFRESH_INTERVAL=1h}.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "sladashboard")
public class SlaDashboardProperties {

    private Cache cache = new Cache();
    private Invalidation invalidation = new Invalidation();
    private Bus bus = new Bus();
    private Http http = new Http();

    @Getter
    @Setter
    public static class Cache {

        /** Interval between full snapshot refreshes; reset by a forced refresh. */
        private Duration refreshInterval = Duration.ofHours(6);

        /** Delay between load attempts while no snapshot has been installed. */
        private Duration initialRetryDelay = Duration.ofMinutes(1);

        /** Length of the precomputed default metrics range. */
        private int defaultRangeDays = 30;

        /** How long incremental changes stay in the recent-changes list. */
        private Duration recentChangesWindow = Duration.ofHours(6);
    }

    @Getter
    @Setter
    public static class Invalidation {

        /** Throw on unregistered scenarios instead of invalidating everything. */
        private boolean strict = false;
    }

    @Getter
    @Setter
    public static class Bus {

        private String path = "/ws";

        private List<String> allowedOrigins = List.of("*");

        /** Sessions without inbound frames for this long are closed. */
        private Duration idleTimeout = Duration.ofSeconds(60);

        private Duration sendTimeLimit = Duration.ofSeconds(5);

        private DataSize sendBufferSize = DataSize.ofKilobytes(512);

        private Redis redis = new Redis();
    }

    @Getter
    @Setter
    public static class Redis {

        private boolean enabled = false;

        private String channel = "sla:changes";
    }

    @Getter
    @Setter
    public static class Http {

        /** Cache-Control max-age per resource type for read endpoints. */
        private Map<String, Duration> maxAge = new LinkedHashMap<>(Map.of(
                "dashboard-summary", Duration.ofSeconds(30),
                "entities", Duration.ofSeconds(30),
                "teams", Duration.ofMinutes(5),
                "tenants", Duration.ofMinutes(5)
        ));

        public Duration maxAgeFor(String resourceType) {
            return maxAge.getOrDefault(resourceType, Duration.ZERO);
        }
    }
}
