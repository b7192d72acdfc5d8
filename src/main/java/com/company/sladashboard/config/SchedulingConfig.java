package com.company.sladashboard.config;

import com.company.sladashboard.invalidation.InvalidationCatalog;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Scheduler, clock and invalidation catalog shared by the cache and the bus.
 */
@Configuration
@Slf4j
public class SchedulingConfig {

    @Bean(name = "taskScheduler")
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("sla-scheduler-");
        scheduler.setErrorHandler(t -> log.error("Scheduled task failed", t));
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public InvalidationCatalog invalidationCatalog(SlaDashboardProperties properties,
                                                   MeterRegistry meterRegistry) {
        boolean strict = properties.getInvalidation().isStrict();
        log.info("Invalidation catalog running in {} mode", strict ? "strict" : "lenient");
        return new InvalidationCatalog(strict, meterRegistry);
    }
}
