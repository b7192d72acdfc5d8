package com.company.sladashboard.bus;

import com.company.sladashboard.domain.EntityChange;
import com.company.sladashboard.domain.enums.RefreshTrigger;
import com.company.sladashboard.event.CacheRefreshedEvent;
import com.company.sladashboard.event.EntityChangedEvent;
import com.company.sladashboard.event.StoreMutationCommittedEvent;
import com.company.sladashboard.invalidation.CacheKeys;
import com.company.sladashboard.invalidation.InvalidationCatalog;
import com.company.sladashboard.invalidation.InvalidationParams;
import com.company.sladashboard.invalidation.InvalidationScenario;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Turns committed writes and cache refreshes into bus events.
 * <p>
 * All events pass through one single-threaded publisher, so every session sees them in
 * the order they were published. Events are also handed to the Redis relay when enabled.
 */
@Service
@Slf4j
public class InvalidationBus {

    private final DashboardWebSocketHandler webSocketHandler;
    private final InvalidationCatalog invalidationCatalog;
    private final ObjectProvider<RedisInvalidationRelay> relay;
    private final Clock clock;
    private final ExecutorService publisher;
    private final Counter publishedEvents;
    private final String instanceId = UUID.randomUUID().toString();

    @Autowired
    public InvalidationBus(DashboardWebSocketHandler webSocketHandler,
                           InvalidationCatalog invalidationCatalog,
                           ObjectProvider<RedisInvalidationRelay> relay,
                           MeterRegistry meterRegistry,
                           Clock clock) {
        this(webSocketHandler, invalidationCatalog, relay, meterRegistry, clock,
                Executors.newSingleThreadExecutor(r -> {
                    Thread thread = new Thread(r, "invalidation-bus");
                    thread.setDaemon(true);
                    return thread;
                }));
    }

    InvalidationBus(DashboardWebSocketHandler webSocketHandler,
                    InvalidationCatalog invalidationCatalog,
                    ObjectProvider<RedisInvalidationRelay> relay,
                    MeterRegistry meterRegistry,
                    Clock clock,
                    ExecutorService publisher) {
        this.webSocketHandler = webSocketHandler;
        this.invalidationCatalog = invalidationCatalog;
        this.relay = relay;
        this.clock = clock;
        this.publisher = publisher;
        this.publishedEvents = Counter.builder("sla.bus.events.published")
                .description("Events published on the invalidation bus")
                .register(meterRegistry);
    }

    @EventListener
    public void onMutationCommitted(StoreMutationCommittedEvent event) {
        publish(InvalidationEvent.builder()
                .event(event.getMutation().getScenario().name())
                .affectedKeys(event.getAffectedKeys())
                .context(event.getParams().toContext())
                .timestamp(clock.instant())
                .build());
    }

    @EventListener
    public void onCacheRefreshed(CacheRefreshedEvent event) {
        if (event.getTrigger() == RefreshTrigger.WRITE) {
            log.debug("Snapshot v{} refreshed by a write, scoped event follows", event.getStatus().getVersion());
            return;
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("version", event.getStatus().getVersion());
        context.put("trigger", event.getTrigger().tag());
        context.put("lastUpdated", String.valueOf(event.getStatus().getLastUpdated()));

        publish(InvalidationEvent.builder()
                .event(InvalidationEvent.CACHE_UPDATED)
                .affectedKeys(List.of(CacheKeys.ALL))
                .context(context)
                .timestamp(clock.instant())
                .build());
    }

    @EventListener
    public void onEntityChanged(EntityChangedEvent event) {
        EntityChange change = event.getChange();
        InvalidationParams params = InvalidationParams.builder()
                .entityId(change.getEntityId())
                .teamId(change.getTeamId())
                .tenantName(change.getTenantName())
                .teamName(change.getTeamName())
                .build();

        Map<String, Object> context = params.toContext();
        context.put("entityName", change.getEntityName());
        context.put("entityType", change.getEntityType());
        context.put("version", event.getSnapshotVersion());

        publish(InvalidationEvent.builder()
                .event(InvalidationEvent.ENTITY_UPDATED)
                .affectedKeys(invalidationCatalog.resolve(InvalidationScenario.ENTITY_UPDATED, params))
                .context(context)
                .timestamp(clock.instant())
                .build());
    }

    /**
     * Queue an event raised on this instance for local delivery and relay.
     */
    public void publish(InvalidationEvent event) {
        InvalidationEvent stamped = event.withOrigin(instanceId);
        publisher.execute(() -> {
            try {
                webSocketHandler.deliver(stamped);
                relay.ifAvailable(r -> r.relay(stamped));
            } catch (RuntimeException e) {
                log.error("Failed to publish bus event {}", stamped.getEvent(), e);
            }
        });
        publishedEvents.increment();
    }

    /**
     * Queue an event received from another instance for local delivery only.
     */
    public void publishRelayed(InvalidationEvent event) {
        publisher.execute(() -> {
            try {
                webSocketHandler.deliver(event);
            } catch (RuntimeException e) {
                log.error("Failed to deliver relayed bus event {}", event.getEvent(), e);
            }
        });
    }

    public String getInstanceId() {
        return instanceId;
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        publisher.shutdown();
        if (!publisher.awaitTermination(5, TimeUnit.SECONDS)) {
            log.warn("Invalidation bus publisher did not drain in time");
            publisher.shutdownNow();
        }
    }
}
