package com.company.sladashboard.cache;

import com.company.sladashboard.config.SlaDashboardProperties;
import com.company.sladashboard.domain.CacheStatus;
import com.company.sladashboard.domain.DashboardMetrics;
import com.company.sladashboard.domain.EntityChange;
import com.company.sladashboard.domain.SlaEntity;
import com.company.sladashboard.domain.Team;
import com.company.sladashboard.domain.Tenant;
import com.company.sladashboard.domain.enums.CacheState;
import com.company.sladashboard.domain.enums.EntityStatus;
import com.company.sladashboard.domain.enums.EntityType;
import com.company.sladashboard.domain.enums.RefreshTrigger;
import com.company.sladashboard.dto.request.IncrementalUpdateRequest;
import com.company.sladashboard.event.CacheRefreshedEvent;
import com.company.sladashboard.event.EntityChangedEvent;
import com.company.sladashboard.exception.CacheNotReadyException;
import com.company.sladashboard.exception.StoreUnavailableException;
import com.company.sladashboard.repository.InMemoryEntityStore;
import com.company.sladashboard.service.MetricsAggregator;
import com.company.sladashboard.util.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("DataCache Tests")
class DataCacheTest {

    private static final Instant T0 = Instant.parse("2026-03-15T12:00:00Z");
    private static final String TENANT = "Data Engineering";
    private static final String OTHER_TENANT = "Analytics";

    private InMemoryEntityStore store;
    private MutableClock clock;
    private TaskScheduler taskScheduler;
    private ApplicationEventPublisher eventPublisher;
    private SimpleMeterRegistry meterRegistry;
    private SlaDashboardProperties properties;
    private DataCache cache;

    private final List<Runnable> scheduledTasks = new CopyOnWriteArrayList<>();
    private final List<Instant> scheduledTimes = new CopyOnWriteArrayList<>();
    private final List<ScheduledFuture<?>> scheduledFutures = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore();
        store.put(Tenant.builder().id(1L).name(TENANT).active(true).build());
        store.put(Tenant.builder().id(2L).name(OTHER_TENANT).active(true).build());
        store.put(Team.builder().id(10L).name("Platform").build());
        store.put(Team.builder().id(20L).name("Reporting").build());
        store.put(entity(1L, "orders", EntityType.TABLE, TENANT, 10L, 100.0));
        store.put(entity(2L, "customers", EntityType.TABLE, TENANT, 10L, 90.0));
        store.put(entity(3L, "daily_load", EntityType.DAG, TENANT, 20L, 80.0));
        store.put(entity(4L, "sessions", EntityType.TABLE, OTHER_TENANT, 20L, 50.0));

        clock = new MutableClock(T0);
        taskScheduler = mock(TaskScheduler.class);
        when(taskScheduler.schedule(any(Runnable.class), any(Instant.class))).thenAnswer(invocation -> {
            scheduledTasks.add(invocation.getArgument(0));
            scheduledTimes.add(invocation.getArgument(1));
            ScheduledFuture<?> future = mock(ScheduledFuture.class);
            scheduledFutures.add(future);
            return future;
        });
        eventPublisher = mock(ApplicationEventPublisher.class);
        meterRegistry = new SimpleMeterRegistry();
        properties = new SlaDashboardProperties();

        cache = new DataCache(store, new MetricsAggregator(), taskScheduler, properties, eventPublisher,
                meterRegistry, OpenTelemetry.noop().getTracer("test"), clock);
    }

    private static SlaEntity entity(long id, String name, EntityType type, String tenant, long teamId, double sla) {
        return SlaEntity.builder()
                .id(id)
                .name(name)
                .type(type)
                .tenantName(tenant)
                .teamId(teamId)
                .currentSla(sla)
                .slaTarget(95.0)
                .status(EntityStatus.HEALTHY)
                .lastRefreshed(T0.minus(Duration.ofDays(2)))
                .active(true)
                .build();
    }

    private Runnable lastScheduledTask() {
        return scheduledTasks.get(scheduledTasks.size() - 1);
    }

    @Test
    @DisplayName("Reads before the first load signal not-ready instead of returning empty data")
    void testReadBeforeStart() {
        CacheNotReadyException e = assertThrows(CacheNotReadyException.class, () -> cache.getAllEntities());
        assertEquals(CacheState.UNINITIALIZED, e.getState());
        assertThrows(CacheNotReadyException.class, () -> cache.getMetrics(TENANT));

        CacheStatus status = cache.getCacheStatus();
        assertFalse(status.isLoaded());
        assertEquals(0, status.getEntitiesCount());
    }

    @Test
    @DisplayName("Start loads the snapshot and schedules the next refresh one interval later")
    void testStart() {
        cache.start();

        assertEquals(CacheState.READY, cache.getState());
        assertTrue(cache.isRunning());
        assertEquals(4, cache.getAllEntities().size());
        assertEquals(3, cache.getEntitiesByTenant(TENANT).size());
        assertEquals(List.of(T0.plus(Duration.ofHours(6))), scheduledTimes);

        CacheStatus status = cache.getCacheStatus();
        assertTrue(status.isLoaded());
        assertEquals(T0, status.getLastUpdated());
        assertEquals(4, status.getEntitiesCount());
        assertEquals(2, status.getTeamsCount());
        assertEquals(2, status.getTenantsCount());

        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publishEvent(events.capture());
        CacheRefreshedEvent refreshed = (CacheRefreshedEvent) events.getValue();
        assertEquals(RefreshTrigger.INITIAL, refreshed.getTrigger());
    }

    @Test
    @DisplayName("Tenant metrics are precomputed from the snapshot's entities")
    void testPrecomputedMetrics() {
        cache.start();

        DashboardMetrics metrics = cache.getMetrics(TENANT).orElseThrow();
        assertEquals(90.0, metrics.getOverallCompliance());
        assertEquals(95.0, metrics.getTablesCompliance());
        assertEquals(80.0, metrics.getDagsCompliance());
        assertEquals(3, metrics.getEntitiesCount());

        DashboardMetrics team = cache.getTeamMetrics(TENANT, 10L).orElseThrow();
        assertEquals(95.0, team.getOverallCompliance());
        assertEquals(2, team.getEntitiesCount());

        assertEquals(DashboardMetrics.empty(), cache.getTeamMetrics(TENANT, 99L).orElseThrow());
        assertTrue(cache.getMetrics("Unknown").isEmpty());
    }

    @Test
    @DisplayName("Teams by tenant are the teams owning the tenant's entities")
    void testTeamsByTenant() {
        cache.start();

        assertEquals(2, cache.getTeamsByTenant(TENANT).size());
        List<Team> analyticsTeams = cache.getTeamsByTenant(OTHER_TENANT);
        assertEquals(1, analyticsTeams.size());
        assertEquals("Reporting", analyticsTeams.get(0).getName());
    }

    @Test
    @DisplayName("A failed first load keeps reads unavailable and retries after the initial retry delay")
    void testStart_StoreUnavailable() {
        store.setUnavailable(true);

        cache.start();

        assertEquals(CacheState.LOADING, cache.getState());
        assertThrows(CacheNotReadyException.class, () -> cache.getAllEntities());
        assertEquals(List.of(T0.plus(Duration.ofMinutes(1))), scheduledTimes);
        assertEquals(1.0, meterRegistry.counter("sla.cache.refresh.failures").count());

        store.setUnavailable(false);
        clock.advance(Duration.ofMinutes(1));
        lastScheduledTask().run();

        assertEquals(CacheState.READY, cache.getState());
        assertEquals(4, cache.getAllEntities().size());
        assertEquals(T0.plus(Duration.ofMinutes(1)).plus(Duration.ofHours(6)), scheduledTimes.get(1));
    }

    @Test
    @DisplayName("Metrics read right after a scheduled refresh reflect the new fetch")
    void testScheduledRefresh_ReflectsNewData() {
        cache.start();
        assertEquals(T0, cache.getCacheStatus().getLastUpdated());

        store.put(entity(2L, "customers", EntityType.TABLE, TENANT, 10L, 60.0));
        clock.advance(Duration.ofHours(6));
        lastScheduledTask().run();

        assertEquals(T0.plus(Duration.ofHours(6)), cache.getCacheStatus().getLastUpdated());
        assertEquals(80.0, cache.getMetrics(TENANT).orElseThrow().getTablesCompliance());
        assertEquals(2, cache.getCacheStatus().getVersion());
    }

    @Test
    @DisplayName("A failed refresh keeps serving the previous snapshot and schedules the next attempt")
    void testScheduledRefresh_Failure() {
        cache.start();
        CacheSnapshot before = cache.getSnapshot();

        store.setUnavailable(true);
        clock.advance(Duration.ofHours(6));
        lastScheduledTask().run();

        assertSame(before, cache.getSnapshot());
        assertEquals(CacheState.READY, cache.getState());
        assertEquals(1.0, meterRegistry.counter("sla.cache.refresh.failures").count());
        assertEquals(2, scheduledTimes.size());
        assertEquals(T0.plus(Duration.ofHours(12)), scheduledTimes.get(1));
    }

    @Test
    @DisplayName("Forced refresh installs new data and restarts the schedule")
    void testForceRefresh() {
        cache.start();
        store.put(entity(5L, "events", EntityType.DAG, TENANT, 20L, 70.0));
        clock.advance(Duration.ofHours(2));

        CacheStatus status = cache.forceRefresh();

        assertEquals(5, status.getEntitiesCount());
        assertEquals(T0.plus(Duration.ofHours(2)), status.getLastUpdated());
        verify(scheduledFutures.get(0)).cancel(false);
        assertEquals(T0.plus(Duration.ofHours(8)), scheduledTimes.get(1));
        assertEquals(1, meterRegistry.timer("sla.cache.refresh", "trigger", "forced", "outcome", "success").count());
    }

    @Test
    @DisplayName("Forced refresh fails loudly and keeps the snapshot when the store is down")
    void testForceRefresh_StoreUnavailable() {
        cache.start();
        CacheSnapshot before = cache.getSnapshot();
        store.setUnavailable(true);

        assertThrows(StoreUnavailableException.class, () -> cache.forceRefresh());
        assertSame(before, cache.getSnapshot());
    }

    @Test
    @DisplayName("A refresh issued by a write is tagged as such on the timer and the event")
    void testForceRefresh_WriteTrigger() {
        cache.start();
        store.put(entity(5L, "events", EntityType.DAG, TENANT, 20L, 70.0));

        CacheStatus status = cache.forceRefresh(RefreshTrigger.WRITE);

        assertEquals(5, status.getEntitiesCount());
        assertEquals(1, meterRegistry.timer("sla.cache.refresh", "trigger", "write", "outcome", "success").count());
        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher, times(2)).publishEvent(events.capture());
        assertEquals(RefreshTrigger.WRITE, ((CacheRefreshedEvent) events.getAllValues().get(1)).getTrigger());
    }

    @Test
    @DisplayName("Forced refresh before start is rejected")
    void testForceRefresh_BeforeStart() {
        assertThrows(CacheNotReadyException.class, () -> cache.forceRefresh());
    }

    @Test
    @DisplayName("Concurrent refreshes install exactly one snapshot per refresh, newest last")
    void testConcurrentRefreshes() throws Exception {
        cache.start();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<CacheStatus>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> cache.forceRefresh()));
            }
            for (Future<CacheStatus> result : results) {
                result.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(9, cache.getCacheStatus().getVersion());
        assertEquals(9, store.getListEntitiesCalls());
        assertEquals(4, cache.getAllEntities().size());
    }

    @Test
    @DisplayName("Readers never observe entities and metrics from different loads")
    void testSnapshotAtomicity() throws Exception {
        cache.start();
        AtomicBoolean torn = new AtomicBoolean();
        AtomicBoolean done = new AtomicBoolean();
        CountDownLatch readerStarted = new CountDownLatch(1);

        Thread reader = new Thread(() -> {
            readerStarted.countDown();
            while (!done.get()) {
                CacheSnapshot snapshot = cache.getSnapshot();
                int entities = snapshot.entitiesForTenant(TENANT).size();
                if (snapshot.getMetricsByTenant().get(TENANT).getEntitiesCount() != entities) {
                    torn.set(true);
                }
            }
        });
        reader.start();
        readerStarted.await();

        for (int i = 0; i < 50; i++) {
            store.put(entity(100L + i, "table_" + i, EntityType.TABLE, TENANT, 10L, i % 100));
            cache.forceRefresh();
        }
        done.set(true);
        reader.join(10_000);

        assertFalse(torn.get());
        assertEquals(53, cache.getMetrics(TENANT).orElseThrow().getEntitiesCount());
    }

    @Test
    @DisplayName("Incremental update installs a new snapshot with the entity replaced")
    void testIncrementalUpdate() {
        cache.start();
        CacheSnapshot before = cache.getSnapshot();
        clock.advance(Duration.ofMinutes(5));

        Optional<EntityChange> change = cache.applyIncrementalUpdate(IncrementalUpdateRequest.builder()
                .entityName("customers")
                .entityType("table")
                .teamName("Platform")
                .currentSla(60.0)
                .status(EntityStatus.CRITICAL)
                .build());

        assertTrue(change.isPresent());
        assertEquals(2L, change.get().getEntityId());
        assertEquals(TENANT, change.get().getTenantName());

        CacheSnapshot after = cache.getSnapshot();
        assertNotSame(before, after);
        assertEquals(before.getVersion() + 1, after.getVersion());
        assertEquals(before.getLastUpdated(), after.getLastUpdated());
        assertEquals(90.0, before.getMetricsByTenant().get(TENANT).getTablesCompliance());
        assertEquals(80.0, after.getMetricsByTenant().get(TENANT).getTablesCompliance());
        assertEquals(80.0, cache.getTeamMetrics(TENANT, 10L).orElseThrow().getOverallCompliance());

        SlaEntity updated = cache.getEntitiesByTeam(TENANT, 10L).stream()
                .filter(e -> e.getId() == 2L).findFirst().orElseThrow();
        assertEquals(EntityStatus.CRITICAL, updated.getStatus());
        assertEquals(T0.plus(Duration.ofMinutes(5)), updated.getLastRefreshed());

        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher, times(2)).publishEvent(events.capture());
        EntityChangedEvent changed = (EntityChangedEvent) events.getAllValues().get(1);
        assertEquals(after.getVersion(), changed.getSnapshotVersion());
    }

    @Test
    @DisplayName("Incremental update for an unknown entity or team changes nothing")
    void testIncrementalUpdate_Unknown() {
        cache.start();
        CacheSnapshot before = cache.getSnapshot();

        assertTrue(cache.applyIncrementalUpdate(IncrementalUpdateRequest.builder()
                .entityName("missing").entityType("table").teamName("Platform").build()).isEmpty());
        assertTrue(cache.applyIncrementalUpdate(IncrementalUpdateRequest.builder()
                .entityName("orders").entityType("table").teamName("Nobody").build()).isEmpty());
        assertTrue(cache.applyIncrementalUpdate(IncrementalUpdateRequest.builder()
                .entityName("orders").entityType("dag").teamName("Platform").build()).isEmpty());

        assertSame(before, cache.getSnapshot());
    }

    @Test
    @DisplayName("Recent changes are newest first, filterable and expire after the window")
    void testRecentChanges() {
        cache.start();
        cache.applyIncrementalUpdate(IncrementalUpdateRequest.builder()
                .entityName("orders").entityType("table").teamName("Platform").currentSla(99.0).build());
        clock.advance(Duration.ofMinutes(1));
        cache.applyIncrementalUpdate(IncrementalUpdateRequest.builder()
                .entityName("daily_load").entityType("dag").teamName("Reporting").currentSla(85.0).build());

        List<EntityChange> changes = cache.getRecentChanges(null, null);
        assertEquals(2, changes.size());
        assertEquals("daily_load", changes.get(0).getEntityName());
        assertEquals(1, cache.getRecentChanges(TENANT, "Platform").size());
        assertTrue(cache.getRecentChanges(OTHER_TENANT, null).isEmpty());

        clock.advance(Duration.ofHours(6).minusSeconds(30));
        assertEquals(1, cache.getRecentChanges(null, null).size());

        // A full refresh carries the retained changes over
        cache.forceRefresh();
        assertEquals(1, cache.getCacheStatus().getRecentChangesCount());
    }

    @Test
    @DisplayName("Date-range metrics only include entities refreshed inside the range")
    void testCalculateMetricsForDateRange() {
        store.put(entity(1L, "orders", EntityType.TABLE, TENANT, 10L, 100.0).toBuilder()
                .lastRefreshed(Instant.parse("2026-03-15T08:00:00Z")).build());
        cache.start();

        LocalDate today = LocalDate.of(2026, 3, 15);
        DashboardMetrics todayOnly = cache.calculateMetricsForDateRange(TENANT, null, today, today);
        assertEquals(1, todayOnly.getEntitiesCount());
        assertEquals(100.0, todayOnly.getOverallCompliance());

        DashboardMetrics lastWeek = cache.calculateMetricsForDateRange(TENANT, null, today.minusDays(6), today);
        assertEquals(3, lastWeek.getEntitiesCount());

        DashboardMetrics teamOnly = cache.calculateMetricsForDateRange(TENANT, 20L, today.minusDays(6), today);
        assertEquals(1, teamOnly.getEntitiesCount());
        assertEquals(80.0, teamOnly.getDagsCompliance());
    }

    @Test
    @DisplayName("Stop cancels the schedule and releases the snapshot")
    void testStop() {
        cache.start();

        cache.stop();

        assertEquals(CacheState.STOPPED, cache.getState());
        assertFalse(cache.isRunning());
        verify(scheduledFutures.get(0)).cancel(false);
        CacheNotReadyException e = assertThrows(CacheNotReadyException.class, () -> cache.getAllEntities());
        assertEquals(CacheState.STOPPED, e.getState());
        assertThrows(CacheNotReadyException.class, () -> cache.forceRefresh());
    }
}
