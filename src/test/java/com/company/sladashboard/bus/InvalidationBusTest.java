package com.company.sladashboard.bus;

import com.company.sladashboard.domain.CacheStatus;
import com.company.sladashboard.domain.EntityChange;
import com.company.sladashboard.domain.enums.RefreshTrigger;
import com.company.sladashboard.event.CacheRefreshedEvent;
import com.company.sladashboard.event.EntityChangedEvent;
import com.company.sladashboard.event.StoreMutationCommittedEvent;
import com.company.sladashboard.invalidation.InvalidationCatalog;
import com.company.sladashboard.invalidation.InvalidationParams;
import com.company.sladashboard.invalidation.StoreMutation;
import com.company.sladashboard.util.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("InvalidationBus Tests")
class InvalidationBusTest {

    private static final Instant NOW = Instant.parse("2026-03-15T12:00:00Z");

    private DashboardWebSocketHandler handler;
    private ObjectProvider<RedisInvalidationRelay> relay;
    private SimpleMeterRegistry meterRegistry;
    private InvalidationBus bus;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        handler = mock(DashboardWebSocketHandler.class);
        relay = mock(ObjectProvider.class);
        meterRegistry = new SimpleMeterRegistry();
        bus = newBus(new DirectExecutorService());
    }

    private InvalidationBus newBus(ExecutorService publisher) {
        return new InvalidationBus(handler, new InvalidationCatalog(true), relay, meterRegistry,
                new MutableClock(NOW), publisher);
    }

    private List<InvalidationEvent> delivered() {
        ArgumentCaptor<InvalidationEvent> captor = ArgumentCaptor.forClass(InvalidationEvent.class);
        verify(handler, atLeast(0)).deliver(captor.capture());
        return captor.getAllValues();
    }

    @Test
    @DisplayName("A committed write is published with its scenario, keys and context")
    void testOnMutationCommitted() {
        InvalidationParams params = InvalidationParams.builder().dagId(7L).taskId(70L).build();

        bus.onMutationCommitted(new StoreMutationCommittedEvent(
                StoreMutation.UPDATE_TASK, params, List.of("tasks/dagId=7", "entity-details/id=7")));

        InvalidationEvent event = delivered().get(0);
        assertEquals("TASK_UPDATED", event.getEvent());
        assertEquals(List.of("tasks/dagId=7", "entity-details/id=7"), event.getAffectedKeys());
        assertEquals(7L, event.getContext().get("dagId"));
        assertEquals(70L, event.getContext().get("taskId"));
        assertEquals(NOW, event.getTimestamp());
        assertEquals(bus.getInstanceId(), event.getOrigin());
        assertEquals(1.0, meterRegistry.counter("sla.bus.events.published").count());
        verify(relay).ifAvailable(any());
    }

    @Test
    @DisplayName("A snapshot refresh invalidates every key")
    void testOnCacheRefreshed() {
        CacheStatus status = CacheStatus.builder().loaded(true).version(4).lastUpdated(NOW).build();

        bus.onCacheRefreshed(new CacheRefreshedEvent(status, RefreshTrigger.SCHEDULED));

        InvalidationEvent event = delivered().get(0);
        assertEquals(InvalidationEvent.CACHE_UPDATED, event.getEvent());
        assertEquals(List.of("*"), event.getAffectedKeys());
        assertEquals(4L, event.getContext().get("version"));
        assertEquals("scheduled", event.getContext().get("trigger"));
    }

    @Test
    @DisplayName("A refresh issued by a write leaves invalidation to the write's scoped event")
    void testOnCacheRefreshed_WriteTrigger() {
        CacheStatus status = CacheStatus.builder().loaded(true).version(5).lastUpdated(NOW).build();

        bus.onCacheRefreshed(new CacheRefreshedEvent(status, RefreshTrigger.WRITE));
        bus.onMutationCommitted(new StoreMutationCommittedEvent(StoreMutation.UPDATE_ENTITY,
                InvalidationParams.builder().entityId(1L).teamId(10L).build(), List.of("entities/teamId=10")));

        List<InvalidationEvent> events = delivered();
        assertEquals(1, events.size());
        assertEquals("ENTITY_UPDATED", events.get(0).getEvent());
        assertFalse(events.get(0).getAffectedKeys().contains("*"));
        assertEquals(1.0, meterRegistry.counter("sla.bus.events.published").count());
    }

    @Test
    @DisplayName("An incremental update invalidates the entity's keys through the catalog")
    void testOnEntityChanged() {
        EntityChange change = EntityChange.builder()
                .entityId(3L).entityName("daily_load").entityType("dag")
                .teamId(20L).teamName("Reporting").tenantName("Analytics")
                .changedAt(NOW)
                .build();

        bus.onEntityChanged(new EntityChangedEvent(change, 12L));

        InvalidationEvent event = delivered().get(0);
        assertEquals(InvalidationEvent.ENTITY_UPDATED, event.getEvent());
        assertTrue(event.getAffectedKeys().contains("entities/teamId=20"));
        assertTrue(event.getAffectedKeys().contains("dashboard-summary/tenant=Analytics"));
        assertTrue(event.getAffectedKeys().contains("entity-details/id=3"));
        assertEquals("daily_load", event.getContext().get("entityName"));
        assertEquals(12L, event.getContext().get("version"));
    }

    @Test
    @DisplayName("Events are delivered in publish order")
    void testPublish_Ordering() throws Exception {
        ExecutorService publisher = Executors.newSingleThreadExecutor();
        InvalidationBus ordered = newBus(publisher);

        for (int i = 0; i < 100; i++) {
            ordered.publish(InvalidationEvent.builder()
                    .event("e" + i)
                    .affectedKeys(List.of("*"))
                    .timestamp(NOW)
                    .build());
        }
        ordered.shutdown();

        List<InvalidationEvent> events = delivered();
        assertEquals(100, events.size());
        for (int i = 0; i < 100; i++) {
            assertEquals("e" + i, events.get(i).getEvent());
        }
        assertTrue(publisher.isTerminated());
    }

    @Test
    @DisplayName("A failing delivery does not stop later events")
    void testPublish_DeliveryFailure() {
        when(handler.deliver(any())).thenThrow(new IllegalStateException("boom")).thenReturn(1);

        bus.publish(InvalidationEvent.builder().event("first").affectedKeys(List.of("*")).build());
        bus.publish(InvalidationEvent.builder().event("second").affectedKeys(List.of("*")).build());

        assertEquals(2, delivered().size());
    }

    @Test
    @DisplayName("Relayed events are delivered locally but never relayed again")
    void testPublishRelayed() {
        InvalidationEvent remote = InvalidationEvent.builder()
                .event("TEAM_CREATED")
                .affectedKeys(List.of("teams"))
                .origin("other-instance")
                .build();

        bus.publishRelayed(remote);

        assertEquals("other-instance", delivered().get(0).getOrigin());
        verify(relay, never()).ifAvailable(any());
        assertEquals(0.0, meterRegistry.counter("sla.bus.events.published").count());
    }

    /**
     * Runs tasks on the calling thread.
     */
    private static class DirectExecutorService extends AbstractExecutorService {

        private volatile boolean shutdown;

        @Override
        public void execute(Runnable command) {
            command.run();
        }

        @Override
        public void shutdown() {
            shutdown = true;
        }

        @Override
        public List<Runnable> shutdownNow() {
            shutdown = true;
            return List.of();
        }

        @Override
        public boolean isShutdown() {
            return shutdown;
        }

        @Override
        public boolean isTerminated() {
            return shutdown;
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) {
            return true;
        }
    }
}
