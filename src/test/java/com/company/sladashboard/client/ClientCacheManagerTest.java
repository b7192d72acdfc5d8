package com.company.sladashboard.client;

import com.company.sladashboard.invalidation.InvalidationCatalog;
import com.company.sladashboard.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ClientCacheManager Tests")
class ClientCacheManagerTest {

    private static final QueryKey DAG_7 = QueryKey.of("tasks", "dagId", 7);
    private static final QueryKey DAG_8 = QueryKey.of("tasks", "dagId", 8);
    private static final QueryKey TEAMS = QueryKey.of("teams");

    private MutableClock clock;
    private ControlledFetcher fetcher;
    private ClientCacheManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-15T12:00:00Z"));
        fetcher = new ControlledFetcher();
        manager = new ClientCacheManager(Runnable::run, TtlPolicy.defaults(), new InvalidationCatalog(true), clock);
        manager.registerFetcher("tasks", fetcher);
        manager.registerFetcher("teams", fetcher);
    }

    private void seed(QueryKey key, Object value) {
        manager.get(key);
        fetcher.completeLast(value);
    }

    @Test
    @DisplayName("A miss reads stale and fetches in the background")
    void testGet_Miss() {
        CacheRead<String> read = manager.get(DAG_7);

        assertFalse(read.isPresent());
        assertTrue(read.isStale());
        assertNull(read.getValue());
        assertEquals(1, fetcher.callCount());

        fetcher.complete(0, "tasks-v1");

        CacheRead<String> fresh = manager.get(DAG_7);
        assertEquals("tasks-v1", fresh.getValue());
        assertFalse(fresh.isStale());
        assertEquals(clock.instant(), fresh.getFetchedAt());
        assertEquals(1, fetcher.callCount());
    }

    @Test
    @DisplayName("Concurrent reads of a missing key share one fetch")
    void testGet_DedupesFetches() {
        manager.get(DAG_7);
        manager.get(DAG_7);
        CompletableFuture<String> loaded = manager.load(DAG_7);

        assertEquals(1, fetcher.callCount());
        fetcher.complete(0, "tasks-v1");
        assertEquals("tasks-v1", loaded.join());
    }

    @Test
    @DisplayName("Entries go stale after their type's TTL and still return the old value")
    void testGet_TtlExpiry() {
        seed(DAG_7, "tasks-v1");
        seed(TEAMS, "teams-v1");

        clock.advance(Duration.ofMinutes(5).plusSeconds(1));

        assertTrue(manager.isStale(DAG_7));
        assertFalse(manager.isStale(TEAMS));

        CacheRead<String> read = manager.get(DAG_7);
        assertTrue(read.isStale());
        assertEquals("tasks-v1", read.getValue());
        assertEquals(3, fetcher.callCount());
    }

    @Test
    @DisplayName("A fetch that completes after a newer one is discarded")
    void testFetch_OutOfOrderCompletion() {
        manager.get(DAG_7);
        manager.invalidate(List.of("tasks/dagId=7"));
        manager.get(DAG_7);
        assertEquals(2, fetcher.callCount());

        fetcher.complete(1, "newer");
        fetcher.complete(0, "older");

        CacheRead<String> read = manager.get(DAG_7);
        assertEquals("newer", read.getValue());
        assertFalse(read.isStale());
    }

    @Test
    @DisplayName("A fetch issued before an invalidation does not make the entry fresh")
    void testFetch_IssuedBeforeInvalidation() {
        manager.get(DAG_7);
        manager.invalidate(List.of("tasks"));

        fetcher.complete(0, "pre-invalidation");

        assertEquals("pre-invalidation", manager.<String>peek(DAG_7).orElseThrow());
        assertTrue(manager.isStale(DAG_7));
    }

    @Test
    @DisplayName("A fetch issued before a local write does not overwrite it")
    void testFetch_IssuedBeforeLocalWrite() {
        manager.get(DAG_7);
        manager.<String>setQueryData(DAG_7, old -> "local");

        fetcher.complete(0, "server");

        assertEquals("local", manager.<String>peek(DAG_7).orElseThrow());
    }

    @Test
    @DisplayName("Invalidation matches by key prefix and is lazy without listeners")
    void testInvalidate_Lazy() {
        seed(DAG_7, "seven");
        seed(DAG_8, "eight");
        seed(TEAMS, "teams");

        assertEquals(2, manager.invalidate(List.of("tasks")));

        assertEquals(3, fetcher.callCount());
        assertTrue(manager.isStale(DAG_7));
        assertTrue(manager.isStale(DAG_8));
        assertFalse(manager.isStale(TEAMS));
        assertEquals("seven", manager.<String>peek(DAG_7).orElseThrow());
    }

    @Test
    @DisplayName("Invalidated entries with listeners are refetched immediately")
    void testInvalidate_RefetchesObserved() {
        List<Object> updates = new ArrayList<>();
        manager.subscribe(DAG_7, (key, value) -> updates.add(value));
        fetcher.completeLast("seven-v1");
        seed(DAG_8, "eight");

        manager.invalidate(List.of("tasks/dagId=7"));

        assertEquals(3, fetcher.callCount());
        assertEquals(DAG_7, fetcher.keyOf(2));
        fetcher.complete(2, "seven-v2");
        assertEquals(List.of("seven-v1", "seven-v2"), updates);
    }

    @Test
    @DisplayName("Invalidating everything marks every entry stale")
    void testInvalidateAll() {
        seed(DAG_7, "seven");
        seed(TEAMS, "teams");

        assertEquals(2, manager.invalidateAll());
        assertTrue(manager.isStale(DAG_7));
        assertTrue(manager.isStale(TEAMS));
    }

    @Test
    @DisplayName("First listener activates the key and the last one releases it")
    void testSubscribe_ActivationAndRelease() {
        List<QueryKey> activated = new ArrayList<>();
        List<QueryKey> released = new ArrayList<>();
        manager.onKeyActivated(activated::add);
        manager.onKeyReleased(released::add);

        Subscription first = manager.subscribe(DAG_7, (key, value) -> { });
        Subscription second = manager.subscribe(DAG_7, (key, value) -> { });

        assertEquals(List.of(DAG_7), activated);
        assertEquals(List.of("tasks/dagId=7"), manager.activeKeys());
        assertEquals(1, fetcher.callCount());

        first.close();
        assertTrue(released.isEmpty());
        second.close();
        assertEquals(List.of(DAG_7), released);
        assertTrue(manager.activeKeys().isEmpty());

        second.close();
        assertEquals(1, released.size());
    }

    @Test
    @DisplayName("A failing listener does not stop the others")
    void testListenerFailure() {
        List<Object> updates = new ArrayList<>();
        manager.subscribe(DAG_7, (key, value) -> {
            throw new IllegalStateException("listener broke");
        });
        manager.subscribe(DAG_7, (key, value) -> updates.add(value));

        fetcher.completeLast("seven");

        assertEquals(List.of("seven"), updates);
    }

    @Test
    @DisplayName("Eviction drops expired entries nobody listens to")
    void testEvictExpired() {
        seed(DAG_7, "seven");
        seed(TEAMS, "teams");
        manager.subscribe(DAG_8, (key, value) -> { });
        fetcher.completeLast("eight");

        clock.advance(Duration.ofMinutes(10));

        assertEquals(1, manager.evictExpired());
        assertFalse(manager.contains(DAG_7));
        assertTrue(manager.contains(DAG_8));
        assertTrue(manager.contains(TEAMS));
    }

    @Test
    @DisplayName("Releasing the last listener of an expired entry evicts it")
    void testSubscribe_ReleaseEvictsExpired() {
        Subscription expired = manager.subscribe(DAG_7, (key, value) -> { });
        fetcher.completeLast("seven");
        Subscription fresh = manager.subscribe(TEAMS, (key, value) -> { });
        fetcher.completeLast("teams");

        clock.advance(Duration.ofMinutes(6));
        expired.close();
        fresh.close();

        assertFalse(manager.contains(DAG_7));
        assertTrue(manager.contains(TEAMS));
        assertEquals("teams", manager.<String>peek(TEAMS).orElseThrow());
    }

    @Test
    @DisplayName("Releasing an entry with a fetch in flight keeps it for the result")
    void testSubscribe_ReleaseKeepsPendingFetch() {
        Subscription subscription = manager.subscribe(DAG_7, (key, value) -> { });

        subscription.close();
        assertTrue(manager.contains(DAG_7));

        fetcher.completeLast("seven");
        assertEquals("seven", manager.<String>peek(DAG_7).orElseThrow());
    }

    @Test
    @DisplayName("A failed fetch fails the load and a later read retries")
    void testFetchFailure() {
        CompletableFuture<String> loaded = manager.load(DAG_7);

        fetcher.fail(0, new IllegalStateException("HTTP 503"));

        ExecutionException e = assertThrows(ExecutionException.class, loaded::get);
        assertEquals("HTTP 503", e.getCause().getMessage());
        assertFalse(manager.peek(DAG_7).isPresent());

        manager.get(DAG_7);
        assertEquals(2, fetcher.callCount());
    }

    @Test
    @DisplayName("Loading a type without a fetcher fails")
    void testLoad_NoFetcher() {
        CompletableFuture<Object> loaded = manager.load(QueryKey.of("users"));

        assertTrue(loaded.isCompletedExceptionally());
        assertEquals(0, fetcher.callCount());
    }

    @Test
    @DisplayName("Local writes notify listeners without fetching")
    void testSetQueryData() {
        seed(TEAMS, "teams-v1");
        List<Object> updates = new ArrayList<>();
        manager.subscribe(TEAMS, (key, value) -> updates.add(value));

        manager.<String>setQueryData(TEAMS, old -> old + "+local");

        assertEquals(List.of("teams-v1+local"), updates);
        assertEquals(1, fetcher.callCount());
    }
}
