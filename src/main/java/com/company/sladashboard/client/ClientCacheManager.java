package com.company.sladashboard.client;

import com.company.sladashboard.exception.InvalidationUnregisteredException;
import com.company.sladashboard.exception.MutationRejectedException;
import com.company.sladashboard.invalidation.CacheKeys;
import com.company.sladashboard.invalidation.InvalidationCatalog;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Key/value cache for one dashboard client, with per-type TTL, per-key listeners and
 * optimistic mutations.
 * <p>
 * Every method must be called on the event loop passed to the constructor; completions of
 * fetches and remote calls are moved back onto it. Reads never block: a stale read returns
 * the last known value and schedules a background refetch. Results are applied in issue
 * order, so a refetch that completes after a newer one is discarded.
 */
@Slf4j
public class ClientCacheManager {

    private final Executor eventLoop;
    private final TtlPolicy ttlPolicy;
    private final InvalidationCatalog invalidationCatalog;
    private final Clock clock;

    private final Map<String, QueryFetcher> fetchers = new HashMap<>();
    private final Map<QueryKey, CacheEntry> entries = new LinkedHashMap<>();
    private final List<Consumer<QueryKey>> activationListeners = new ArrayList<>();
    private final List<Consumer<QueryKey>> releaseListeners = new ArrayList<>();

    private long sequence;

    public ClientCacheManager(Executor eventLoop,
                              TtlPolicy ttlPolicy,
                              InvalidationCatalog invalidationCatalog,
                              Clock clock) {
        this.eventLoop = eventLoop;
        this.ttlPolicy = ttlPolicy;
        this.invalidationCatalog = invalidationCatalog;
        this.clock = clock;
    }

    public void registerFetcher(String resourceType, QueryFetcher fetcher) {
        fetchers.put(resourceType, fetcher);
    }

    public Executor getEventLoop() {
        return eventLoop;
    }

    // ============================================================
    // Reads
    // ============================================================

    /**
     * Current value for a key. Absent, expired or invalidated entries are reported stale
     * and refetched in the background.
     */
    @SuppressWarnings("unchecked")
    public <T> CacheRead<T> get(QueryKey key) {
        CacheEntry entry = entryFor(key);
        boolean stale = entry.isStale(clock.instant());
        CacheRead<T> read = new CacheRead<>((T) entry.getValue(), stale, entry.isPresent(), entry.getFetchedAt());
        if (stale) {
            refetch(entry);
        }
        return read;
    }

    /**
     * Completes with a fresh value: immediately when the entry is fresh, otherwise when the refetch lands.
     */
    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> load(QueryKey key) {
        CacheEntry entry = entryFor(key);
        if (!entry.isStale(clock.instant())) {
            return CompletableFuture.completedFuture((T) entry.getValue());
        }
        return refetch(entry).thenApply(value -> (T) value);
    }

    /**
     * Value without triggering a fetch.
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<T> peek(QueryKey key) {
        CacheEntry entry = entries.get(key);
        if (entry == null || !entry.isPresent()) {
            return Optional.empty();
        }
        return Optional.ofNullable((T) entry.getValue());
    }

    public boolean isStale(QueryKey key) {
        CacheEntry entry = entries.get(key);
        return entry == null || entry.isStale(clock.instant());
    }

    public boolean contains(QueryKey key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    // ============================================================
    // Local writes
    // ============================================================

    @SuppressWarnings("unchecked")
    public <T> void setQueryData(QueryKey key, UnaryOperator<T> updater) {
        localWrite(entryFor(key), value -> updater.apply((T) value));
    }

    // ============================================================
    // Invalidation
    // ============================================================

    /**
     * Mark every entry matching one of the keys stale. Entries with listeners are refetched
     * now; the rest on their next read.
     */
    public int invalidate(Collection<String> keys) {
        List<CacheEntry> matched = matching(keys);
        for (CacheEntry entry : matched) {
            entry.invalidate(nextSequence());
            log.debug("Invalidated {}", entry.getKey());
            if (entry.hasListeners()) {
                refetch(entry);
            }
        }
        return matched.size();
    }

    /**
     * Mark matching entries stale and refetch all of them now.
     */
    public int invalidateAndRefetch(Collection<String> keys) {
        List<CacheEntry> matched = matching(keys);
        for (CacheEntry entry : matched) {
            entry.invalidate(nextSequence());
            log.debug("Invalidated {}, refetching", entry.getKey());
            refetch(entry);
        }
        return matched.size();
    }

    public int invalidateAll() {
        log.info("Invalidating all {} client cache entries", entries.size());
        return invalidate(List.of(CacheKeys.ALL));
    }

    // ============================================================
    // Listeners and eviction
    // ============================================================

    public Subscription subscribe(QueryKey key, CacheListener listener) {
        CacheEntry entry = entryFor(key);
        boolean first = !entry.hasListeners();
        entry.addListener(listener);
        if (first) {
            activationListeners.forEach(l -> l.accept(key));
        }
        if (entry.isStale(clock.instant())) {
            refetch(entry);
        }

        return () -> {
            if (entry.removeListener(listener) && !entry.hasListeners()) {
                releaseListeners.forEach(l -> l.accept(key));
                if (isEvictable(entry, clock.instant()) && entries.get(key) == entry) {
                    entries.remove(key);
                    log.debug("Evicted {} on release", key);
                }
            }
        };
    }

    /**
     * Canonical keys that currently have at least one listener.
     */
    public List<String> activeKeys() {
        return entries.values().stream()
                .filter(CacheEntry::hasListeners)
                .map(e -> e.getKey().getCanonical())
                .collect(Collectors.toList());
    }

    public void onKeyActivated(Consumer<QueryKey> listener) {
        activationListeners.add(listener);
    }

    public void onKeyReleased(Consumer<QueryKey> listener) {
        releaseListeners.add(listener);
    }

    /**
     * Drop expired entries nobody listens to and nothing is fetching. Released entries that are
     * already expired go at release time; this sweep catches the ones that expire later.
     * {@link InvalidationBusClient} runs it on every heartbeat.
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(e -> isEvictable(e, now));
        int evicted = before - entries.size();
        if (evicted > 0) {
            log.debug("Evicted {} expired client cache entries", evicted);
        }
        return evicted;
    }

    private static boolean isEvictable(CacheEntry entry, Instant now) {
        return !entry.hasListeners() && entry.isExpired(now) && !entry.hasUsefulFetchInFlight();
    }

    // ============================================================
    // Optimistic mutations
    // ============================================================

    /**
     * Apply the mutation locally, run the remote call, then either refetch what the
     * mutation's scenario invalidates or restore the rollback keys.
     * <p>
     * Rollback points are taken when this method is called, after any earlier mutation's
     * local update, so failing this mutation never undoes an earlier one. A key that received
     * a fetched value after the rollback point already shows server state and is not restored.
     *
     * @return completes with the remote result, or exceptionally with {@link MutationRejectedException};
     *         with {@link InvalidationUnregisteredException} when a strict catalog has no rule for the
     *         mutation's scenario, after the write has been committed and its own key refetched
     */
    @SuppressWarnings("unchecked")
    public <T, R> CompletableFuture<R> mutate(OptimisticMutation<T, R> mutation) {
        long rollbackPoint = sequence;
        Map<QueryKey, Snapshot> snapshots = new LinkedHashMap<>();
        for (QueryKey key : mutation.effectiveRollbackKeys()) {
            CacheEntry entry = entries.get(key);
            snapshots.put(key, entry != null
                    ? new Snapshot(entry.getValue(), entry.isPresent())
                    : new Snapshot(null, false));
        }

        UnaryOperator<T> updater = mutation.getLocalUpdater();
        localWrite(entryFor(mutation.getQueryKey()), value -> updater.apply((T) value));

        CompletableFuture<R> remote;
        try {
            remote = mutation.getRemoteCall().get();
        } catch (RuntimeException e) {
            remote = CompletableFuture.failedFuture(e);
        }
        if (remote == null) {
            remote = CompletableFuture.failedFuture(new IllegalStateException("Remote call returned no future"));
        }
        if (mutation.getTimeout() != null) {
            remote = remote.copy().orTimeout(mutation.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        }

        CompletableFuture<R> outcome = new CompletableFuture<>();
        remote.whenCompleteAsync((result, error) -> {
            if (error == null) {
                try {
                    onCommitted(mutation);
                    outcome.complete(result);
                } catch (InvalidationUnregisteredException e) {
                    log.error("Mutation on {} committed but {} has no invalidation rule",
                            mutation.getQueryKey(), mutation.getInvalidationScenario(), e);
                    outcome.completeExceptionally(e);
                }
            } else {
                MutationRejectedException rejection = toRejection(error, mutation);
                log.warn("Mutation on {} failed, rolling back {} keys: {}",
                        mutation.getQueryKey(), snapshots.size(), rejection.getMessage());
                rollback(snapshots, rollbackPoint);
                outcome.completeExceptionally(rejection);
            }
        }, eventLoop);
        return outcome;
    }

    private void onCommitted(OptimisticMutation<?, ?> mutation) {
        Set<String> keys = new LinkedHashSet<>();
        keys.add(mutation.getQueryKey().getCanonical());
        try {
            if (mutation.getInvalidationScenario() != null) {
                keys.addAll(invalidationCatalog.resolve(
                        mutation.getInvalidationScenario(), mutation.getInvalidationParams()));
            }
        } finally {
            int refetched = invalidateAndRefetch(keys);
            log.debug("Mutation on {} committed, refetching {} entries", mutation.getQueryKey(), refetched);
        }
    }

    private void rollback(Map<QueryKey, Snapshot> snapshots, long rollbackPoint) {
        for (Map.Entry<QueryKey, Snapshot> snapshot : snapshots.entrySet()) {
            CacheEntry entry = entries.get(snapshot.getKey());
            if (entry == null) {
                continue;
            }
            if (entry.getFetchedSeq() > rollbackPoint) {
                log.debug("{} refetched since the mutation started, keeping server value", entry.getKey());
                continue;
            }
            entry.restore(snapshot.getValue().value, snapshot.getValue().present);
            notifyListeners(entry);
        }
    }

    private MutationRejectedException toRejection(Throwable error, OptimisticMutation<?, ?> mutation) {
        Throwable cause = unwrap(error);
        if (cause instanceof MutationRejectedException rejected) {
            return rejected;
        }
        if (cause instanceof TimeoutException) {
            return new MutationRejectedException(0,
                    "Mutation on " + mutation.getQueryKey() + " timed out after " + mutation.getTimeout(), cause);
        }
        return new MutationRejectedException(0,
                "Mutation on " + mutation.getQueryKey() + " failed: " + cause.getMessage(), cause);
    }

    // ============================================================
    // Internals
    // ============================================================

    private CacheEntry entryFor(QueryKey key) {
        return entries.computeIfAbsent(key, k -> new CacheEntry(k, ttlPolicy.ttlFor(k.getResourceType())));
    }

    private List<CacheEntry> matching(Collection<String> keys) {
        return entries.values().stream()
                .filter(entry -> keys.stream().anyMatch(entry.getKey()::matches))
                .collect(Collectors.toList());
    }

    private long nextSequence() {
        return ++sequence;
    }

    private void localWrite(CacheEntry entry, UnaryOperator<Object> updater) {
        Object updated = updater.apply(entry.isPresent() ? entry.getValue() : null);
        entry.applyLocal(updated, nextSequence());
        notifyListeners(entry);
    }

    private CompletableFuture<Object> refetch(CacheEntry entry) {
        if (entry.hasUsefulFetchInFlight()) {
            return entry.getPendingResult();
        }

        QueryKey key = entry.getKey();
        QueryFetcher fetcher = fetchers.get(key.getResourceType());
        if (fetcher == null) {
            log.warn("No fetcher registered for {}", key.getResourceType());
            return CompletableFuture.failedFuture(
                    new IllegalStateException("No fetcher registered for " + key.getResourceType()));
        }

        long seq = nextSequence();
        CompletableFuture<Object> result = new CompletableFuture<>();
        entry.startFetch(seq, result);

        CompletableFuture<?> remote;
        try {
            remote = fetcher.fetch(key);
        } catch (RuntimeException e) {
            remote = CompletableFuture.failedFuture(e);
        }
        if (remote == null) {
            remote = CompletableFuture.failedFuture(new IllegalStateException("Fetcher returned no future for " + key));
        }

        remote.whenCompleteAsync((value, error) -> onFetched(key, seq, value, error, result), eventLoop);
        return result;
    }

    private void onFetched(QueryKey key, long seq, Object value, Throwable error, CompletableFuture<Object> result) {
        CacheEntry entry = entries.get(key);

        if (error != null) {
            Throwable cause = unwrap(error);
            log.warn("Fetch of {} failed: {}", key, cause.getMessage());
            if (entry != null) {
                entry.fetchFailed(seq);
            }
            result.completeExceptionally(cause);
            return;
        }

        if (entry == null) {
            result.complete(value);
            return;
        }
        if (seq <= entry.getVersionSeq()) {
            log.debug("Discarding fetch of {} issued at {}, entry already at {}", key, seq, entry.getVersionSeq());
            result.complete(entry.getValue());
            return;
        }

        entry.applyFetched(value, seq, clock.instant());
        notifyListeners(entry);
        result.complete(value);
    }

    private void notifyListeners(CacheEntry entry) {
        for (CacheListener listener : entry.listenersSnapshot()) {
            try {
                listener.onUpdate(entry.getKey(), entry.getValue());
            } catch (RuntimeException e) {
                log.error("Cache listener for {} failed", entry.getKey(), e);
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static final class Snapshot {
        private final Object value;
        private final boolean present;

        private Snapshot(Object value, boolean present) {
            this.value = value;
            this.present = present;
        }
    }
}
