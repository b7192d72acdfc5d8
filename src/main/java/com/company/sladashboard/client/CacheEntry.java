package com.company.sladashboard.client;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * One client cache slot. Mutated only by {@link ClientCacheManager} on its event loop.
 * <p>
 * Sequence numbers come from the manager's single counter and order fetches, local writes
 * and invalidations by issue time.
 */
@Getter
public class CacheEntry {

    private final QueryKey key;
    private final Duration ttl;
    private Object value;
    private boolean present;
    private Instant fetchedAt;
    private boolean invalidated;

    // Sequence of the write currently held, fetch or local
    private long versionSeq;
    // Sequence of the last fetch result applied
    private long fetchedSeq;
    private long invalidationSeq;
    private long pendingSeq;
    private CompletableFuture<Object> pendingResult;

    private final List<CacheListener> listeners = new ArrayList<>();

    CacheEntry(QueryKey key, Duration ttl) {
        this.key = key;
        this.ttl = ttl;
    }

    public boolean isExpired(Instant now) {
        return fetchedAt == null || now.isAfter(fetchedAt.plus(ttl));
    }

    public boolean isStale(Instant now) {
        return !present || invalidated || isExpired(now);
    }

    boolean hasListeners() {
        return !listeners.isEmpty();
    }

    /**
     * A fetch in flight supersedes the current value only if it was issued after both
     * the last write and the last invalidation.
     */
    boolean hasUsefulFetchInFlight() {
        return pendingSeq > versionSeq && pendingSeq > invalidationSeq;
    }

    void startFetch(long seq, CompletableFuture<Object> result) {
        this.pendingSeq = seq;
        this.pendingResult = result;
    }

    void fetchFailed(long seq) {
        if (pendingSeq == seq) {
            pendingSeq = 0;
        }
    }

    void applyFetched(Object fetched, long seq, Instant now) {
        this.value = fetched;
        this.present = true;
        this.fetchedAt = now;
        this.versionSeq = seq;
        this.fetchedSeq = seq;
        this.invalidated = invalidationSeq > seq;
    }

    void applyLocal(Object updated, long seq) {
        this.value = updated;
        this.present = true;
        this.versionSeq = seq;
    }

    void restore(Object previous, boolean wasPresent) {
        this.value = previous;
        this.present = wasPresent;
    }

    void invalidate(long seq) {
        this.invalidationSeq = seq;
        this.invalidated = true;
    }

    void addListener(CacheListener listener) {
        listeners.add(listener);
    }

    boolean removeListener(CacheListener listener) {
        return listeners.remove(listener);
    }

    List<CacheListener> listenersSnapshot() {
        return List.copyOf(listeners);
    }
}
