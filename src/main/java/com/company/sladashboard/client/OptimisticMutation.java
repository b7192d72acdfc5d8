package com.company.sladashboard.client;

import com.company.sladashboard.invalidation.InvalidationParams;
import com.company.sladashboard.invalidation.InvalidationScenario;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * A write applied to the client cache before the server confirms it.
 *
 * @param <T> type of the value cached under {@link #queryKey}
 * @param <R> result type of the remote call
 */
@Getter
@Builder
public class OptimisticMutation<T, R> {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    @NonNull
    private final QueryKey queryKey;

    /** Applied synchronously to the value under {@link #queryKey}; receives null when nothing is cached. */
    @NonNull
    private final UnaryOperator<T> localUpdater;

    @NonNull
    private final Supplier<CompletableFuture<R>> remoteCall;

    /** Resolved against the catalog on success; when null only {@link #queryKey} is refetched. */
    private final InvalidationScenario invalidationScenario;

    @Builder.Default
    private final InvalidationParams invalidationParams = InvalidationParams.none();

    /** Keys restored on failure. {@link #queryKey} is always included. */
    private final List<QueryKey> rollbackKeys;

    @Builder.Default
    private final Duration timeout = DEFAULT_TIMEOUT;

    public List<QueryKey> effectiveRollbackKeys() {
        List<QueryKey> keys = new ArrayList<>();
        keys.add(queryKey);
        if (rollbackKeys != null) {
            for (QueryKey key : rollbackKeys) {
                if (!keys.contains(key)) {
                    keys.add(key);
                }
            }
        }
        return keys;
    }
}
