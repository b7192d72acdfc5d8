package com.company.sladashboard.client;

import java.util.concurrent.CompletableFuture;

/**
 * Loads the current server value for a key. Called on the event loop; must not block it.
 */
@FunctionalInterface
public interface QueryFetcher {

    CompletableFuture<?> fetch(QueryKey key);
}
