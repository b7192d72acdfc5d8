package com.company.sladashboard.domain.enums;

/**
 * Lifecycle of the server data cache.
 * UNINITIALIZED -> LOADING -> READY <-> REFRESHING, any -> STOPPED.
 */
public enum CacheState {
    UNINITIALIZED,
    LOADING,
    READY,
    REFRESHING,
    STOPPED;

    public boolean isServing() {
        return this == READY || this == REFRESHING;
    }
}
