package com.company.sladashboard.exception;

import com.company.sladashboard.domain.enums.CacheState;

/**
 * Thrown by cache reads before the first snapshot has been installed, or after shutdown.
 */
public class CacheNotReadyException extends RuntimeException {

    private final CacheState state;

    public CacheNotReadyException(CacheState state) {
        super("Dashboard cache not ready (state=" + state + ")");
        this.state = state;
    }

    public CacheState getState() {
        return state;
    }
}
