package com.company.sladashboard.client;

import lombok.Value;

import java.time.Instant;

/**
 * Result of a cache read. A stale read still carries the last known value.
 */
@Value
public class CacheRead<T> {
    T value;
    boolean stale;
    boolean present;
    Instant fetchedAt;
}
