package com.company.sladashboard.client;

@FunctionalInterface
public interface CacheListener {

    void onUpdate(QueryKey key, Object value);
}
