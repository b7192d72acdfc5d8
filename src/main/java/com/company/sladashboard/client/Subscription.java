package com.company.sladashboard.client;

public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
