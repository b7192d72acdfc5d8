package com.company.sladashboard.exception;

public class InvalidationUnregisteredException extends RuntimeException {
    public InvalidationUnregisteredException(String scenario) {
        super("No invalidation rule registered for scenario: " + scenario);
    }
}
