package com.company.sladashboard.exception;

public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String operation, Throwable cause) {
        super("Entity store unavailable during " + operation, cause);
    }
}
