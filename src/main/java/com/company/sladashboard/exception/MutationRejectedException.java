package com.company.sladashboard.exception;

/**
 * A write rejected by the store or by the remote API. Carries the HTTP status
 * the rejection maps to; 0 when the request never reached the server.
 */
public class MutationRejectedException extends RuntimeException {

    public static final int DEFAULT_STATUS = 422;

    private final int status;

    public MutationRejectedException(String message) {
        this(DEFAULT_STATUS, message, null);
    }

    public MutationRejectedException(int status, String message) {
        this(status, message, null);
    }

    public MutationRejectedException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
