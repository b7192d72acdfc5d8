package com.company.sladashboard.exception;

public class EntityNotFoundException extends RuntimeException {
    public EntityNotFoundException(String kind, Object id) {
        super(kind + " not found: " + id);
    }
}
