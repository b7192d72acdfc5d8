package com.company.sladashboard.exception;

public class TenantNotFoundException extends RuntimeException {
    public TenantNotFoundException(String tenantName) {
        super("Tenant not found: " + tenantName);
    }
}
