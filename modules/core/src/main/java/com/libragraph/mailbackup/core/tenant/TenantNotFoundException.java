package com.libragraph.mailbackup.core.tenant;

/**
 * Thrown when a tenant is unknown or has been deactivated.
 */
public class TenantNotFoundException extends RuntimeException {

    private final String tenantId;

    public TenantNotFoundException(String tenantId) {
        super("No active tenant: " + tenantId);
        this.tenantId = tenantId;
    }

    public String tenantId() {
        return tenantId;
    }
}
