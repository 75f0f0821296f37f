package com.libragraph.mailbackup.types;

import java.util.Objects;

/**
 * The set of tenants a backup run or query covers: either one tenant or all
 * of them. At most one snapshot may be running per scope, keyed by
 * {@link #key()}.
 *
 * <p>Key format: {@code tenant:{tenantId}} or {@code all}.
 */
public record TenantScope(String tenantId) {

    private static final String ALL_KEY = "all";
    private static final String TENANT_PREFIX = "tenant:";
    private static final TenantScope ALL = new TenantScope(null);

    public TenantScope {
        if (tenantId != null && tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId cannot be blank");
        }
    }

    public static TenantScope all() {
        return ALL;
    }

    public static TenantScope tenant(String tenantId) {
        return new TenantScope(Objects.requireNonNull(tenantId, "tenantId cannot be null"));
    }

    /**
     * Parses a scope key back into a TenantScope.
     *
     * @throws IllegalArgumentException if the key is malformed
     */
    public static TenantScope parse(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        if (ALL_KEY.equals(key)) {
            return ALL;
        }
        if (key.startsWith(TENANT_PREFIX) && key.length() > TENANT_PREFIX.length()) {
            return tenant(key.substring(TENANT_PREFIX.length()));
        }
        throw new IllegalArgumentException("Invalid scope key: " + key);
    }

    public boolean isAll() {
        return tenantId == null;
    }

    public boolean includes(String candidateTenantId) {
        return isAll() || tenantId.equals(candidateTenantId);
    }

    public String key() {
        return isAll() ? ALL_KEY : TENANT_PREFIX + tenantId;
    }

    @Override
    public String toString() {
        return key();
    }
}
