package com.libragraph.mailbackup.core.dao;

import com.libragraph.mailbackup.types.SnapshotStatus;
import com.libragraph.mailbackup.types.TenantScope;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record SnapshotRecord(
        @ColumnName("id") long id,
        @ColumnName("scope") String scope,
        @ColumnName("label") String label,
        @ColumnName("status") SnapshotStatus status,
        @ColumnName("started_at") Instant startedAt,
        @ColumnName("ended_at") Instant endedAt,
        @ColumnName("failure") String failure
) {
    public TenantScope tenantScope() {
        return TenantScope.parse(scope);
    }
}
