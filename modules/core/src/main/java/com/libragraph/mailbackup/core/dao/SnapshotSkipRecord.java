package com.libragraph.mailbackup.core.dao;

import com.libragraph.mailbackup.types.ItemIdentity;
import com.libragraph.mailbackup.types.ItemKind;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record SnapshotSkipRecord(
        @ColumnName("snapshot_id") long snapshotId,
        @ColumnName("tenant_id") String tenantId,
        @ColumnName("mailbox_id") String mailboxId,
        @ColumnName("provider_item_id") String providerItemId,
        @ColumnName("item_kind") ItemKind kind,
        @ColumnName("reason") String reason,
        @ColumnName("recorded_at") Instant recordedAt
) {
    public ItemIdentity identity() {
        return new ItemIdentity(tenantId, mailboxId, providerItemId, kind);
    }
}
