package com.libragraph.mailbackup.core.dao;

import com.libragraph.mailbackup.types.ItemIdentity;
import com.libragraph.mailbackup.types.ItemKind;
import com.libragraph.mailbackup.util.ContentHash;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

/**
 * One recorded (identity, digest) pair of a snapshot, joined with the
 * identity columns of its object entry.
 */
public record SnapshotItemRecord(
        @ColumnName("snapshot_id") long snapshotId,
        @ColumnName("entry_id") long entryId,
        @ColumnName("tenant_id") String tenantId,
        @ColumnName("mailbox_id") String mailboxId,
        @ColumnName("provider_item_id") String providerItemId,
        @ColumnName("item_kind") ItemKind kind,
        @ColumnName("digest") String digest,
        @ColumnName("provider_modified_at") Instant providerModifiedAt,
        @ColumnName("recorded_at") Instant recordedAt
) {
    public ItemIdentity identity() {
        return new ItemIdentity(tenantId, mailboxId, providerItemId, kind);
    }

    public ContentHash contentHash() {
        return ContentHash.fromHex(digest);
    }
}
