package com.libragraph.mailbackup.core.dao;

import com.libragraph.mailbackup.types.ItemIdentity;
import com.libragraph.mailbackup.types.ItemKind;
import com.libragraph.mailbackup.util.ContentHash;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record ObjectEntryRecord(
        @ColumnName("id") long id,
        @ColumnName("tenant_id") String tenantId,
        @ColumnName("mailbox_id") String mailboxId,
        @ColumnName("provider_item_id") String providerItemId,
        @ColumnName("item_kind") ItemKind kind,
        @ColumnName("digest") String digest,
        @ColumnName("size") long size,
        @ColumnName("provider_modified_at") Instant providerModifiedAt,
        @ColumnName("first_seen_at") Instant firstSeenAt,
        @ColumnName("last_seen_at") Instant lastSeenAt,
        @ColumnName("tombstoned_at") Instant tombstonedAt
) {
    public ItemIdentity identity() {
        return new ItemIdentity(tenantId, mailboxId, providerItemId, kind);
    }

    public ContentHash contentHash() {
        return ContentHash.fromHex(digest);
    }

    public boolean isTombstoned() {
        return tombstonedAt != null;
    }
}
