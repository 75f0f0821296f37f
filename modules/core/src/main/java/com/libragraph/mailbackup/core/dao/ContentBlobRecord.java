package com.libragraph.mailbackup.core.dao;

import com.libragraph.mailbackup.util.ContentHash;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record ContentBlobRecord(
        @ColumnName("digest") String digest,
        @ColumnName("size") long size,
        @ColumnName("storage_key") String storageKey,
        @ColumnName("ref_count") long refCount,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("touched_at") Instant touchedAt
) {
    public ContentHash contentHash() {
        return ContentHash.fromHex(digest);
    }
}
