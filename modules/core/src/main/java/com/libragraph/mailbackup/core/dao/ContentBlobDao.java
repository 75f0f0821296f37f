package com.libragraph.mailbackup.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(ContentBlobRecord.class)
public interface ContentBlobDao {

    String UNREFERENCED_BY_SNAPSHOTS =
            "NOT EXISTS (SELECT 1 FROM snapshot_item si WHERE si.digest = :digest)";

    @SqlQuery("SELECT * FROM content_blob WHERE digest = :digest")
    Optional<ContentBlobRecord> findByDigest(@Bind("digest") String digest);

    /**
     * Inserts a first-seen blob holding one reference.
     * Fails with a unique violation if a concurrent writer got there first.
     */
    @SqlUpdate("INSERT INTO content_blob (digest, size, storage_key, ref_count, created_at, touched_at) " +
            "VALUES (:digest, :size, :storageKey, 1, :now, :now)")
    void insert(@Bind("digest") String digest,
                @Bind("size") long size,
                @Bind("storageKey") String storageKey,
                @Bind("now") Instant now);

    @SqlUpdate("UPDATE content_blob SET ref_count = ref_count + 1, touched_at = :now " +
            "WHERE digest = :digest")
    int incrementRefCount(@Bind("digest") String digest, @Bind("now") Instant now);

    /**
     * Decrements without ever going below zero. Returns 0 when the blob is
     * missing or already unreferenced.
     */
    @SqlUpdate("UPDATE content_blob SET ref_count = ref_count - 1, touched_at = :now " +
            "WHERE digest = :digest AND ref_count > 0")
    int decrementRefCount(@Bind("digest") String digest, @Bind("now") Instant now);

    @SqlQuery("SELECT b.* FROM content_blob b " +
            "WHERE b.ref_count = 0 AND b.touched_at < :cutoff " +
            "AND NOT EXISTS (SELECT 1 FROM snapshot_item si WHERE si.digest = b.digest) " +
            "ORDER BY b.touched_at LIMIT :limit")
    List<ContentBlobRecord> findReclaimable(@Bind("cutoff") Instant cutoff, @Bind("limit") int limit);

    /**
     * Deletes the row only if it is still reclaimable, so a reference taken
     * after the mark phase keeps the blob alive.
     */
    @SqlUpdate("DELETE FROM content_blob WHERE digest = :digest " +
            "AND ref_count = 0 AND touched_at < :cutoff AND " + UNREFERENCED_BY_SNAPSHOTS)
    int deleteIfReclaimable(@Bind("digest") String digest, @Bind("cutoff") Instant cutoff);

    @SqlQuery("SELECT COUNT(*) FROM content_blob")
    long count();

    @SqlQuery("SELECT COALESCE(SUM(size), 0) FROM content_blob")
    long totalBytes();
}
