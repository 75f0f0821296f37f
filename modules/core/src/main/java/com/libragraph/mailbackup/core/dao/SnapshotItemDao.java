package com.libragraph.mailbackup.core.dao;

import com.libragraph.mailbackup.types.ItemKind;
import com.libragraph.mailbackup.types.SnapshotStatus;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RegisterColumnMapper(ItemKindColumnMapper.class)
@RegisterArgumentFactory(ItemKindArgumentFactory.class)
@RegisterArgumentFactory(SnapshotStatusArgumentFactory.class)
@RegisterConstructorMapper(SnapshotItemRecord.class)
public interface SnapshotItemDao {

    String SELECT_ITEMS = "SELECT si.snapshot_id, si.entry_id, e.tenant_id, e.mailbox_id, " +
            "e.provider_item_id, e.item_kind, si.digest, si.provider_modified_at, si.recorded_at " +
            "FROM snapshot_item si JOIN object_entry e ON e.id = si.entry_id ";

    String ENTRY_IDENTITY = "e.tenant_id = :tenantId AND e.mailbox_id = :mailboxId " +
            "AND e.provider_item_id = :providerItemId AND e.item_kind = :kind";

    @SqlQuery("SELECT digest FROM snapshot_item WHERE snapshot_id = :snapshotId AND entry_id = :entryId")
    Optional<String> findDigest(@Bind("snapshotId") long snapshotId, @Bind("entryId") long entryId);

    @SqlUpdate("INSERT INTO snapshot_item (snapshot_id, entry_id, digest, provider_modified_at, recorded_at) " +
            "VALUES (:snapshotId, :entryId, :digest, :providerModifiedAt, :recordedAt)")
    void insert(@Bind("snapshotId") long snapshotId,
                @Bind("entryId") long entryId,
                @Bind("digest") String digest,
                @Bind("providerModifiedAt") Instant providerModifiedAt,
                @Bind("recordedAt") Instant recordedAt);

    @SqlQuery(SELECT_ITEMS + "WHERE si.snapshot_id = :snapshotId " +
            "ORDER BY e.tenant_id, e.mailbox_id, e.provider_item_id, e.item_kind")
    List<SnapshotItemRecord> findBySnapshot(@Bind("snapshotId") long snapshotId);

    @SqlQuery(SELECT_ITEMS + "WHERE si.snapshot_id = :snapshotId AND e.tenant_id = :tenantId " +
            "ORDER BY e.tenant_id, e.mailbox_id, e.provider_item_id, e.item_kind")
    List<SnapshotItemRecord> findBySnapshotAndTenant(@Bind("snapshotId") long snapshotId,
                                                     @Bind("tenantId") String tenantId);

    @SqlQuery(SELECT_ITEMS + "WHERE si.snapshot_id = :snapshotId AND " + ENTRY_IDENTITY)
    Optional<SnapshotItemRecord> findByIdentity(@Bind("snapshotId") long snapshotId,
                                                @Bind("tenantId") String tenantId,
                                                @Bind("mailboxId") String mailboxId,
                                                @Bind("providerItemId") String providerItemId,
                                                @Bind("kind") ItemKind kind);

    /**
     * Counts complete snapshots newer than {@code afterId} that recorded the identity.
     */
    @SqlQuery("SELECT COUNT(*) FROM snapshot_item si " +
            "JOIN snapshot s ON s.id = si.snapshot_id " +
            "JOIN object_entry e ON e.id = si.entry_id " +
            "WHERE s.status = :complete AND s.id > :afterId AND " + ENTRY_IDENTITY)
    int countRecordedAfter(@Bind("complete") SnapshotStatus complete,
                           @Bind("afterId") long afterId,
                           @Bind("tenantId") String tenantId,
                           @Bind("mailboxId") String mailboxId,
                           @Bind("providerItemId") String providerItemId,
                           @Bind("kind") ItemKind kind);

    @SqlQuery("SELECT COUNT(*) FROM snapshot_item WHERE snapshot_id = :snapshotId")
    long countBySnapshot(@Bind("snapshotId") long snapshotId);

    @SqlUpdate("DELETE FROM snapshot_item WHERE snapshot_id = :snapshotId")
    int deleteBySnapshot(@Bind("snapshotId") long snapshotId);
}
