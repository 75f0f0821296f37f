package com.libragraph.mailbackup.core.dao;

import com.libragraph.mailbackup.types.ItemKind;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;

@RegisterColumnMapper(ItemKindColumnMapper.class)
@RegisterArgumentFactory(ItemKindArgumentFactory.class)
@RegisterConstructorMapper(SnapshotSkipRecord.class)
public interface SnapshotSkipDao {

    @SqlQuery("SELECT COUNT(*) FROM snapshot_skip WHERE snapshot_id = :snapshotId " +
            "AND tenant_id = :tenantId AND mailbox_id = :mailboxId " +
            "AND provider_item_id = :providerItemId AND item_kind = :kind")
    int count(@Bind("snapshotId") long snapshotId,
              @Bind("tenantId") String tenantId,
              @Bind("mailboxId") String mailboxId,
              @Bind("providerItemId") String providerItemId,
              @Bind("kind") ItemKind kind);

    @SqlUpdate("INSERT INTO snapshot_skip (snapshot_id, tenant_id, mailbox_id, provider_item_id, item_kind, " +
            "reason, recorded_at) " +
            "VALUES (:snapshotId, :tenantId, :mailboxId, :providerItemId, :kind, :reason, :recordedAt)")
    void insert(@Bind("snapshotId") long snapshotId,
                @Bind("tenantId") String tenantId,
                @Bind("mailboxId") String mailboxId,
                @Bind("providerItemId") String providerItemId,
                @Bind("kind") ItemKind kind,
                @Bind("reason") String reason,
                @Bind("recordedAt") Instant recordedAt);

    @SqlQuery("SELECT * FROM snapshot_skip WHERE snapshot_id = :snapshotId " +
            "ORDER BY tenant_id, mailbox_id, provider_item_id, item_kind")
    List<SnapshotSkipRecord> findBySnapshot(@Bind("snapshotId") long snapshotId);

    /**
     * Skips recorded by snapshots of {@code scope} from {@code sinceId} onwards.
     */
    @SqlQuery("SELECT k.* FROM snapshot_skip k JOIN snapshot s ON s.id = k.snapshot_id " +
            "WHERE s.scope = :scope AND s.id >= :sinceId " +
            "ORDER BY k.snapshot_id, k.tenant_id, k.mailbox_id, k.provider_item_id, k.item_kind")
    List<SnapshotSkipRecord> findForScopeSince(@Bind("scope") String scope, @Bind("sinceId") long sinceId);

    @SqlQuery("SELECT COUNT(*) FROM snapshot_skip WHERE snapshot_id = :snapshotId")
    long countBySnapshot(@Bind("snapshotId") long snapshotId);

    @SqlUpdate("DELETE FROM snapshot_skip WHERE snapshot_id = :snapshotId")
    int deleteBySnapshot(@Bind("snapshotId") long snapshotId);
}
