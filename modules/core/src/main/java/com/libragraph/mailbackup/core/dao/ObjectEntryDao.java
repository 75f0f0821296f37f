package com.libragraph.mailbackup.core.dao;

import com.libragraph.mailbackup.types.ItemIdentity;
import com.libragraph.mailbackup.types.ItemKind;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.Optional;
import java.util.stream.Stream;

@RegisterColumnMapper(ItemKindColumnMapper.class)
@RegisterArgumentFactory(ItemKindArgumentFactory.class)
@RegisterConstructorMapper(ObjectEntryRecord.class)
public interface ObjectEntryDao {

    String IDENTITY_MATCH = "tenant_id = :tenantId AND mailbox_id = :mailboxId " +
            "AND provider_item_id = :providerItemId AND item_kind = :kind";

    String LIVE_AS_OF = "first_seen_at <= :asOf AND (tombstoned_at IS NULL OR tombstoned_at > :asOf)";

    String IDENTITY_ORDER = "ORDER BY tenant_id, mailbox_id, provider_item_id, item_kind";

    @SqlQuery("SELECT * FROM object_entry WHERE " + IDENTITY_MATCH)
    Optional<ObjectEntryRecord> find(@Bind("tenantId") String tenantId,
                                     @Bind("mailboxId") String mailboxId,
                                     @Bind("providerItemId") String providerItemId,
                                     @Bind("kind") ItemKind kind);

    default Optional<ObjectEntryRecord> findByIdentity(ItemIdentity identity) {
        return find(identity.tenantId(), identity.mailboxId(),
                identity.providerItemId(), identity.kind());
    }

    @SqlQuery("SELECT * FROM object_entry WHERE id = :id")
    Optional<ObjectEntryRecord> findById(@Bind("id") long id);

    @SqlUpdate("INSERT INTO object_entry (tenant_id, mailbox_id, provider_item_id, item_kind, digest, size, " +
            "provider_modified_at, first_seen_at, last_seen_at) " +
            "VALUES (:tenantId, :mailboxId, :providerItemId, :kind, :digest, :size, " +
            ":providerModifiedAt, :now, :now)")
    @GetGeneratedKeys("id")
    long insert(@Bind("tenantId") String tenantId,
                @Bind("mailboxId") String mailboxId,
                @Bind("providerItemId") String providerItemId,
                @Bind("kind") ItemKind kind,
                @Bind("digest") String digest,
                @Bind("size") long size,
                @Bind("providerModifiedAt") Instant providerModifiedAt,
                @Bind("now") Instant now);

    /**
     * Swaps the current digest only if it still equals {@code expectedDigest}.
     * Revives a tombstoned entry. Returns 0 if another writer changed it first.
     */
    @SqlUpdate("UPDATE object_entry SET digest = :digest, size = :size, " +
            "provider_modified_at = :providerModifiedAt, last_seen_at = :now, tombstoned_at = NULL " +
            "WHERE id = :id AND digest = :expectedDigest")
    int compareAndSetDigest(@Bind("id") long id,
                            @Bind("expectedDigest") String expectedDigest,
                            @Bind("digest") String digest,
                            @Bind("size") long size,
                            @Bind("providerModifiedAt") Instant providerModifiedAt,
                            @Bind("now") Instant now);

    /**
     * Refreshes last-seen for an entry whose digest is still {@code digest}.
     * Revives a tombstoned entry.
     */
    @SqlUpdate("UPDATE object_entry SET provider_modified_at = :providerModifiedAt, " +
            "last_seen_at = :now, tombstoned_at = NULL " +
            "WHERE id = :id AND digest = :digest")
    int refreshUnchanged(@Bind("id") long id,
                         @Bind("digest") String digest,
                         @Bind("providerModifiedAt") Instant providerModifiedAt,
                         @Bind("now") Instant now);

    @SqlUpdate("UPDATE object_entry SET last_seen_at = :now WHERE id = :id")
    int touch(@Bind("id") long id, @Bind("now") Instant now);

    @SqlUpdate("UPDATE object_entry SET tombstoned_at = :now WHERE id = :id AND tombstoned_at IS NULL")
    int tombstone(@Bind("id") long id, @Bind("now") Instant now);

    @SqlQuery("SELECT * FROM object_entry WHERE " + LIVE_AS_OF + " " + IDENTITY_ORDER)
    Stream<ObjectEntryRecord> streamLive(@Bind("asOf") Instant asOf);

    @SqlQuery("SELECT * FROM object_entry WHERE tenant_id = :tenantId AND " + LIVE_AS_OF + " " + IDENTITY_ORDER)
    Stream<ObjectEntryRecord> streamLiveForTenant(@Bind("tenantId") String tenantId,
                                                  @Bind("asOf") Instant asOf);

    @SqlQuery("SELECT COUNT(*) FROM object_entry WHERE tombstoned_at IS NULL")
    long countLive();
}
