package com.libragraph.mailbackup.core.dao;

import com.libragraph.mailbackup.types.SnapshotStatus;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RegisterColumnMapper(SnapshotStatusColumnMapper.class)
@RegisterArgumentFactory(SnapshotStatusArgumentFactory.class)
@RegisterConstructorMapper(SnapshotRecord.class)
public interface SnapshotDao {

    @SqlUpdate("INSERT INTO snapshot (scope, label, status, started_at) " +
            "VALUES (:scope, :label, :status, :startedAt)")
    @GetGeneratedKeys("id")
    long insert(@Bind("scope") String scope,
                @Bind("label") String label,
                @Bind("status") SnapshotStatus status,
                @Bind("startedAt") Instant startedAt);

    /**
     * Claims the scope for a running snapshot. The primary key on scope makes
     * a second concurrent claim fail with a unique violation.
     */
    @SqlUpdate("INSERT INTO snapshot_scope_run (scope, snapshot_id, claimed_at) " +
            "VALUES (:scope, :snapshotId, :claimedAt)")
    void claimScope(@Bind("scope") String scope,
                    @Bind("snapshotId") long snapshotId,
                    @Bind("claimedAt") Instant claimedAt);

    @SqlQuery("SELECT snapshot_id FROM snapshot_scope_run WHERE scope = :scope")
    Optional<Long> findRunningForScope(@Bind("scope") String scope);

    @SqlUpdate("DELETE FROM snapshot_scope_run WHERE snapshot_id = :snapshotId")
    int releaseScope(@Bind("snapshotId") long snapshotId);

    @SqlUpdate("UPDATE snapshot SET status = :to, ended_at = :endedAt, failure = :failure " +
            "WHERE id = :id AND status = :from")
    int transition(@Bind("id") long id,
                   @Bind("from") SnapshotStatus from,
                   @Bind("to") SnapshotStatus to,
                   @Bind("endedAt") Instant endedAt,
                   @Bind("failure") String failure);

    @SqlQuery("SELECT * FROM snapshot WHERE id = :id")
    Optional<SnapshotRecord> findById(@Bind("id") long id);

    @SqlQuery("SELECT * FROM snapshot WHERE status = :status ORDER BY id DESC")
    List<SnapshotRecord> findByStatus(@Bind("status") SnapshotStatus status);

    @SqlQuery("SELECT * FROM snapshot WHERE scope = :scope AND status = :status ORDER BY id DESC")
    List<SnapshotRecord> findByScopeAndStatus(@Bind("scope") String scope,
                                              @Bind("status") SnapshotStatus status);

    /**
     * Snapshots of the tenant's own scope plus whole-estate snapshots, which
     * also contain the tenant's items.
     */
    @SqlQuery("SELECT * FROM snapshot WHERE (scope = :scope OR scope = :allScope) " +
            "AND status = :status ORDER BY id DESC")
    List<SnapshotRecord> findVisibleToScope(@Bind("scope") String scope,
                                            @Bind("allScope") String allScope,
                                            @Bind("status") SnapshotStatus status);

    @SqlQuery("SELECT * FROM snapshot ORDER BY id DESC LIMIT :limit")
    List<SnapshotRecord> findRecent(@Bind("limit") int limit);

    @SqlQuery("SELECT id FROM snapshot WHERE scope = :scope AND status <> :running AND id < :beforeId " +
            "ORDER BY id")
    List<Long> findTerminalBefore(@Bind("scope") String scope,
                                  @Bind("running") SnapshotStatus running,
                                  @Bind("beforeId") long beforeId);

    @SqlUpdate("DELETE FROM snapshot WHERE id = :id AND status <> :running")
    int deleteTerminal(@Bind("id") long id, @Bind("running") SnapshotStatus running);
}
