package com.libragraph.mailbackup.core.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.mailbackup.core.dao.ObjectEntryDao;
import com.libragraph.mailbackup.core.dao.ObjectEntryRecord;
import com.libragraph.mailbackup.core.dao.SnapshotDao;
import com.libragraph.mailbackup.core.dao.SnapshotItemDao;
import com.libragraph.mailbackup.core.dao.SnapshotItemRecord;
import com.libragraph.mailbackup.core.dao.SnapshotRecord;
import com.libragraph.mailbackup.core.dao.SnapshotSkipDao;
import com.libragraph.mailbackup.core.dao.SnapshotSkipRecord;
import com.libragraph.mailbackup.core.dao.SqlStates;
import com.libragraph.mailbackup.core.index.EntryNotFoundException;
import com.libragraph.mailbackup.types.ItemIdentity;
import com.libragraph.mailbackup.types.SnapshotStatus;
import com.libragraph.mailbackup.types.TenantScope;
import com.libragraph.mailbackup.util.ContentHash;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Owns snapshots: their lifecycle ({@code RUNNING -> COMPLETE | FAILED}),
 * the items and skips recorded into them, and the per-scope run claim.
 *
 * <p>Terminal snapshots are immutable. A failed snapshot keeps whatever it
 * recorded but is never resumed; the next run begins a new snapshot.
 */
@ApplicationScoped
public class SnapshotManager {

    private static final Logger log = Logger.getLogger(SnapshotManager.class);

    @Inject
    Jdbi jdbi;

    @Inject
    ObjectMapper objectMapper;

    Clock clock = Clock.systemUTC();

    public long begin(TenantScope scope) {
        return begin(scope, null);
    }

    /**
     * Starts a snapshot and claims its scope.
     *
     * @throws SnapshotAlreadyRunningException if the scope holds a running snapshot
     */
    public long begin(TenantScope scope, String label) {
        Objects.requireNonNull(scope, "scope cannot be null");
        Instant now = now();
        try {
            long id = jdbi.inTransaction(handle -> {
                SnapshotDao dao = handle.attach(SnapshotDao.class);
                long snapshotId = dao.insert(scope.key(), label, SnapshotStatus.RUNNING, now);
                dao.claimScope(scope.key(), snapshotId, now);
                return snapshotId;
            });
            log.infof("Snapshot %d started: scope=%s label=%s", id, scope, label);
            return id;
        } catch (UnableToExecuteStatementException e) {
            if (!SqlStates.isUniqueViolation(e)) {
                throw e;
            }
            Long running = jdbi.withExtension(SnapshotDao.class,
                    dao -> dao.findRunningForScope(scope.key()).orElse(null));
            throw new SnapshotAlreadyRunningException(scope, running);
        }
    }

    /**
     * Records that {@code identity} had content {@code digest} in this
     * snapshot. Recording the same pair twice is a no-op.
     *
     * @throws InvalidSnapshotStateException if the snapshot is not running, the identity is
     *                                       outside its scope, or was already recorded with another digest
     * @throws EntryNotFoundException        if the identity is not in the index
     */
    public void recordItem(long snapshotId, ItemIdentity identity, ContentHash digest) {
        String hex = digest.toHex();
        jdbi.useTransaction(handle -> {
            SnapshotRecord snapshot = requireRunning(handle.attach(SnapshotDao.class), snapshotId);
            requireInScope(snapshot, identity);
            ObjectEntryRecord entry = handle.attach(ObjectEntryDao.class).findByIdentity(identity)
                    .orElseThrow(() -> new EntryNotFoundException(identity));
            SnapshotItemDao items = handle.attach(SnapshotItemDao.class);
            Optional<String> recorded = items.findDigest(snapshotId, entry.id());
            if (recorded.isPresent()) {
                if (recorded.get().equals(hex)) {
                    return;
                }
                throw new InvalidSnapshotStateException(snapshotId, snapshot.status(),
                        identity + " already recorded with digest " + recorded.get());
            }
            items.insert(snapshotId, entry.id(), hex, entry.providerModifiedAt(), now());
        });
    }

    /**
     * Records an item the run could not capture, with the reason. Skips are
     * what the next incremental plan re-fetches. Recording the same identity
     * twice keeps the first reason.
     */
    public void recordSkip(long snapshotId, ItemIdentity identity, String reason) {
        String text = reason != null ? reason : "unspecified";
        String stored = text.length() > 2000 ? text.substring(0, 2000) : text;
        jdbi.useTransaction(handle -> {
            SnapshotRecord snapshot = requireRunning(handle.attach(SnapshotDao.class), snapshotId);
            SnapshotSkipDao skips = handle.attach(SnapshotSkipDao.class);
            if (skips.count(snapshotId, identity.tenantId(), identity.mailboxId(),
                    identity.providerItemId(), identity.kind()) > 0) {
                return;
            }
            skips.insert(snapshot.id(), identity.tenantId(), identity.mailboxId(),
                    identity.providerItemId(), identity.kind(), stored, now());
        });
        log.debugf("Snapshot %d skipped %s: %s", snapshotId, identity, stored);
    }

    /**
     * @throws InvalidSnapshotStateException unless the snapshot is running
     */
    public SnapshotRecord complete(long snapshotId) {
        SnapshotRecord done = finish(snapshotId, SnapshotStatus.COMPLETE, null);
        log.infof("Snapshot %d complete: scope=%s", snapshotId, done.scope());
        return done;
    }

    public SnapshotRecord fail(long snapshotId, String reason) {
        return fail(snapshotId, SnapshotError.of(reason));
    }

    public SnapshotRecord fail(long snapshotId, Throwable cause) {
        return fail(snapshotId, SnapshotError.from(cause));
    }

    /**
     * Fails a running snapshot, keeping what it recorded.
     *
     * @throws InvalidSnapshotStateException unless the snapshot is running
     */
    public SnapshotRecord fail(long snapshotId, SnapshotError error) {
        SnapshotRecord failed = finish(snapshotId, SnapshotStatus.FAILED, serialize(error));
        log.warnf("Snapshot %d failed: scope=%s reason=%s", snapshotId, failed.scope(), error.message());
        return failed;
    }

    /**
     * Reads back the failure stored on a failed snapshot.
     */
    public Optional<SnapshotError> failureOf(SnapshotRecord snapshot) {
        if (snapshot.failure() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(snapshot.failure(), SnapshotError.class));
        } catch (JsonProcessingException e) {
            return Optional.of(new SnapshotError(snapshot.failure(), null, false));
        }
    }

    /**
     * Builds the fetch hint for a run of {@code scope} relative to
     * {@code sinceSnapshotId}. A null baseline gives a full plan.
     *
     * @throws InvalidSnapshotStateException if the baseline is not complete
     */
    public IncrementalPlan computeIncrementalPlan(TenantScope scope, Long sinceSnapshotId) {
        if (sinceSnapshotId == null) {
            return IncrementalPlan.full();
        }
        return jdbi.inTransaction(handle -> {
            SnapshotRecord since = handle.attach(SnapshotDao.class).findById(sinceSnapshotId)
                    .orElseThrow(() -> new SnapshotNotFoundException(sinceSnapshotId));
            if (since.status() != SnapshotStatus.COMPLETE) {
                throw new InvalidSnapshotStateException(sinceSnapshotId, since.status(),
                        "incremental baseline must be complete");
            }
            SnapshotItemDao items = handle.attach(SnapshotItemDao.class);

            Map<ItemIdentity, Instant> baseline = new HashMap<>();
            for (SnapshotItemRecord item : items.findBySnapshot(sinceSnapshotId)) {
                if (scope.includes(item.tenantId()) && item.providerModifiedAt() != null) {
                    baseline.put(item.identity(), item.providerModifiedAt());
                }
            }

            Set<ItemIdentity> refetch = new HashSet<>();
            for (SnapshotSkipRecord skip : handle.attach(SnapshotSkipDao.class)
                    .findForScopeSince(scope.key(), sinceSnapshotId)) {
                ItemIdentity identity = skip.identity();
                if (refetch.contains(identity) || !scope.includes(identity.tenantId())) {
                    continue;
                }
                int recordedLater = items.countRecordedAfter(SnapshotStatus.COMPLETE, skip.snapshotId(),
                        identity.tenantId(), identity.mailboxId(), identity.providerItemId(), identity.kind());
                if (recordedLater == 0) {
                    refetch.add(identity);
                }
            }
            log.debugf("Incremental plan for %s since %d: %d baseline item(s), %d to re-fetch",
                    scope, sinceSnapshotId, baseline.size(), refetch.size());
            return new IncrementalPlan(sinceSnapshotId, baseline, refetch);
        });
    }

    /**
     * Complete snapshots a restore of {@code scope} could use, most recent
     * first. Whole-estate snapshots count for every tenant.
     */
    public List<SnapshotRecord> listRestoreCandidates(TenantScope scope) {
        return jdbi.withExtension(SnapshotDao.class, dao -> scope.isAll()
                ? dao.findByStatus(SnapshotStatus.COMPLETE)
                : dao.findVisibleToScope(scope.key(), TenantScope.all().key(), SnapshotStatus.COMPLETE));
    }

    public Optional<SnapshotRecord> latestComplete(TenantScope scope) {
        return jdbi.withExtension(SnapshotDao.class,
                dao -> dao.findByScopeAndStatus(scope.key(), SnapshotStatus.COMPLETE))
                .stream().findFirst();
    }

    public List<SnapshotRecord> recent(int limit) {
        return jdbi.withExtension(SnapshotDao.class, dao -> dao.findRecent(limit));
    }

    /**
     * @throws SnapshotNotFoundException if no snapshot has this id
     */
    public SnapshotRecord get(long snapshotId) {
        return jdbi.withExtension(SnapshotDao.class, dao -> dao.findById(snapshotId))
                .orElseThrow(() -> new SnapshotNotFoundException(snapshotId));
    }

    public List<SnapshotItemRecord> items(long snapshotId) {
        get(snapshotId);
        return jdbi.withExtension(SnapshotItemDao.class, dao -> dao.findBySnapshot(snapshotId));
    }

    public List<SnapshotItemRecord> items(long snapshotId, String tenantId) {
        get(snapshotId);
        return jdbi.withExtension(SnapshotItemDao.class, dao -> dao.findBySnapshotAndTenant(snapshotId, tenantId));
    }

    public List<SnapshotSkipRecord> skips(long snapshotId) {
        get(snapshotId);
        return jdbi.withExtension(SnapshotSkipDao.class, dao -> dao.findBySnapshot(snapshotId));
    }

    /**
     * Digest the identity had when {@code snapshotId} recorded it.
     *
     * @throws SnapshotNotFoundException if no snapshot has this id
     * @throws EntryNotFoundException    if the snapshot did not record the identity
     */
    public ContentHash resolve(long snapshotId, ItemIdentity identity) {
        get(snapshotId);
        return jdbi.withExtension(SnapshotItemDao.class, dao -> dao.findByIdentity(snapshotId,
                        identity.tenantId(), identity.mailboxId(), identity.providerItemId(), identity.kind()))
                .map(SnapshotItemRecord::contentHash)
                .orElseThrow(() -> new EntryNotFoundException(identity));
    }

    /**
     * Deletes terminal snapshots of {@code scope} older than its
     * {@code keepComplete}-th most recent complete snapshot, with their items
     * and skips. Their digests then become reclaimable once unreferenced.
     *
     * @return number of snapshots deleted
     */
    public int prune(TenantScope scope, int keepComplete) {
        if (keepComplete < 1) {
            throw new IllegalArgumentException("keepComplete must be at least 1, got: " + keepComplete);
        }
        int pruned = jdbi.inTransaction(handle -> {
            SnapshotDao dao = handle.attach(SnapshotDao.class);
            List<SnapshotRecord> complete = dao.findByScopeAndStatus(scope.key(), SnapshotStatus.COMPLETE);
            if (complete.size() < keepComplete) {
                return 0;
            }
            long boundary = complete.get(keepComplete - 1).id();
            SnapshotItemDao items = handle.attach(SnapshotItemDao.class);
            SnapshotSkipDao skips = handle.attach(SnapshotSkipDao.class);
            int deleted = 0;
            for (long id : dao.findTerminalBefore(scope.key(), SnapshotStatus.RUNNING, boundary)) {
                items.deleteBySnapshot(id);
                skips.deleteBySnapshot(id);
                deleted += dao.deleteTerminal(id, SnapshotStatus.RUNNING);
            }
            return deleted;
        });
        if (pruned > 0) {
            log.infof("Pruned %d snapshot(s) of scope %s, keeping %d complete", pruned, scope, keepComplete);
        }
        return pruned;
    }

    /**
     * Fails every snapshot still marked running. Only safe when no run is in
     * progress, i.e. at process start.
     *
     * @return number of snapshots failed
     */
    public int failStaleRuns(String reason) {
        List<SnapshotRecord> running = jdbi.withExtension(SnapshotDao.class,
                dao -> dao.findByStatus(SnapshotStatus.RUNNING));
        int failed = 0;
        for (SnapshotRecord snapshot : running) {
            try {
                fail(snapshot.id(), reason);
                failed++;
            } catch (InvalidSnapshotStateException e) {
                log.debugf("Snapshot %d finished before recovery reached it", snapshot.id());
            }
        }
        return failed;
    }

    private SnapshotRecord finish(long snapshotId, SnapshotStatus to, String failure) {
        Instant now = now();
        int updated = jdbi.inTransaction(handle -> {
            SnapshotDao dao = handle.attach(SnapshotDao.class);
            int changed = dao.transition(snapshotId, SnapshotStatus.RUNNING, to, now, failure);
            if (changed == 1) {
                dao.releaseScope(snapshotId);
            }
            return changed;
        });
        SnapshotRecord snapshot = get(snapshotId);
        if (updated == 0) {
            throw new InvalidSnapshotStateException(snapshotId, snapshot.status(),
                    "cannot transition to " + to);
        }
        return snapshot;
    }

    private SnapshotRecord requireRunning(SnapshotDao dao, long snapshotId) {
        SnapshotRecord snapshot = dao.findById(snapshotId)
                .orElseThrow(() -> new SnapshotNotFoundException(snapshotId));
        if (snapshot.status() != SnapshotStatus.RUNNING) {
            throw new InvalidSnapshotStateException(snapshotId, snapshot.status(), "not running");
        }
        return snapshot;
    }

    private static void requireInScope(SnapshotRecord snapshot, ItemIdentity identity) {
        if (!snapshot.tenantScope().includes(identity.tenantId())) {
            throw new InvalidSnapshotStateException(snapshot.id(), snapshot.status(),
                    identity + " is outside scope " + snapshot.scope());
        }
    }

    private String serialize(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new RuntimeException("Failed to serialize: " + value, e);
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
