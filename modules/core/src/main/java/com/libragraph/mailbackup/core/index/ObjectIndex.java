package com.libragraph.mailbackup.core.index;

import com.libragraph.mailbackup.core.dao.ObjectEntryDao;
import com.libragraph.mailbackup.core.dao.ObjectEntryRecord;
import com.libragraph.mailbackup.core.dao.SqlStates;
import com.libragraph.mailbackup.types.ItemIdentity;
import com.libragraph.mailbackup.types.TenantScope;
import com.libragraph.mailbackup.util.ContentHash;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Current mapping from item identity to content digest.
 *
 * <p>Each identity has at most one entry. Entries are never deleted; a
 * provider deletion tombstones the entry and a later upsert revives it.
 * Concurrent upserts of one identity are resolved by compare-and-set on the
 * stored digest, so neither writer's digest change is lost.
 */
@ApplicationScoped
public class ObjectIndex {

    private static final Logger log = Logger.getLogger(ObjectIndex.class);

    @Inject
    Jdbi jdbi;

    Clock clock = Clock.systemUTC();

    /**
     * Points the identity at {@code digest}. The index does not touch
     * reference counts; on UPDATED the caller releases the previous digest.
     */
    public UpsertResult upsert(ItemIdentity identity, ContentHash digest, long size,
                               Instant providerModifiedAt) {
        Objects.requireNonNull(identity, "identity cannot be null");
        Objects.requireNonNull(digest, "digest cannot be null");
        String hex = digest.toHex();
        while (true) {
            Instant now = now();
            Optional<ObjectEntryRecord> existing = jdbi.withExtension(ObjectEntryDao.class,
                    dao -> dao.findByIdentity(identity));

            if (existing.isEmpty()) {
                try {
                    ObjectEntryRecord created = jdbi.withExtension(ObjectEntryDao.class, dao -> {
                        long id = dao.insert(identity.tenantId(), identity.mailboxId(),
                                identity.providerItemId(), identity.kind(), hex, size,
                                providerModifiedAt, now);
                        return dao.findById(id).orElseThrow();
                    });
                    log.debugf("Index entry created: %s -> %s", identity, digest);
                    return UpsertResult.created(created);
                } catch (UnableToExecuteStatementException e) {
                    if (!SqlStates.isUniqueViolation(e)) {
                        throw e;
                    }
                    continue;
                }
            }

            ObjectEntryRecord current = existing.get();
            if (current.digest().equals(hex)) {
                Instant modified = providerModifiedAt != null ? providerModifiedAt : current.providerModifiedAt();
                int refreshed = jdbi.withExtension(ObjectEntryDao.class,
                        dao -> dao.refreshUnchanged(current.id(), hex, modified, now));
                if (refreshed == 1) {
                    return UpsertResult.unchanged(reload(current.id()));
                }
                continue;
            }

            int swapped = jdbi.withExtension(ObjectEntryDao.class,
                    dao -> dao.compareAndSetDigest(current.id(), current.digest(), hex, size,
                            providerModifiedAt, now));
            if (swapped == 1) {
                log.debugf("Index entry updated: %s %s -> %s", identity, current.digest(), digest);
                return UpsertResult.updated(reload(current.id()), current.contentHash());
            }
            log.debugf("Lost compare-and-set on %s, retrying", identity);
        }
    }

    /**
     * Refreshes {@code entry} if it still points at the digest it was read
     * with, reviving it if tombstoned. Reference counts are untouched.
     *
     * @return false if another writer changed the digest since {@code entry} was read
     */
    public boolean refreshIfCurrent(ObjectEntryRecord entry, Instant providerModifiedAt) {
        Instant modified = providerModifiedAt != null ? providerModifiedAt : entry.providerModifiedAt();
        return jdbi.withExtension(ObjectEntryDao.class,
                dao -> dao.refreshUnchanged(entry.id(), entry.digest(), modified, now())) == 1;
    }

    /**
     * Marks the identity deleted upstream. Blobs are untouched. Idempotent.
     *
     * @throws EntryNotFoundException if the identity was never ingested
     */
    public ObjectEntryRecord tombstone(ItemIdentity identity) {
        ObjectEntryRecord entry = lookup(identity);
        jdbi.useExtension(ObjectEntryDao.class, dao -> dao.tombstone(entry.id(), now()));
        return reload(entry.id());
    }

    /**
     * Refreshes last-seen for an item the fetcher reported unchanged.
     *
     * @throws EntryNotFoundException if the identity was never ingested
     */
    public ObjectEntryRecord touch(ItemIdentity identity) {
        ObjectEntryRecord entry = lookup(identity);
        jdbi.useExtension(ObjectEntryDao.class, dao -> dao.touch(entry.id(), now()));
        return reload(entry.id());
    }

    /**
     * @throws EntryNotFoundException if the identity was never ingested
     */
    public ObjectEntryRecord lookup(ItemIdentity identity) {
        return find(identity).orElseThrow(() -> new EntryNotFoundException(identity));
    }

    public Optional<ObjectEntryRecord> find(ItemIdentity identity) {
        return jdbi.withExtension(ObjectEntryDao.class, dao -> dao.findByIdentity(identity));
    }

    /**
     * Lazily streams the entries that belonged to {@code scope} at
     * {@code asOf}, ordered by identity. The stream holds a database handle
     * and must be closed by the caller.
     */
    public Stream<ObjectEntryRecord> listForSnapshot(TenantScope scope, Instant asOf) {
        Handle handle = jdbi.open();
        try {
            ObjectEntryDao dao = handle.attach(ObjectEntryDao.class);
            Stream<ObjectEntryRecord> entries = scope.isAll()
                    ? dao.streamLive(asOf)
                    : dao.streamLiveForTenant(scope.tenantId(), asOf);
            return entries.onClose(handle::close);
        } catch (RuntimeException e) {
            handle.close();
            throw e;
        }
    }

    public long countLive() {
        return jdbi.withExtension(ObjectEntryDao.class, ObjectEntryDao::countLive);
    }

    private ObjectEntryRecord reload(long id) {
        return jdbi.withExtension(ObjectEntryDao.class, dao -> dao.findById(id).orElseThrow());
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
