package com.libragraph.mailbackup.core.store;

import com.libragraph.mailbackup.core.dao.ContentBlobDao;
import com.libragraph.mailbackup.core.dao.ContentBlobRecord;
import com.libragraph.mailbackup.core.dao.SqlStates;
import com.libragraph.mailbackup.util.ContentHash;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Content-addressed, reference-counted blob store shared by every tenant.
 *
 * <p>Bytes live in {@link ObjectStorage}; digest, size and reference count
 * live in the {@code content_blob} table. A blob's first write and its
 * reclamation take the same striped lock, so a reclaimed blob is never
 * resurrected half-deleted.
 */
@ApplicationScoped
public class ContentStore {

    private static final Logger log = Logger.getLogger(ContentStore.class);

    private static final int LOCK_STRIPES = 64;

    @Inject
    Jdbi jdbi;

    @Inject
    ObjectStorage storage;

    @ConfigProperty(name = "backup.store.write-attempts", defaultValue = "3")
    int writeAttempts;

    @ConfigProperty(name = "backup.store.write-backoff", defaultValue = "PT0.2S")
    Duration writeBackoff;

    Clock clock = Clock.systemUTC();

    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public ContentStore() {
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public record PutResult(ContentHash digest, long size, boolean wasNew) {}

    public ContentHash digest(byte[] content) {
        return ContentHash.of(content);
    }

    /**
     * Stores the bytes if their digest is unseen, otherwise takes one more
     * reference on the existing blob. Every call adds exactly one reference.
     *
     * @throws StorageWriteException if the bytes could not be written
     */
    public PutResult put(byte[] content) {
        Objects.requireNonNull(content, "content cannot be null");
        ContentHash digest = digest(content);
        String hex = digest.toHex();
        while (true) {
            if (increment(hex)) {
                log.debugf("Dedup hit: %s", digest);
                return new PutResult(digest, content.length, false);
            }
            ReentrantLock lock = lockFor(digest);
            lock.lock();
            try {
                if (increment(hex)) {
                    log.debugf("Dedup hit after lock: %s", digest);
                    return new PutResult(digest, content.length, false);
                }
                write(digest, content);
                try {
                    jdbi.useExtension(ContentBlobDao.class, dao ->
                            dao.insert(hex, content.length, storage.storageKey(digest), now()));
                    log.debugf("New blob stored: %s (%d bytes)", digest, content.length);
                    return new PutResult(digest, content.length, true);
                } catch (UnableToExecuteStatementException e) {
                    if (!SqlStates.isUniqueViolation(e)) {
                        throw e;
                    }
                    log.debugf("Concurrent first write of %s, retrying as a reference", digest);
                }
            } finally {
                lock.unlock();
            }
        }
    }

    /**
     * Adds a reference to a blob that is already stored.
     *
     * @throws BlobNotFoundException if the digest is unknown or reclaimed
     */
    public void retain(ContentHash digest) {
        if (!increment(digest.toHex())) {
            throw new BlobNotFoundException(digest);
        }
    }

    /**
     * Drops one reference. Reaching zero only makes the blob a reclamation
     * candidate; bytes stay readable until {@link BlobReclaimer} runs.
     *
     * @throws BlobNotReferencedException if the count is already zero
     * @throws BlobNotFoundException if the digest is unknown
     */
    public void release(ContentHash digest) {
        String hex = digest.toHex();
        int updated = jdbi.withExtension(ContentBlobDao.class, dao -> dao.decrementRefCount(hex, now()));
        if (updated == 1) {
            return;
        }
        if (find(digest).isPresent()) {
            throw new BlobNotReferencedException(digest);
        }
        throw new BlobNotFoundException(digest);
    }

    /**
     * @throws BlobNotFoundException if the digest was never stored or has been reclaimed
     */
    public byte[] get(ContentHash digest) {
        if (find(digest).isEmpty()) {
            throw new BlobNotFoundException(digest);
        }
        return storage.read(digest).await().indefinitely();
    }

    public boolean contains(ContentHash digest) {
        return find(digest).isPresent();
    }

    /**
     * @throws BlobNotFoundException if the digest is unknown
     */
    public ContentBlobRecord describe(ContentHash digest) {
        return find(digest).orElseThrow(() -> new BlobNotFoundException(digest));
    }

    public Optional<ContentBlobRecord> find(ContentHash digest) {
        return jdbi.withExtension(ContentBlobDao.class, dao -> dao.findByDigest(digest.toHex()));
    }

    /**
     * Deletes the blob if it is still unreferenced, untouched since
     * {@code cutoff} and absent from every snapshot. The row is deleted and
     * committed first; the object goes after. An object whose delete fails is
     * left as an orphan that a later {@link #put} of the same bytes overwrites.
     *
     * @return true if the blob was removed
     */
    boolean reclaimIfUnreferenced(ContentHash digest, Instant cutoff) {
        ReentrantLock lock = lockFor(digest);
        lock.lock();
        try {
            int deleted = jdbi.withExtension(ContentBlobDao.class,
                    dao -> dao.deleteIfReclaimable(digest.toHex(), cutoff));
            if (deleted == 0) {
                return false;
            }
            try {
                storage.delete(digest).await().indefinitely();
            } catch (StorageException e) {
                log.warnf(e, "Blob %s unrecorded but its object could not be deleted; left orphaned", digest);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    private boolean increment(String hex) {
        return jdbi.withExtension(ContentBlobDao.class, dao -> dao.incrementRefCount(hex, now())) == 1;
    }

    private void write(ContentHash digest, byte[] content) {
        Uni<Void> write = storage.create(digest, content);
        if (writeAttempts > 1) {
            write = write.onFailure(StorageException.class).retry()
                    .withBackOff(writeBackoff, writeBackoff.multipliedBy(10))
                    .atMost(writeAttempts - 1);
        }
        try {
            write.await().indefinitely();
        } catch (RuntimeException e) {
            log.warnf("Write of blob %s failed after %d attempt(s): %s",
                    digest, Math.max(writeAttempts, 1), e.getMessage());
            throw new StorageWriteException(digest, Math.max(writeAttempts, 1), e);
        }
    }

    private ReentrantLock lockFor(ContentHash digest) {
        return locks[Math.floorMod(digest.hashCode(), LOCK_STRIPES)];
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
