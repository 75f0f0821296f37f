package com.libragraph.mailbackup.core.query;

import com.libragraph.mailbackup.core.dao.ContentBlobDao;
import com.libragraph.mailbackup.core.dao.ObjectEntryRecord;
import com.libragraph.mailbackup.core.dao.SnapshotItemRecord;
import com.libragraph.mailbackup.core.dao.SnapshotRecord;
import com.libragraph.mailbackup.core.dao.SnapshotSkipRecord;
import com.libragraph.mailbackup.core.index.ObjectIndex;
import com.libragraph.mailbackup.core.snapshot.SnapshotManager;
import com.libragraph.mailbackup.core.store.ContentStore;
import com.libragraph.mailbackup.core.tenant.TenantRegistry;
import com.libragraph.mailbackup.types.ItemIdentity;
import com.libragraph.mailbackup.types.TenantScope;
import com.libragraph.mailbackup.util.ContentHash;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Read-only view of the store for the presentation layer. Never mutates
 * reference counts, index entries or snapshots.
 */
@ApplicationScoped
public class BackupQueryService {

    @Inject
    Jdbi jdbi;

    @Inject
    ContentStore contentStore;

    @Inject
    ObjectIndex objectIndex;

    @Inject
    SnapshotManager snapshotManager;

    @Inject
    TenantRegistry tenantRegistry;

    public List<SnapshotRecord> listRestoreCandidates(TenantScope scope) {
        return snapshotManager.listRestoreCandidates(scope);
    }

    public List<SnapshotRecord> recentSnapshots(int limit) {
        return snapshotManager.recent(limit);
    }

    public SnapshotRecord snapshot(long snapshotId) {
        return snapshotManager.get(snapshotId);
    }

    public List<SnapshotItemRecord> snapshotItems(long snapshotId, String tenantId) {
        return tenantId == null
                ? snapshotManager.items(snapshotId)
                : snapshotManager.items(snapshotId, tenantId);
    }

    public List<SnapshotSkipRecord> snapshotSkips(long snapshotId) {
        return snapshotManager.skips(snapshotId);
    }

    public ObjectEntryRecord lookup(ItemIdentity identity) {
        return objectIndex.lookup(identity);
    }

    /**
     * Entries currently live in {@code scope}, in identity order, at most {@code limit}.
     */
    public List<ObjectEntryRecord> liveItems(TenantScope scope, int limit) {
        try (Stream<ObjectEntryRecord> entries = objectIndex.listForSnapshot(scope, Instant.now())) {
            return entries.limit(limit).collect(Collectors.toList());
        }
    }

    public byte[] download(ContentHash digest) {
        return contentStore.get(digest);
    }

    /**
     * Bytes the identity had when {@code snapshotId} recorded it.
     */
    public byte[] downloadAsOf(long snapshotId, ItemIdentity identity) {
        return contentStore.get(snapshotManager.resolve(snapshotId, identity));
    }

    public StoreStats stats() {
        long[] blobs = jdbi.withExtension(ContentBlobDao.class,
                dao -> new long[]{dao.count(), dao.totalBytes()});
        return new StoreStats(blobs[0], blobs[1], objectIndex.countLive(), tenantRegistry.listActive().size());
    }
}
