package com.libragraph.mailbackup.core.store;

import com.libragraph.mailbackup.core.dao.ContentBlobDao;
import com.libragraph.mailbackup.core.dao.ContentBlobRecord;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Mark-and-sweep removal of blobs nothing refers to any more. Runs out of
 * band from ingestion; a blob is only a candidate once its reference count
 * is zero, it has been untouched for the grace period and no retained
 * snapshot records its digest.
 */
@ApplicationScoped
public class BlobReclaimer {

    private static final Logger log = Logger.getLogger(BlobReclaimer.class);

    @Inject
    Jdbi jdbi;

    @Inject
    ContentStore contentStore;

    @ConfigProperty(name = "backup.reclaim.grace", defaultValue = "PT1H")
    Duration grace;

    @ConfigProperty(name = "backup.reclaim.batch-size", defaultValue = "500")
    int batchSize;

    Clock clock = Clock.systemUTC();

    @Scheduled(every = "{backup.reclaim.every}", concurrentExecution = SKIP)
    public void sweep() {
        int reclaimed = reclaim(clock.instant());
        if (reclaimed > 0) {
            log.infof("Reclaimed %d unreferenced blob(s)", reclaimed);
        }
    }

    /**
     * Runs one pass treating {@code asOf} as the current time.
     *
     * @return number of blobs removed
     */
    public int reclaim(Instant asOf) {
        Instant cutoff = asOf.minus(grace);
        int total = 0;
        while (true) {
            List<ContentBlobRecord> candidates = jdbi.withExtension(ContentBlobDao.class,
                    dao -> dao.findReclaimable(cutoff, batchSize));
            int removed = 0;
            for (ContentBlobRecord candidate : candidates) {
                if (contentStore.reclaimIfUnreferenced(candidate.contentHash(), cutoff)) {
                    removed++;
                    log.debugf("Reclaimed blob %s (%d bytes)", candidate.digest(), candidate.size());
                }
            }
            total += removed;
            if (candidates.size() < batchSize || removed == 0) {
                return total;
            }
        }
    }
}
