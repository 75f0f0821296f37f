package com.libragraph.mailbackup.core.ingest;

import com.libragraph.mailbackup.core.dao.ObjectEntryRecord;
import com.libragraph.mailbackup.core.dao.SnapshotRecord;
import com.libragraph.mailbackup.core.dao.TenantRecord;
import com.libragraph.mailbackup.core.index.ObjectIndex;
import com.libragraph.mailbackup.core.index.UpsertOutcome;
import com.libragraph.mailbackup.core.index.UpsertResult;
import com.libragraph.mailbackup.core.snapshot.IncrementalPlan;
import com.libragraph.mailbackup.core.snapshot.SnapshotAlreadyRunningException;
import com.libragraph.mailbackup.core.snapshot.SnapshotError;
import com.libragraph.mailbackup.core.snapshot.SnapshotManager;
import com.libragraph.mailbackup.core.store.BlobNotFoundException;
import com.libragraph.mailbackup.core.store.ContentStore;
import com.libragraph.mailbackup.core.tenant.TenantNotFoundException;
import com.libragraph.mailbackup.core.tenant.TenantRegistry;
import com.libragraph.mailbackup.types.ItemIdentity;
import com.libragraph.mailbackup.types.SnapshotStatus;
import com.libragraph.mailbackup.types.TenantScope;
import com.libragraph.mailbackup.util.ContentHash;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Drives one backup run per scope: begins a snapshot, pulls items from the
 * {@link MailSource}, stores and indexes them, records them into the
 * snapshot and finally completes or fails it.
 *
 * <p>Items of a run are processed on a bounded number of workers. Snapshot
 * appends are serialised per run. Blobs stored before a run fails are kept;
 * they are deduplicated on the next run.
 */
@ApplicationScoped
public class IngestionCoordinator {

    private static final Logger log = Logger.getLogger(IngestionCoordinator.class);

    static final String CANCELLED = "cancelled";

    @Inject
    ContentStore contentStore;

    @Inject
    ObjectIndex objectIndex;

    @Inject
    SnapshotManager snapshotManager;

    @Inject
    TenantRegistry tenantRegistry;

    @Inject
    MailSource mailSource;

    @Inject
    @Named("ingestExecutor")
    ExecutorService executor;

    @ConfigProperty(name = "backup.ingest.workers", defaultValue = "8")
    int workers;

    @ConfigProperty(name = "backup.ingest.max-failure-rate", defaultValue = "0.1")
    double maxFailureRate;

    @ConfigProperty(name = "backup.ingest.failure-rate-min-items", defaultValue = "20")
    int failureRateMinItems;

    private final Map<String, CancellationToken> activeRuns = new ConcurrentHashMap<>();

    public RunResult runScope(TenantScope scope) {
        return runScope(scope, null);
    }

    public RunResult runScope(TenantScope scope, String label) {
        return runScope(scope, label, new CancellationToken());
    }

    /**
     * Runs one backup of {@code scope} to completion or failure.
     *
     * @throws SnapshotAlreadyRunningException if the scope is already being backed up
     * @throws TenantNotFoundException         if a single-tenant scope names an inactive tenant
     */
    public RunResult runScope(TenantScope scope, String label, CancellationToken token) {
        if (!scope.isAll()) {
            tenantRegistry.requireActive(scope.tenantId());
        }
        long snapshotId = snapshotManager.begin(scope, label);
        activeRuns.put(scope.key(), token);
        try {
            return execute(new Run(snapshotId, scope, workers), token);
        } finally {
            activeRuns.remove(scope.key(), token);
        }
    }

    /**
     * Runs every active tenant's scope concurrently. Tenants whose scope is
     * already running are reported and left out of the result.
     */
    public List<RunResult> runAllTenants(String label) {
        List<TenantRecord> tenants = tenantRegistry.listActive();
        List<CompletableFuture<RunResult>> runs = new ArrayList<>();
        for (TenantRecord tenant : tenants) {
            TenantScope scope = TenantScope.tenant(tenant.id());
            runs.add(CompletableFuture.supplyAsync(() -> runScope(scope, label), executor));
        }
        List<RunResult> results = new ArrayList<>();
        for (int i = 0; i < runs.size(); i++) {
            try {
                results.add(runs.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof SnapshotAlreadyRunningException
                        || cause instanceof TenantNotFoundException) {
                    log.warnf("Tenant %s not backed up: %s", tenants.get(i).id(), cause.getMessage());
                } else if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                } else {
                    throw e;
                }
            }
        }
        return results;
    }

    /**
     * Asks the running backup of {@code scope} to stop. It fails its snapshot
     * with reason "cancelled" once in-flight items finish.
     *
     * @return false if no run of this scope is active
     */
    public boolean cancel(TenantScope scope) {
        CancellationToken token = activeRuns.get(scope.key());
        if (token == null) {
            return false;
        }
        token.cancel();
        log.infof("Cancellation requested for scope %s", scope);
        return true;
    }

    public boolean isRunning(TenantScope scope) {
        return activeRuns.containsKey(scope.key());
    }

    @PreDestroy
    void shutdown() {
        activeRuns.values().forEach(CancellationToken::cancel);
    }

    private RunResult execute(Run run, CancellationToken token) {
        IncrementalPlan plan;
        try {
            Long baseline = snapshotManager.latestComplete(run.scope).map(SnapshotRecord::id).orElse(null);
            plan = snapshotManager.computeIncrementalPlan(run.scope, baseline);
        } catch (RuntimeException e) {
            log.errorf(e, "Snapshot %d: could not compute incremental plan", run.snapshotId);
            return finishFailed(run, e.getMessage(), e);
        }
        log.infof("Snapshot %d: fetching scope %s (%s)", run.snapshotId, run.scope,
                plan.isFull() ? "full" : "incremental since " + plan.baselineSnapshotId());

        String stopReason = null;
        RuntimeException streamFailure = null;
        boolean interrupted = false;
        try (Stream<FetchResult> results = mailSource.fetch(run.scope, plan)) {
            Iterator<FetchResult> it = results.iterator();
            while (true) {
                if (token.isCancelled() || Thread.currentThread().isInterrupted()) {
                    stopReason = CANCELLED;
                    break;
                }
                if (run.fault.get() != null) {
                    break;
                }
                if (run.failureRateExceeded(maxFailureRate, failureRateMinItems)) {
                    stopReason = run.failureRateReason();
                    break;
                }
                if (!it.hasNext()) {
                    break;
                }
                FetchResult result = it.next();
                run.permits.acquire();
                try {
                    executor.execute(() -> {
                        try {
                            process(run, result);
                        } finally {
                            run.permits.release();
                        }
                    });
                } catch (RejectedExecutionException e) {
                    run.permits.release();
                    stopReason = CANCELLED;
                    break;
                }
            }
        } catch (InterruptedException e) {
            interrupted = true;
            stopReason = CANCELLED;
        } catch (RuntimeException e) {
            streamFailure = e;
        }

        run.awaitIdle();
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        if (streamFailure != null) {
            log.errorf(streamFailure, "Snapshot %d: fetch stream failed", run.snapshotId);
            return finishFailed(run, messageOf(streamFailure), streamFailure);
        }
        RunFault fault = run.fault.get();
        if (fault != null) {
            return finishFailed(run, fault.reason(), fault.cause());
        }
        RuntimeException releaseFailure = retryPendingReleases(run);
        if (releaseFailure != null) {
            return finishFailed(run, "could not release " + run.pendingReleases.size()
                    + " superseded blob reference(s): " + messageOf(releaseFailure), releaseFailure);
        }
        if (stopReason == null && run.failureRateExceeded(maxFailureRate, failureRateMinItems)) {
            stopReason = run.failureRateReason();
        }
        if (stopReason != null) {
            return finishFailed(run, stopReason, null);
        }
        snapshotManager.complete(run.snapshotId);
        log.infof("Snapshot %d: complete, %d recorded, %d skipped, %d tombstoned",
                run.snapshotId, run.processed.get(), run.skipped.get(), run.tombstoned.get());
        return new RunResult(run.snapshotId, SnapshotStatus.COMPLETE,
                run.processed.get(), run.skipped.get(), null);
    }

    private RunResult finishFailed(Run run, String reason, Throwable cause) {
        if (cause != null) {
            snapshotManager.fail(run.snapshotId, SnapshotError.of(reason, cause));
        } else {
            snapshotManager.fail(run.snapshotId, reason);
        }
        return new RunResult(run.snapshotId, SnapshotStatus.FAILED,
                run.processed.get(), run.skipped.get(), reason);
    }

    void process(Run run, FetchResult result) {
        ItemIdentity identity = result.identity();
        try {
            if (!run.scope.includes(identity.tenantId())) {
                skip(run, identity, "outside run scope " + run.scope);
                return;
            }
            if (result instanceof FetchResult.Fetched fetched) {
                ingest(run, fetched.item());
            } else if (result instanceof FetchResult.Unchanged) {
                unchanged(run, identity);
            } else if (result instanceof FetchResult.Deleted) {
                deleted(run, identity);
            } else if (result instanceof FetchResult.Failed failed) {
                failItem(run, identity, failed.cause());
            }
        } catch (RuntimeException e) {
            failItem(run, identity, e);
        }
    }

    private void ingest(Run run, MailItem item) {
        ItemIdentity identity = item.identity();
        byte[] content = item.content();
        ContentHash digest = contentStore.digest(content);
        Optional<ObjectEntryRecord> existing = objectIndex.find(identity);

        if (existing.isPresent() && existing.get().digest().equals(digest.toHex())
                && objectIndex.refreshIfCurrent(existing.get(), item.providerModifiedAt())) {
            log.debugf("Snapshot %d: %s unchanged", run.snapshotId, identity);
            record(run, identity, digest);
            return;
        }

        acquireReference(digest, content);
        UpsertResult upsert;
        try {
            upsert = objectIndex.upsert(identity, digest, content.length, item.providerModifiedAt());
        } catch (RuntimeException e) {
            giveBack(digest, e);
            throw e;
        }
        if (upsert.outcome() == UpsertOutcome.UNCHANGED) {
            releaseSuperseded(run, digest);
        } else if (upsert.outcome() == UpsertOutcome.UPDATED) {
            releaseSuperseded(run, upsert.previousDigest());
        }
        log.debugf("Snapshot %d: %s %s -> %s", run.snapshotId, identity, upsert.outcome(), digest);
        record(run, identity, digest);
    }

    // the reference was taken for an upsert that never happened
    private void giveBack(ContentHash digest, RuntimeException failure) {
        try {
            contentStore.release(digest);
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
    }

    /**
     * Drops a reference the index no longer holds. A failed release is
     * queued and retried before the run completes.
     */
    private void releaseSuperseded(Run run, ContentHash digest) {
        try {
            contentStore.release(digest);
        } catch (RuntimeException e) {
            log.warnf("Snapshot %d: release of %s failed, retrying at end of run: %s",
                    run.snapshotId, digest, messageOf(e));
            run.pendingReleases.add(digest);
        }
    }

    private RuntimeException retryPendingReleases(Run run) {
        RuntimeException last = null;
        for (Iterator<ContentHash> it = run.pendingReleases.iterator(); it.hasNext(); ) {
            ContentHash digest = it.next();
            try {
                contentStore.release(digest);
                it.remove();
            } catch (RuntimeException e) {
                log.errorf(e, "Snapshot %d: release of %s failed again", run.snapshotId, digest);
                last = e;
            }
        }
        return last;
    }

    private void acquireReference(ContentHash digest, byte[] content) {
        if (contentStore.contains(digest)) {
            try {
                contentStore.retain(digest);
                return;
            } catch (BlobNotFoundException e) {
                log.debugf("Blob %s reclaimed before retain, storing again", digest);
            }
        }
        contentStore.put(content);
    }

    private void unchanged(Run run, ItemIdentity identity) {
        Optional<ObjectEntryRecord> entry = objectIndex.find(identity);
        if (entry.isEmpty() || entry.get().isTombstoned()) {
            skip(run, identity, "reported unchanged but has no live index entry");
            return;
        }
        ObjectEntryRecord touched = objectIndex.touch(identity);
        record(run, identity, touched.contentHash());
    }

    private void deleted(Run run, ItemIdentity identity) {
        if (objectIndex.find(identity).isEmpty()) {
            log.debugf("Snapshot %d: deletion of never-ingested %s ignored", run.snapshotId, identity);
            return;
        }
        objectIndex.tombstone(identity);
        run.tombstoned.incrementAndGet();
    }

    private void record(Run run, ItemIdentity identity, ContentHash digest) {
        synchronized (run.recordLock) {
            snapshotManager.recordItem(run.snapshotId, identity, digest);
        }
        run.processed.incrementAndGet();
    }

    private void skip(Run run, ItemIdentity identity, String reason) {
        synchronized (run.recordLock) {
            snapshotManager.recordSkip(run.snapshotId, identity, reason);
        }
        run.skipped.incrementAndGet();
    }

    /**
     * Counts the item as failed and records it as a skip so the next plan
     * re-fetches it. If even the skip cannot be recorded, the run fails.
     */
    private void failItem(Run run, ItemIdentity identity, Throwable cause) {
        run.failed.incrementAndGet();
        log.warnf("Snapshot %d: item %s failed: %s", run.snapshotId, identity, messageOf(cause));
        try {
            skip(run, identity, cause.getClass().getSimpleName() + ": " + messageOf(cause));
        } catch (RuntimeException e) {
            log.errorf(e, "Snapshot %d: could not record skip of %s", run.snapshotId, identity);
            run.fault.compareAndSet(null,
                    new RunFault("could not record skip of " + identity + ": " + messageOf(e), e));
        }
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }

    private record RunFault(String reason, RuntimeException cause) {}

    /**
     * Per-run state shared between the pulling thread and its workers.
     */
    static final class Run {
        final long snapshotId;
        final TenantScope scope;
        final int workers;
        final Semaphore permits;
        final Object recordLock = new Object();
        final AtomicInteger processed = new AtomicInteger();
        final AtomicInteger skipped = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();
        final AtomicInteger tombstoned = new AtomicInteger();
        final Queue<ContentHash> pendingReleases = new ConcurrentLinkedQueue<>();
        final AtomicReference<RunFault> fault = new AtomicReference<>();

        Run(long snapshotId, TenantScope scope, int workers) {
            this.snapshotId = snapshotId;
            this.scope = scope;
            this.workers = Math.max(1, workers);
            this.permits = new Semaphore(this.workers);
        }

        int attempted() {
            return processed.get() + skipped.get() + tombstoned.get();
        }

        boolean failureRateExceeded(double maxRate, int minItems) {
            int attempted = attempted();
            return attempted >= minItems && attempted > 0
                    && (double) failed.get() / attempted > maxRate;
        }

        String failureRateReason() {
            return "failure rate exceeded: " + failed.get() + " of " + attempted() + " items failed";
        }

        void awaitIdle() {
            permits.acquireUninterruptibly(workers);
            permits.release(workers);
        }
    }
}
