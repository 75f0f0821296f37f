package com.libragraph.mailbackup.core.ingest;

import com.libragraph.mailbackup.types.SnapshotStatus;

/**
 * Outcome of one ingestion run.
 *
 * @param itemsProcessed items recorded into the snapshot
 * @param itemsSkipped   items recorded as skipped, failures included
 * @param failureReason  null unless {@code status} is FAILED
 */
public record RunResult(
        long snapshotId,
        SnapshotStatus status,
        int itemsProcessed,
        int itemsSkipped,
        String failureReason
) {
    public boolean succeeded() {
        return status == SnapshotStatus.COMPLETE;
    }

    /**
     * Process exit code for a scheduler or CLI wrapper: 0 on success, 1 otherwise.
     */
    public int exitCode() {
        return succeeded() ? 0 : 1;
    }
}
