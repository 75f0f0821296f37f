package com.libragraph.mailbackup.core.snapshot;

import com.libragraph.mailbackup.types.SnapshotStatus;

/**
 * Thrown when an operation is not allowed in the snapshot's current state,
 * such as recording into a finished snapshot or re-recording an identity
 * with a different digest. Never retried.
 */
public class InvalidSnapshotStateException extends IllegalStateException {

    private final long snapshotId;
    private final SnapshotStatus status;

    public InvalidSnapshotStateException(long snapshotId, SnapshotStatus status, String message) {
        super("Snapshot " + snapshotId + " (" + status + "): " + message);
        this.snapshotId = snapshotId;
        this.status = status;
    }

    public long snapshotId() {
        return snapshotId;
    }

    public SnapshotStatus status() {
        return status;
    }
}
