package com.libragraph.mailbackup.core.snapshot;

public class SnapshotNotFoundException extends RuntimeException {

    private final long snapshotId;

    public SnapshotNotFoundException(long snapshotId) {
        super("Snapshot not found: " + snapshotId);
        this.snapshotId = snapshotId;
    }

    public long snapshotId() {
        return snapshotId;
    }
}
