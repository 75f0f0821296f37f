package com.libragraph.mailbackup.core.snapshot;

import com.libragraph.mailbackup.types.TenantScope;

/**
 * Thrown by {@link SnapshotManager#begin} when the scope already holds a
 * running snapshot.
 */
public class SnapshotAlreadyRunningException extends RuntimeException {

    private final TenantScope scope;
    private final Long runningSnapshotId;

    public SnapshotAlreadyRunningException(TenantScope scope, Long runningSnapshotId) {
        super("Snapshot already running for scope " + scope
                + (runningSnapshotId != null ? ": snapshot " + runningSnapshotId : ""));
        this.scope = scope;
        this.runningSnapshotId = runningSnapshotId;
    }

    public TenantScope scope() {
        return scope;
    }

    /**
     * Id of the blocking snapshot, or null if it finished before it could be read.
     */
    public Long runningSnapshotId() {
        return runningSnapshotId;
    }
}
