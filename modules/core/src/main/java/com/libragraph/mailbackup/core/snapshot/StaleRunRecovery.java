package com.libragraph.mailbackup.core.snapshot;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Fails snapshots a previous process left running, releasing their scopes
 * so the next scheduled run can begin.
 */
@ApplicationScoped
public class StaleRunRecovery {

    private static final Logger log = Logger.getLogger(StaleRunRecovery.class);

    static final String REASON = "interrupted: process stopped while the snapshot was running";

    @Inject
    SnapshotManager snapshotManager;

    void onStart(@Observes StartupEvent event) {
        recover();
    }

    int recover() {
        int failed = snapshotManager.failStaleRuns(REASON);
        if (failed > 0) {
            log.warnf("Failed %d snapshot(s) left running by a previous process", failed);
        }
        return failed;
    }
}
