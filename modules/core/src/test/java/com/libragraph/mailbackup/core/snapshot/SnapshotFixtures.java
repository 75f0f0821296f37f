package com.libragraph.mailbackup.core.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jdbi.v3.core.Jdbi;

import java.time.Clock;

public final class SnapshotFixtures {

    private SnapshotFixtures() {
    }

    public static SnapshotManager snapshotManager(Jdbi jdbi) {
        return snapshotManager(jdbi, Clock.systemUTC());
    }

    public static SnapshotManager snapshotManager(Jdbi jdbi, Clock clock) {
        return configure(new SnapshotManager(), jdbi, clock);
    }

    /**
     * Wires a test subclass of the manager.
     */
    public static <T extends SnapshotManager> T configure(T manager, Jdbi jdbi, Clock clock) {
        manager.jdbi = jdbi;
        manager.objectMapper = new ObjectMapper();
        manager.clock = clock;
        return manager;
    }
}
