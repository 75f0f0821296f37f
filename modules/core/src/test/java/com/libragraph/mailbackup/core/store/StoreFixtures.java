package com.libragraph.mailbackup.core.store;

import org.jdbi.v3.core.Jdbi;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires store beans by hand for tests outside this package.
 */
public final class StoreFixtures {

    private StoreFixtures() {
    }

    public static FilesystemObjectStorage filesystemStorage(Path root) {
        FilesystemObjectStorage storage = new FilesystemObjectStorage();
        storage.root = root.toString();
        return storage;
    }

    public static ContentStore contentStore(Jdbi jdbi, ObjectStorage storage) {
        return contentStore(jdbi, storage, Clock.systemUTC());
    }

    public static ContentStore contentStore(Jdbi jdbi, ObjectStorage storage, Clock clock) {
        return configure(new ContentStore(), jdbi, storage, clock);
    }

    /**
     * Wires a test subclass of the store.
     */
    public static <T extends ContentStore> T configure(T store, Jdbi jdbi, ObjectStorage storage, Clock clock) {
        store.jdbi = jdbi;
        store.storage = storage;
        store.writeAttempts = 3;
        store.writeBackoff = Duration.ofMillis(1);
        store.clock = clock;
        return store;
    }

    public static BlobReclaimer reclaimer(Jdbi jdbi, ContentStore store, Duration grace) {
        BlobReclaimer reclaimer = new BlobReclaimer();
        reclaimer.jdbi = jdbi;
        reclaimer.contentStore = store;
        reclaimer.grace = grace;
        reclaimer.batchSize = 2;
        return reclaimer;
    }
}
