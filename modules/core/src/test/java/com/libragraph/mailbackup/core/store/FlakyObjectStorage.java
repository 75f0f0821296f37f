package com.libragraph.mailbackup.core.store;

import com.libragraph.mailbackup.util.ContentHash;
import io.smallrye.mutiny.Uni;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delegating storage whose first {@code failures} writes fail. Deletes
 * fail while {@link #failDeletes} is set.
 */
class FlakyObjectStorage implements ObjectStorage {

    private final ObjectStorage delegate;
    private final AtomicInteger remainingFailures;
    final AtomicInteger createCalls = new AtomicInteger();
    volatile boolean failDeletes;

    FlakyObjectStorage(ObjectStorage delegate, int failures) {
        this.delegate = delegate;
        this.remainingFailures = new AtomicInteger(failures);
    }

    @Override
    public Uni<byte[]> read(ContentHash digest) {
        return delegate.read(digest);
    }

    @Override
    public Uni<Void> create(ContentHash digest, byte[] data) {
        return Uni.createFrom().voidItem().invoke(() -> {
            createCalls.incrementAndGet();
            if (remainingFailures.getAndDecrement() > 0) {
                throw new StorageException("injected write failure");
            }
        }).chain(() -> delegate.create(digest, data));
    }

    @Override
    public Uni<Boolean> exists(ContentHash digest) {
        return delegate.exists(digest);
    }

    @Override
    public Uni<Void> delete(ContentHash digest) {
        if (failDeletes) {
            return Uni.createFrom().failure(new StorageException("injected delete failure"));
        }
        return delegate.delete(digest);
    }

    @Override
    public String storageKey(ContentHash digest) {
        return delegate.storageKey(digest);
    }
}
