package com.libragraph.mailbackup.core.store;

import com.libragraph.mailbackup.util.ContentHash;
import io.smallrye.mutiny.Uni;

/**
 * Byte storage for content blobs, keyed only by digest.
 *
 * <p>Drivers hold no reference counts or metadata; that lives in the
 * {@code content_blob} table owned by {@link ContentStore}.
 */
public interface ObjectStorage {

    /**
     * Reads a blob.
     *
     * @throws BlobNotFoundException if the blob does not exist
     * @throws StorageException on I/O errors
     */
    Uni<byte[]> read(ContentHash digest);

    /**
     * Writes a blob so that it becomes visible all at once or not at all.
     * Writing the same digest twice leaves identical bytes in place.
     *
     * @throws StorageException on I/O errors
     */
    Uni<Void> create(ContentHash digest, byte[] data);

    Uni<Boolean> exists(ContentHash digest);

    /**
     * Deletes a blob. Deleting a missing blob is a no-op.
     *
     * @throws StorageException on I/O errors
     */
    Uni<Void> delete(ContentHash digest);

    /**
     * Driver-specific location recorded alongside the blob row, for operators.
     */
    String storageKey(ContentHash digest);
}
