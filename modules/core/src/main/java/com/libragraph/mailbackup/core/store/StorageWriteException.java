package com.libragraph.mailbackup.core.store;

import com.libragraph.mailbackup.util.ContentHash;

/**
 * Raised once every write attempt for a blob has failed. The blob is left
 * unrecorded; only the item being ingested fails.
 */
public class StorageWriteException extends StorageException {

    private final ContentHash digest;
    private final int attempts;

    public StorageWriteException(ContentHash digest, int attempts, Throwable cause) {
        super("Failed to write blob " + digest + " after " + attempts + " attempt(s)", cause);
        this.digest = digest;
        this.attempts = attempts;
    }

    public ContentHash digest() {
        return digest;
    }

    public int attempts() {
        return attempts;
    }
}
