package com.libragraph.mailbackup.core.store;

import com.libragraph.mailbackup.util.ContentHash;

/**
 * Thrown by a release of a blob whose reference count is already zero.
 */
public class BlobNotReferencedException extends IllegalStateException {

    private final ContentHash digest;

    public BlobNotReferencedException(ContentHash digest) {
        super("Blob has no references to release: " + digest);
        this.digest = digest;
    }

    public ContentHash digest() {
        return digest;
    }
}
