package com.libragraph.mailbackup.core.store;

import com.libragraph.mailbackup.util.ContentHash;

/**
 * Thrown when a read, retain or release targets a digest that was never
 * stored or has been reclaimed.
 */
public class BlobNotFoundException extends RuntimeException {

    private final ContentHash digest;

    public BlobNotFoundException(ContentHash digest) {
        super("Blob not found: " + digest);
        this.digest = digest;
    }

    public ContentHash digest() {
        return digest;
    }
}
