package com.libragraph.mailbackup.core.index;

import com.libragraph.mailbackup.types.ItemIdentity;

/**
 * Thrown when an index operation names an identity that was never ingested.
 */
public class EntryNotFoundException extends RuntimeException {

    private final ItemIdentity identity;

    public EntryNotFoundException(ItemIdentity identity) {
        super("No index entry for " + identity);
        this.identity = identity;
    }

    public ItemIdentity identity() {
        return identity;
    }
}
