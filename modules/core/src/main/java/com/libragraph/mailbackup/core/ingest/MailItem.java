package com.libragraph.mailbackup.core.ingest;

import com.libragraph.mailbackup.types.ItemIdentity;

import java.time.Instant;
import java.util.Objects;

/**
 * A fetched message or attachment: its identity, raw bytes, and the
 * provider's last-modified time (null if the provider did not report one).
 */
public record MailItem(ItemIdentity identity, byte[] content, Instant providerModifiedAt) {

    public MailItem {
        Objects.requireNonNull(identity, "identity cannot be null");
        Objects.requireNonNull(content, "content cannot be null");
    }
}
