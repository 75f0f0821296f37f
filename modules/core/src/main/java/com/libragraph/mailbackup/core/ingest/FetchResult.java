package com.libragraph.mailbackup.core.ingest;

import com.libragraph.mailbackup.types.ItemIdentity;

import java.time.Instant;
import java.util.Objects;

/**
 * One element of the stream a {@link MailSource} produces for a run.
 */
public sealed interface FetchResult {

    ItemIdentity identity();

    /** Item downloaded; its bytes are ingested. */
    record Fetched(MailItem item) implements FetchResult {
        public Fetched {
            Objects.requireNonNull(item, "item cannot be null");
        }

        @Override
        public ItemIdentity identity() {
            return item.identity();
        }
    }

    /** Item still present upstream but not downloaded, per the incremental plan. */
    record Unchanged(ItemIdentity identity, Instant providerModifiedAt) implements FetchResult {
        public Unchanged {
            Objects.requireNonNull(identity, "identity cannot be null");
        }
    }

    /** Item deleted upstream. */
    record Deleted(ItemIdentity identity) implements FetchResult {
        public Deleted {
            Objects.requireNonNull(identity, "identity cannot be null");
        }
    }

    /** Item that could not be fetched; recorded as a skip and re-fetched next run. */
    record Failed(ItemIdentity identity, Throwable cause) implements FetchResult {
        public Failed {
            Objects.requireNonNull(identity, "identity cannot be null");
            Objects.requireNonNull(cause, "cause cannot be null");
        }
    }

    static FetchResult fetched(ItemIdentity identity, byte[] content, Instant providerModifiedAt) {
        return new Fetched(new MailItem(identity, content, providerModifiedAt));
    }

    static FetchResult unchanged(ItemIdentity identity, Instant providerModifiedAt) {
        return new Unchanged(identity, providerModifiedAt);
    }

    static FetchResult deleted(ItemIdentity identity) {
        return new Deleted(identity);
    }

    static FetchResult failed(ItemIdentity identity, Throwable cause) {
        return new Failed(identity, cause);
    }
}
