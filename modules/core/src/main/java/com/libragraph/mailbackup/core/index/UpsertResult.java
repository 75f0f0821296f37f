package com.libragraph.mailbackup.core.index;

import com.libragraph.mailbackup.core.dao.ObjectEntryRecord;
import com.libragraph.mailbackup.util.ContentHash;

/**
 * Result of {@link ObjectIndex#upsert}. {@code previousDigest} is set only
 * for {@link UpsertOutcome#UPDATED}; the caller owns releasing it.
 */
public record UpsertResult(UpsertOutcome outcome, ObjectEntryRecord entry, ContentHash previousDigest) {

    static UpsertResult created(ObjectEntryRecord entry) {
        return new UpsertResult(UpsertOutcome.CREATED, entry, null);
    }

    static UpsertResult updated(ObjectEntryRecord entry, ContentHash previous) {
        return new UpsertResult(UpsertOutcome.UPDATED, entry, previous);
    }

    static UpsertResult unchanged(ObjectEntryRecord entry) {
        return new UpsertResult(UpsertOutcome.UNCHANGED, entry, null);
    }
}
