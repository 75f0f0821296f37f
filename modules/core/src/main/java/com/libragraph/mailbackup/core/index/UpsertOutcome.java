package com.libragraph.mailbackup.core.index;

public enum UpsertOutcome {
    CREATED,
    UPDATED,
    UNCHANGED
}
