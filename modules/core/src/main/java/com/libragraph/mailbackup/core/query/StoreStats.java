package com.libragraph.mailbackup.core.query;

public record StoreStats(long blobCount, long storedBytes, long liveEntries, int activeTenants) {}
