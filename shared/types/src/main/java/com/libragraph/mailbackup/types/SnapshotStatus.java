package com.libragraph.mailbackup.types;

/**
 * Snapshot lifecycle: {@code RUNNING -> COMPLETE} or {@code RUNNING -> FAILED}.
 * Both outcomes are terminal.
 */
public enum SnapshotStatus {
    RUNNING(0, "RUNNING"),
    COMPLETE(1, "COMPLETE"),
    FAILED(2, "FAILED");

    private final int id;
    private final String label;

    SnapshotStatus(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public static SnapshotStatus fromId(int id) {
        for (SnapshotStatus s : values()) {
            if (s.id == id) return s;
        }
        throw new IllegalArgumentException("Unknown SnapshotStatus id: " + id);
    }
}
