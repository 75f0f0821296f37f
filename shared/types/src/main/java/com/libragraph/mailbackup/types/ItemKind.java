package com.libragraph.mailbackup.types;

public enum ItemKind {
    MESSAGE(0, "message"),
    ATTACHMENT(1, "attachment");

    private final int id;
    private final String label;

    ItemKind(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static ItemKind fromId(int id) {
        for (ItemKind k : values()) {
            if (k.id == id) return k;
        }
        throw new IllegalArgumentException("Unknown ItemKind id: " + id);
    }

    public static ItemKind fromLabel(String label) {
        for (ItemKind k : values()) {
            if (k.label.equalsIgnoreCase(label)) return k;
        }
        throw new IllegalArgumentException("Unknown ItemKind label: " + label);
    }
}
