package com.cywriter.ast;

/**
 * Opaque identity of a compiler temporary. Two handles denote the same temporary only if they
 * are the same instance; {@code id} and {@code typeName} are kept for diagnostics and for
 * re-linking handles when a tree is read back from JSON.
 */
public final class TempHandle {
    private final int id;
    private final String typeName;  // Can be null

    public TempHandle(int id, String typeName) {
        this.id = id;
        this.typeName = typeName;
    }

    public TempHandle(int id) {
        this(id, null);
    }

    public int id() {
        return id;
    }

    public String typeName() {
        return typeName;
    }

    @Override
    public String toString() {
        return typeName == null ? "TempHandle#" + id : "TempHandle#" + id + "(" + typeName + ")";
    }
}
