package com.cywriter.ast;

/**
 * One entry of a {@code from ... import} or {@code from ... cimport} name list.
 */
public record ImportedName(
    String name,
    String asName,  // Can be null
    String kind     // "struct", "union" or "class" qualifier; can be null
) {
    public ImportedName(String name) {
        this(name, null, null);
    }

    public ImportedName(String name, String asName) {
        this(name, asName, null);
    }
}
