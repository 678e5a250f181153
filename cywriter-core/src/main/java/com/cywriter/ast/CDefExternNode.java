package com.cywriter.ast;

/**
 * {@code cdef extern from "header.h":} block.
 */
public record CDefExternNode(
    String includeFile,  // Can be null, rendered as *
    StatNode body
) implements StatNode {
    @Override
    public String type() {
        return "CDefExternNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCDefExtern(this);
    }
}
