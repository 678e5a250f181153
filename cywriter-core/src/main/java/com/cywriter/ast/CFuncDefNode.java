package com.cywriter.ast;

import java.util.List;

/**
 * C function definition ({@code cdef} or {@code cpdef}).
 */
public record CFuncDefNode(
    String visibility,        // "private", "public" or "extern"
    boolean overridable,      // cpdef
    boolean api,
    List<String> modifiers,   // e.g. "inline"
    BaseTypeNode baseType,
    DeclaratorNode declarator,
    StatNode body
) implements StatNode {
    public CFuncDefNode {
        modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
    }

    public CFuncDefNode(BaseTypeNode baseType, DeclaratorNode declarator, StatNode body) {
        this("private", false, false, List.of(), baseType, declarator, body);
    }

    public boolean isInline() {
        return modifiers.contains("inline");
    }

    @Override
    public String type() {
        return "CFuncDefNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCFuncDef(this);
    }
}
