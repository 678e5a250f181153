package com.cywriter.ast;

import java.util.List;

/**
 * Extension type definition ({@code cdef class}).
 */
public record CClassDefNode(
    String className,
    String moduleName,        // Only set for extern classes, which are not written
    String baseClassModule,   // Can be null
    String baseClassName,     // Can be null
    List<DecoratorNode> decorators,
    StatNode body
) implements StatNode {
    public CClassDefNode {
        decorators = decorators == null ? List.of() : List.copyOf(decorators);
    }

    public CClassDefNode(String className, String baseClassName, StatNode body) {
        this(className, null, null, baseClassName, List.of(), body);
    }

    @Override
    public String type() {
        return "CClassDefNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCClassDef(this);
    }
}
