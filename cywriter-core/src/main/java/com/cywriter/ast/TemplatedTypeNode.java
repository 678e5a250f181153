package com.cywriter.ast;

import java.util.List;

public record TemplatedTypeNode(
    BaseTypeNode baseType,
    List<Node> positionalArgs  // Template arguments: base types or expressions
) implements BaseTypeNode {
    public TemplatedTypeNode {
        positionalArgs = List.copyOf(positionalArgs);
    }

    @Override
    public String type() {
        return "TemplatedTypeNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitTemplatedType(this);
    }
}
