package com.cywriter.ast;

public record CNestedBaseTypeNode(
    BaseTypeNode baseType,
    String name
) implements BaseTypeNode {
    @Override
    public String type() {
        return "CNestedBaseTypeNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCNestedBaseType(this);
    }
}
