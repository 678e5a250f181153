package com.cywriter.ast;

public record CComplexBaseTypeNode(
    BaseTypeNode baseType,
    DeclaratorNode declarator
) implements BaseTypeNode {
    @Override
    public String type() {
        return "CComplexBaseTypeNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCComplexBaseType(this);
    }
}
