package com.cywriter.ast;

public record CTypeDefNode(
    BaseTypeNode baseType,
    DeclaratorNode declarator
) implements StatNode {
    @Override
    public String type() {
        return "CTypeDefNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCTypeDef(this);
    }
}
