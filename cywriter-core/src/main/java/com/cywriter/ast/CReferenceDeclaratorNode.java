package com.cywriter.ast;

public record CReferenceDeclaratorNode(
    DeclaratorNode base
) implements DeclaratorNode {
    @Override
    public ExprNode defaultValue() {
        return base.defaultValue();
    }

    @Override
    public String type() {
        return "CReferenceDeclaratorNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCReferenceDeclarator(this);
    }
}
