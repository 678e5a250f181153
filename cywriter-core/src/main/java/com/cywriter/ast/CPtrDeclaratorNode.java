package com.cywriter.ast;

public record CPtrDeclaratorNode(
    DeclaratorNode base
) implements DeclaratorNode {
    @Override
    public ExprNode defaultValue() {
        return base.defaultValue();
    }

    @Override
    public String type() {
        return "CPtrDeclaratorNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCPtrDeclarator(this);
    }
}
