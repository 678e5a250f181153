package com.cywriter.ast;

public record CArrayDeclaratorNode(
    DeclaratorNode base,
    ExprNode dimension  // Can be null for unbounded arrays
) implements DeclaratorNode {
    @Override
    public ExprNode defaultValue() {
        return base.defaultValue();
    }

    @Override
    public String type() {
        return "CArrayDeclaratorNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCArrayDeclarator(this);
    }
}
