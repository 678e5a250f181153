package com.cywriter.ast;

public record IndexNode(
    ExprNode base,
    ExprNode index
) implements ExprNode {
    @Override
    public String type() {
        return "IndexNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitIndex(this);
    }
}
