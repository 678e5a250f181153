package com.cywriter.ast;

public record NotNode(
    ExprNode operand
) implements ExprNode {
    @Override
    public String type() {
        return "NotNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitNot(this);
    }
}
