package com.cywriter.ast;

public record BinopNode(
    String operator,
    ExprNode operand1,
    ExprNode operand2
) implements ExprNode {
    @Override
    public String type() {
        return "BinopNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitBinop(this);
    }
}
