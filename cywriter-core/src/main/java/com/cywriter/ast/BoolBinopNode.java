package com.cywriter.ast;

public record BoolBinopNode(
    String operator,  // "and" or "or"
    ExprNode operand1,
    ExprNode operand2
) implements ExprNode {
    @Override
    public String type() {
        return "BoolBinopNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitBoolBinop(this);
    }
}
