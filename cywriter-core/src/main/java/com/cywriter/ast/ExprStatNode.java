package com.cywriter.ast;

public record ExprStatNode(
    ExprNode expr
) implements StatNode {
    @Override
    public String type() {
        return "ExprStatNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitExprStat(this);
    }
}
