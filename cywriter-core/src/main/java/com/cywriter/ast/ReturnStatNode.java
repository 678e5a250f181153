package com.cywriter.ast;

public record ReturnStatNode(
    ExprNode value  // Can be null
) implements StatNode {
    @Override
    public String type() {
        return "ReturnStatNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitReturnStat(this);
    }
}
