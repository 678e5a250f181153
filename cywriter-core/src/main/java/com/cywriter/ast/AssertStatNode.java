package com.cywriter.ast;

public record AssertStatNode(
    ExprNode cond,
    ExprNode value  // Can be null
) implements StatNode {
    @Override
    public String type() {
        return "AssertStatNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitAssertStat(this);
    }
}
