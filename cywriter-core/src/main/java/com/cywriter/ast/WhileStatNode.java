package com.cywriter.ast;

public record WhileStatNode(
    ExprNode condition,
    StatNode body,
    StatNode elseClause  // Can be null
) implements StatNode {
    @Override
    public String type() {
        return "WhileStatNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitWhileStat(this);
    }
}
