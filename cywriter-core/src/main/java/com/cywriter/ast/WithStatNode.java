package com.cywriter.ast;

public record WithStatNode(
    ExprNode manager,
    ExprNode target,  // Can be null
    StatNode body
) implements StatNode {
    @Override
    public String type() {
        return "WithStatNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitWithStat(this);
    }
}
