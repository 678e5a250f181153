package com.cywriter.ast;

public record TryFinallyStatNode(
    StatNode body,
    StatNode finallyClause
) implements StatNode {
    @Override
    public String type() {
        return "TryFinallyStatNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitTryFinallyStat(this);
    }
}
