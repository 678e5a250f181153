package com.cywriter.ast;

public record ContinueStatNode() implements StatNode {
    @Override
    public String type() {
        return "ContinueStatNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitContinueStat(this);
    }
}
