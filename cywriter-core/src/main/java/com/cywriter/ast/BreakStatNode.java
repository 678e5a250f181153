package com.cywriter.ast;

public record BreakStatNode() implements StatNode {
    @Override
    public String type() {
        return "BreakStatNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitBreakStat(this);
    }
}
