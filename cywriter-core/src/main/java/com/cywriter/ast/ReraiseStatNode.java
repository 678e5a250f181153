package com.cywriter.ast;

public record ReraiseStatNode() implements StatNode {
    @Override
    public String type() {
        return "ReraiseStatNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitReraiseStat(this);
    }
}
