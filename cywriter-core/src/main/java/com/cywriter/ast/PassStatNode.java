package com.cywriter.ast;

public record PassStatNode() implements StatNode {
    @Override
    public String type() {
        return "PassStatNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitPassStat(this);
    }
}
