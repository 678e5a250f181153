package com.cywriter.ast;

public record NoneNode() implements AtomicExprNode {
    @Override
    public String type() {
        return "NoneNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitNone(this);
    }
}
