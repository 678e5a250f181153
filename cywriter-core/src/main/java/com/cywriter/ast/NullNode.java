package com.cywriter.ast;

public record NullNode() implements AtomicExprNode {
    @Override
    public String type() {
        return "NullNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitNull(this);
    }
}
