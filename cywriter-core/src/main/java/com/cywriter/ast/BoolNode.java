package com.cywriter.ast;

public record BoolNode(
    boolean value
) implements AtomicExprNode {
    @Override
    public String type() {
        return "BoolNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitBool(this);
    }
}
