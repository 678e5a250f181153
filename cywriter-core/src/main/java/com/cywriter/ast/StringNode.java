package com.cywriter.ast;

public record StringNode(
    String value
) implements AtomicExprNode {
    @Override
    public String type() {
        return "StringNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitString(this);
    }
}
