package com.cywriter.ast;

public record AttributeNode(
    ExprNode obj,
    String attribute
) implements ExprNode {
    @Override
    public String type() {
        return "AttributeNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitAttribute(this);
    }
}
