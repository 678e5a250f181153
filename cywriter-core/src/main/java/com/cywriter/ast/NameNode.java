package com.cywriter.ast;

public record NameNode(
    String name
) implements AtomicExprNode {
    @Override
    public String type() {
        return "NameNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitName(this);
    }
}
