package com.cywriter.ast;

public record ModuleNode(
    StatListNode body
) implements Node {
    @Override
    public String type() {
        return "ModuleNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitModule(this);
    }
}
