package com.cywriter.ast;

public record PyClassDefNode(
    String name,
    TupleNode bases,  // Can be null
    StatNode body
) implements StatNode {
    @Override
    public String type() {
        return "PyClassDefNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitPyClassDef(this);
    }
}
