package com.cywriter.ast;

public record AsTupleNode(
    ExprNode arg
) implements ExprNode {
    @Override
    public String type() {
        return "AsTupleNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitAsTuple(this);
    }
}
