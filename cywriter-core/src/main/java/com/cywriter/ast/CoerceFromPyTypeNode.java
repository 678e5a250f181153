package com.cywriter.ast;

public record CoerceFromPyTypeNode(
    ExprNode arg
) implements CoercionNode {
    @Override
    public String type() {
        return "CoerceFromPyTypeNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCoerceFromPyType(this);
    }
}
