package com.cywriter.ast;

public record CoerceToTempNode(
    ExprNode arg
) implements CoercionNode {
    @Override
    public String type() {
        return "CoerceToTempNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCoerceToTemp(this);
    }
}
