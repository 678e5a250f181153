package com.cywriter.ast;

public record CoerceToBooleanNode(
    ExprNode arg
) implements CoercionNode {
    @Override
    public String type() {
        return "CoerceToBooleanNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCoerceToBoolean(this);
    }
}
