package com.cywriter.ast;

public record CoerceToPyTypeNode(
    ExprNode arg
) implements CoercionNode {
    @Override
    public String type() {
        return "CoerceToPyTypeNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCoerceToPyType(this);
    }
}
