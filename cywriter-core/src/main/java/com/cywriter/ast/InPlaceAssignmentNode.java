package com.cywriter.ast;

public record InPlaceAssignmentNode(
    ExprNode lhs,
    String operator,  // Binary operator without the trailing '=', e.g. "+"
    ExprNode rhs
) implements StatNode {
    @Override
    public String type() {
        return "InPlaceAssignmentNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitInPlaceAssignment(this);
    }
}
