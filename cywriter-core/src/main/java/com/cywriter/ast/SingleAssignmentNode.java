package com.cywriter.ast;

public record SingleAssignmentNode(
    ExprNode lhs,
    ExprNode rhs
) implements StatNode {
    @Override
    public String type() {
        return "SingleAssignmentNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitSingleAssignment(this);
    }
}
