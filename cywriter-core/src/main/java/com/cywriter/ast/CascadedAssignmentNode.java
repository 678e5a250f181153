package com.cywriter.ast;

import java.util.List;

/**
 * {@code a = b = rhs}: every target in {@code lhsList} receives the same value.
 */
public record CascadedAssignmentNode(
    List<ExprNode> lhsList,
    ExprNode rhs
) implements StatNode {
    public CascadedAssignmentNode {
        lhsList = List.copyOf(lhsList);
    }

    @Override
    public String type() {
        return "CascadedAssignmentNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCascadedAssignment(this);
    }
}
