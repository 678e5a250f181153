package com.cywriter.ast;

public record IfClauseNode(
    ExprNode condition,
    StatNode body
) implements Node {
    @Override
    public String type() {
        return "IfClauseNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitIfClause(this);
    }
}
