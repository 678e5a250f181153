package com.cywriter.ast;

public record ExceptClauseNode(
    ExprNode pattern,  // Can be null for a bare except
    ExprNode target,   // Can be null
    StatNode body
) implements Node {
    @Override
    public String type() {
        return "ExceptClauseNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitExceptClause(this);
    }
}
