package com.cywriter.ast;

import java.util.List;

public record TryExceptStatNode(
    StatNode body,
    List<ExceptClauseNode> exceptClauses,
    StatNode elseClause  // Can be null
) implements StatNode {
    public TryExceptStatNode {
        exceptClauses = List.copyOf(exceptClauses);
    }

    @Override
    public String type() {
        return "TryExceptStatNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitTryExceptStat(this);
    }
}
