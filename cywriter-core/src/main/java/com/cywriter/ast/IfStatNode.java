package com.cywriter.ast;

import java.util.List;

public record IfStatNode(
    List<IfClauseNode> ifClauses,  // The if clause followed by any elif clauses
    StatNode elseClause            // Can be null
) implements StatNode {
    public IfStatNode {
        ifClauses = List.copyOf(ifClauses);
    }

    @Override
    public String type() {
        return "IfStatNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitIfStat(this);
    }
}
