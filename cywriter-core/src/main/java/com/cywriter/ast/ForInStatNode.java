package com.cywriter.ast;

public record ForInStatNode(
    ExprNode target,      // NameNode, or a TupleNode for unpacking
    ExprNode sequence,
    StatNode body,
    StatNode elseClause   // Can be null
) implements StatNode {
    public ForInStatNode(ExprNode target, ExprNode sequence, StatNode body) {
        this(target, sequence, body, null);
    }

    @Override
    public String type() {
        return "ForInStatNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitForInStat(this);
    }
}
