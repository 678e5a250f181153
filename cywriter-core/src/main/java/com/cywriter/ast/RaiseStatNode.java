package com.cywriter.ast;

public record RaiseStatNode(
    ExprNode excType,
    ExprNode excValue,  // Can be null
    ExprNode excTb,     // Can be null
    ExprNode cause      // Can be null
) implements StatNode {
    public RaiseStatNode(ExprNode excType) {
        this(excType, null, null, null);
    }

    @Override
    public String type() {
        return "RaiseStatNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitRaiseStat(this);
    }
}
