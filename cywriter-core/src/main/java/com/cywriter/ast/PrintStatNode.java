package com.cywriter.ast;

import java.util.List;

public record PrintStatNode(
    List<ExprNode> args,
    boolean appendNewline
) implements StatNode {
    public PrintStatNode {
        args = args == null ? List.of() : List.copyOf(args);
    }

    @Override
    public String type() {
        return "PrintStatNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitPrintStat(this);
    }
}
