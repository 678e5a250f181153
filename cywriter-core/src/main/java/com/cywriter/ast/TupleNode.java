package com.cywriter.ast;

import java.util.List;

public record TupleNode(
    List<ExprNode> args
) implements SequenceNode {
    public TupleNode {
        args = args == null ? List.of() : List.copyOf(args);
    }

    public TupleNode(ExprNode... args) {
        this(List.of(args));
    }

    @Override
    public String type() {
        return "TupleNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitTuple(this);
    }
}
