package com.cywriter.ast;

import java.util.List;

/**
 * Call with positional arguments only. The arguments are either listed in {@code args} or
 * captured in {@code argTuple}.
 */
public record SimpleCallNode(
    ExprNode function,
    List<ExprNode> args,
    TupleNode argTuple  // Can be null
) implements ExprNode {
    public SimpleCallNode {
        args = args == null ? List.of() : List.copyOf(args);
    }

    public SimpleCallNode(ExprNode function, List<ExprNode> args) {
        this(function, args, null);
    }

    @Override
    public String type() {
        return "SimpleCallNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitSimpleCall(this);
    }
}
