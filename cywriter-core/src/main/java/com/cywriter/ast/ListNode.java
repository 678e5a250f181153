package com.cywriter.ast;

import java.util.List;

public record ListNode(
    List<ExprNode> args
) implements SequenceNode {
    public ListNode {
        args = args == null ? List.of() : List.copyOf(args);
    }

    public ListNode(ExprNode... args) {
        this(List.of(args));
    }

    @Override
    public String type() {
        return "ListNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitList(this);
    }
}
