package com.cywriter.ast;

import java.util.List;

public record StatListNode(
    List<StatNode> stats
) implements StatNode {
    public StatListNode {
        stats = stats == null ? List.of() : List.copyOf(stats);
    }

    public StatListNode(StatNode... stats) {
        this(List.of(stats));
    }

    @Override
    public String type() {
        return "StatListNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitStatList(this);
    }
}
