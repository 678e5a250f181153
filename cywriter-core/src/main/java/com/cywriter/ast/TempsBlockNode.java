package com.cywriter.ast;

import java.util.List;

/**
 * Allocates the given temporaries for the duration of {@code body}.
 */
public record TempsBlockNode(
    List<TempHandle> temps,
    StatNode body
) implements StatNode {
    public TempsBlockNode {
        temps = List.copyOf(temps);
    }

    @Override
    public String type() {
        return "TempsBlockNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitTempsBlock(this);
    }
}
