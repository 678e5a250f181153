package com.cywriter.ast;

import java.util.List;

public record DictNode(
    List<DictItemNode> keyValuePairs
) implements ExprNode {
    public DictNode {
        keyValuePairs = keyValuePairs == null ? List.of() : List.copyOf(keyValuePairs);
    }

    @Override
    public String type() {
        return "DictNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitDict(this);
    }
}
