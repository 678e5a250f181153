package com.cywriter.ast;

public record DictItemNode(
    ExprNode key,
    ExprNode value
) implements Node {
    @Override
    public String type() {
        return "DictItemNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitDictItem(this);
    }
}
