package com.cywriter.ast;

public record CEnumDefItemNode(
    String name,
    String cname,    // Can be null
    ExprNode value   // Can be null
) implements Node {
    public CEnumDefItemNode(String name) {
        this(name, null, null);
    }

    @Override
    public String type() {
        return "CEnumDefItemNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCEnumDefItem(this);
    }
}
