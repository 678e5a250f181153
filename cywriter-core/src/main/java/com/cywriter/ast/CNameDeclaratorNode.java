package com.cywriter.ast;

public record CNameDeclaratorNode(
    String name,            // Empty for anonymous declarators, e.g. in casts
    String cname,           // Can be null
    ExprNode defaultValue   // Can be null
) implements DeclaratorNode {
    public CNameDeclaratorNode(String name) {
        this(name, null, null);
    }

    @Override
    public String type() {
        return "CNameDeclaratorNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCNameDeclarator(this);
    }
}
