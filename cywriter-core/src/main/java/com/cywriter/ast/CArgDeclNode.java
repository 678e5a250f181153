package com.cywriter.ast;

public record CArgDeclNode(
    BaseTypeNode baseType,
    DeclaratorNode declarator,
    ExprNode defaultValue  // Can be null
) implements Node, HasDefaultValue {
    public CArgDeclNode(BaseTypeNode baseType, DeclaratorNode declarator) {
        this(baseType, declarator, null);
    }

    @Override
    public String type() {
        return "CArgDeclNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCArgDecl(this);
    }
}
