package com.cywriter.ast;

public record UnicodeNode(
    String value
) implements AtomicExprNode {
    @Override
    public String type() {
        return "UnicodeNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitUnicode(this);
    }
}
