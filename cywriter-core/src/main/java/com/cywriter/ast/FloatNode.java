package com.cywriter.ast;

public record FloatNode(
    String value  // Literal text as written, e.g. "1e-3"
) implements AtomicExprNode {
    @Override
    public String type() {
        return "FloatNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitFloat(this);
    }
}
