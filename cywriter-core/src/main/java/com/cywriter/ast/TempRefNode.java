package com.cywriter.ast;

/**
 * Use of a temporary allocated by an enclosing {@link TempsBlockNode}.
 */
public record TempRefNode(
    TempHandle handle
) implements AtomicExprNode {
    @Override
    public String type() {
        return "TempRefNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitTempRef(this);
    }
}
