package com.cywriter.ast;

public record DecoratorNode(
    ExprNode decorator
) implements Node {
    @Override
    public String type() {
        return "DecoratorNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitDecorator(this);
    }
}
