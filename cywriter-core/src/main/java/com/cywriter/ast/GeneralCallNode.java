package com.cywriter.ast;

/**
 * Call whose positional arguments are a tuple expression, optionally with keyword and
 * {@code **} arguments.
 */
public record GeneralCallNode(
    ExprNode function,
    ExprNode positionalArgs,  // TupleNode, or AsTupleNode for f(*seq)
    ExprNode keywordArgs,     // Can be null
    ExprNode starstarArg      // Can be null
) implements ExprNode {
    public GeneralCallNode(ExprNode function, ExprNode positionalArgs) {
        this(function, positionalArgs, null, null);
    }

    @Override
    public String type() {
        return "GeneralCallNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitGeneralCall(this);
    }
}
