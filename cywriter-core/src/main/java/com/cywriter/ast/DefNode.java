package com.cywriter.ast;

import java.util.List;

/**
 * Python function definition ({@code def}).
 */
public record DefNode(
    String name,
    List<CArgDeclNode> args,
    String starArg,       // Name of the *args parameter, can be null
    String starstarArg,   // Name of the **kwargs parameter, can be null
    List<DecoratorNode> decorators,
    StatNode body
) implements StatNode {
    public DefNode {
        args = args == null ? List.of() : List.copyOf(args);
        decorators = decorators == null ? List.of() : List.copyOf(decorators);
    }

    public DefNode(String name, List<CArgDeclNode> args, StatNode body) {
        this(name, args, null, null, List.of(), body);
    }

    @Override
    public String type() {
        return "DefNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitDef(this);
    }
}
