package com.cywriter.ast;

import java.util.List;

public record CFuncDeclaratorNode(
    DeclaratorNode base,
    List<CArgDeclNode> args,
    boolean hasVarargs,
    ExprNode exceptionValue,  // "except <value>", can be null
    boolean exceptionCheck,   // "except *" or "except? <value>"
    boolean nogil,
    boolean withGil
) implements DeclaratorNode {
    public CFuncDeclaratorNode {
        args = args == null ? List.of() : List.copyOf(args);
    }

    public CFuncDeclaratorNode(DeclaratorNode base, List<CArgDeclNode> args) {
        this(base, args, false, null, false, false, false);
    }

    @Override
    public ExprNode defaultValue() {
        return base.defaultValue();
    }

    @Override
    public String type() {
        return "CFuncDeclaratorNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCFuncDeclarator(this);
    }
}
