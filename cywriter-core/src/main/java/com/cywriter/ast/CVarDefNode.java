package com.cywriter.ast;

import java.util.List;

public record CVarDefNode(
    BaseTypeNode baseType,
    List<DeclaratorNode> declarators
) implements StatNode {
    public CVarDefNode {
        declarators = List.copyOf(declarators);
    }

    @Override
    public String type() {
        return "CVarDefNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCVarDef(this);
    }
}
