package com.cywriter.ast;

import java.util.List;

public record CEnumDefNode(
    String name,         // Can be null for anonymous enums
    String cname,        // Can be null
    boolean typedefFlag,
    String visibility,
    List<CEnumDefItemNode> items
) implements StatNode {
    public CEnumDefNode {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public CEnumDefNode(String name, List<CEnumDefItemNode> items) {
        this(name, null, false, "private", items);
    }

    @Override
    public String type() {
        return "CEnumDefNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCEnumDef(this);
    }
}
