package com.cywriter.ast;

import java.util.List;

public record CStructOrUnionDefNode(
    String name,         // Can be null for anonymous structs
    String cname,        // Can be null
    String kind,         // "struct" or "union"
    boolean typedefFlag,
    String visibility,   // "private", "public" or "extern"
    boolean packed,
    List<StatNode> attributes
) implements StatNode {
    public CStructOrUnionDefNode {
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    public CStructOrUnionDefNode(String name, String kind, List<StatNode> attributes) {
        this(name, null, kind, false, "private", false, attributes);
    }

    @Override
    public String type() {
        return "CStructOrUnionDefNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCStructOrUnionDef(this);
    }
}
