package com.cywriter.ast;

import java.util.List;

public record CppClassNode(
    String name,
    String cname,                // Can be null
    List<String> templates,
    List<String> baseClasses,
    List<StatNode> attributes
) implements StatNode {
    public CppClassNode {
        templates = templates == null ? List.of() : List.copyOf(templates);
        baseClasses = baseClasses == null ? List.of() : List.copyOf(baseClasses);
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    @Override
    public String type() {
        return "CppClassNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCppClass(this);
    }
}
