package com.cywriter.ast;

public record ImportNode(
    String moduleName,
    String asName  // Can be null
) implements StatNode {
    public ImportNode(String moduleName) {
        this(moduleName, null);
    }

    @Override
    public String type() {
        return "ImportNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitImport(this);
    }
}
