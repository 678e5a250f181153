package com.cywriter.ast;

public record CImportStatNode(
    String moduleName,
    String asName  // Can be null
) implements StatNode {
    @Override
    public String type() {
        return "CImportStatNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCImportStat(this);
    }
}
