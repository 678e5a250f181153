package com.cywriter.ast;

import java.util.List;

public record FromImportStatNode(
    String moduleName,
    List<ImportedName> importedNames
) implements StatNode {
    public FromImportStatNode {
        importedNames = List.copyOf(importedNames);
    }

    @Override
    public String type() {
        return "FromImportStatNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitFromImportStat(this);
    }
}
