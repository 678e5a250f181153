package com.cywriter.ast;

import java.util.List;

public record FromCImportStatNode(
    String moduleName,
    List<ImportedName> importedNames
) implements StatNode {
    public FromCImportStatNode {
        importedNames = List.copyOf(importedNames);
    }

    @Override
    public String type() {
        return "FromCImportStatNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitFromCImportStat(this);
    }
}
