package com.cywriter.ast;

import java.util.List;

public record CSimpleBaseTypeNode(
    String name,              // Null when the type is omitted, e.g. "def f(x)"
    List<String> modulePath,
    boolean isBasicCType,
    int signed,               // 0 = unsigned, 1 = unspecified, 2 = signed
    int longness,             // < 0 short, > 0 long; magnitude is the repeat count
    boolean isSelfArg
) implements BaseTypeNode {
    public CSimpleBaseTypeNode {
        modulePath = modulePath == null ? List.of() : List.copyOf(modulePath);
    }

    public CSimpleBaseTypeNode(String name) {
        this(name, List.of(), false, 1, 0, false);
    }

    public static CSimpleBaseTypeNode basic(String name, int signed, int longness) {
        return new CSimpleBaseTypeNode(name, List.of(), true, signed, longness, false);
    }

    @Override
    public String type() {
        return "CSimpleBaseTypeNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitCSimpleBaseType(this);
    }
}
