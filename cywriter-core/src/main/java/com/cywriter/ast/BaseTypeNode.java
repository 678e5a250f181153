package com.cywriter.ast;

public sealed interface BaseTypeNode extends Node permits
    CSimpleBaseTypeNode,
    CComplexBaseTypeNode,
    CNestedBaseTypeNode,
    TemplatedTypeNode {
}
