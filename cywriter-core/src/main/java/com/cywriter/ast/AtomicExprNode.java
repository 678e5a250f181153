package com.cywriter.ast;

/**
 * Expressions that never need parentheses: names, literals and temporaries.
 */
public sealed interface AtomicExprNode extends ExprNode permits
    NameNode,
    IntNode,
    FloatNode,
    BoolNode,
    NoneNode,
    NullNode,
    StringNode,
    UnicodeNode,
    BytesNode,
    TempRefNode {
}
