package com.cywriter.ast;

/**
 * C declarators. Wrapper declarators (pointer, reference, array, function) compose around a
 * base declarator; the innermost one is always a {@link CNameDeclaratorNode}.
 */
public sealed interface DeclaratorNode extends Node, HasDefaultValue permits
    CNameDeclaratorNode,
    CPtrDeclaratorNode,
    CReferenceDeclaratorNode,
    CArrayDeclaratorNode,
    CFuncDeclaratorNode {
}
