package com.cywriter.ast;

/**
 * Conversion wrappers inserted by the front end. They have no syntax of their own.
 */
public sealed interface CoercionNode extends ExprNode permits
    CoerceToBooleanNode,
    CoerceToTempNode,
    CoerceToPyTypeNode,
    CoerceFromPyTypeNode {

    ExprNode arg();
}
