package com.cywriter.ast;

public sealed interface ExprNode extends Node permits
    AtomicExprNode,
    CoercionNode,
    SequenceNode,
    NotNode,
    BinopNode,
    BoolBinopNode,
    PrimaryCmpNode,
    IndexNode,
    AttributeNode,
    SimpleCallNode,
    GeneralCallNode,
    AsTupleNode,
    DictNode {
}
