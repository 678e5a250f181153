package com.cywriter.ast;

/**
 * Statements, including declaration statements.
 */
public sealed interface StatNode extends Node permits
    StatListNode,
    PassStatNode,
    ExprStatNode,
    CDefExternNode,
    CVarDefNode,
    CStructOrUnionDefNode,
    CppClassNode,
    CEnumDefNode,
    CTypeDefNode,
    CClassDefNode,
    PyClassDefNode,
    DefNode,
    CFuncDefNode,
    CImportStatNode,
    FromCImportStatNode,
    ImportNode,
    FromImportStatNode,
    SingleAssignmentNode,
    CascadedAssignmentNode,
    InPlaceAssignmentNode,
    PrintStatNode,
    ForInStatNode,
    IfStatNode,
    WhileStatNode,
    WithStatNode,
    TryFinallyStatNode,
    TryExceptStatNode,
    ReturnStatNode,
    RaiseStatNode,
    ReraiseStatNode,
    BreakStatNode,
    ContinueStatNode,
    AssertStatNode,
    TempsBlockNode {
}
