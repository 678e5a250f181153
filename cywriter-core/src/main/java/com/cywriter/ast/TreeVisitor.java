package com.cywriter.ast;

import com.cywriter.UnhandledNodeException;

/**
 * Visitor over the code tree with one method per concrete node kind.
 *
 * <p>Every kind method falls back to the method of its category ({@link #visitStat},
 * {@link #visitAtomicExpr}, {@link #visitCoercion}, {@link #visitSequence}, {@link #visitExpr},
 * {@link #visitDeclarator}, {@link #visitBaseType}), and every category falls back to
 * {@link #visitNode}. Implementations override the most general method that renders a group
 * of kinds the same way. A node that reaches {@link #visitNode} has no rule at any level and
 * fails with {@link UnhandledNodeException}.</p>
 */
public interface TreeVisitor {

    default void visitNode(Node node) {
        throw new UnhandledNodeException(node);
    }

    // ==================== Categories ====================

    default void visitStat(StatNode node) {
        visitNode(node);
    }

    default void visitExpr(ExprNode node) {
        visitNode(node);
    }

    default void visitAtomicExpr(AtomicExprNode node) {
        visitExpr(node);
    }

    default void visitCoercion(CoercionNode node) {
        visitExpr(node);
    }

    default void visitSequence(SequenceNode node) {
        visitExpr(node);
    }

    default void visitDeclarator(DeclaratorNode node) {
        visitNode(node);
    }

    default void visitBaseType(BaseTypeNode node) {
        visitNode(node);
    }

    // ==================== Structure ====================

    default void visitModule(ModuleNode node) {
        visitNode(node);
    }

    default void visitCArgDecl(CArgDeclNode node) {
        visitNode(node);
    }

    default void visitCEnumDefItem(CEnumDefItemNode node) {
        visitNode(node);
    }

    default void visitIfClause(IfClauseNode node) {
        visitNode(node);
    }

    default void visitExceptClause(ExceptClauseNode node) {
        visitNode(node);
    }

    default void visitDecorator(DecoratorNode node) {
        visitNode(node);
    }

    default void visitDictItem(DictItemNode node) {
        visitNode(node);
    }

    // ==================== Statements ====================

    default void visitStatList(StatListNode node) {
        visitStat(node);
    }

    default void visitPassStat(PassStatNode node) {
        visitStat(node);
    }

    default void visitExprStat(ExprStatNode node) {
        visitStat(node);
    }

    default void visitCDefExtern(CDefExternNode node) {
        visitStat(node);
    }

    default void visitCVarDef(CVarDefNode node) {
        visitStat(node);
    }

    default void visitCStructOrUnionDef(CStructOrUnionDefNode node) {
        visitStat(node);
    }

    default void visitCppClass(CppClassNode node) {
        visitStat(node);
    }

    default void visitCEnumDef(CEnumDefNode node) {
        visitStat(node);
    }

    default void visitCTypeDef(CTypeDefNode node) {
        visitStat(node);
    }

    default void visitCClassDef(CClassDefNode node) {
        visitStat(node);
    }

    default void visitPyClassDef(PyClassDefNode node) {
        visitStat(node);
    }

    default void visitDef(DefNode node) {
        visitStat(node);
    }

    default void visitCFuncDef(CFuncDefNode node) {
        visitStat(node);
    }

    default void visitCImportStat(CImportStatNode node) {
        visitStat(node);
    }

    default void visitFromCImportStat(FromCImportStatNode node) {
        visitStat(node);
    }

    default void visitImport(ImportNode node) {
        visitStat(node);
    }

    default void visitFromImportStat(FromImportStatNode node) {
        visitStat(node);
    }

    default void visitSingleAssignment(SingleAssignmentNode node) {
        visitStat(node);
    }

    default void visitCascadedAssignment(CascadedAssignmentNode node) {
        visitStat(node);
    }

    default void visitInPlaceAssignment(InPlaceAssignmentNode node) {
        visitStat(node);
    }

    default void visitPrintStat(PrintStatNode node) {
        visitStat(node);
    }

    default void visitForInStat(ForInStatNode node) {
        visitStat(node);
    }

    default void visitIfStat(IfStatNode node) {
        visitStat(node);
    }

    default void visitWhileStat(WhileStatNode node) {
        visitStat(node);
    }

    default void visitWithStat(WithStatNode node) {
        visitStat(node);
    }

    default void visitTryFinallyStat(TryFinallyStatNode node) {
        visitStat(node);
    }

    default void visitTryExceptStat(TryExceptStatNode node) {
        visitStat(node);
    }

    default void visitReturnStat(ReturnStatNode node) {
        visitStat(node);
    }

    default void visitRaiseStat(RaiseStatNode node) {
        visitStat(node);
    }

    default void visitReraiseStat(ReraiseStatNode node) {
        visitStat(node);
    }

    default void visitBreakStat(BreakStatNode node) {
        visitStat(node);
    }

    default void visitContinueStat(ContinueStatNode node) {
        visitStat(node);
    }

    default void visitAssertStat(AssertStatNode node) {
        visitStat(node);
    }

    default void visitTempsBlock(TempsBlockNode node) {
        visitStat(node);
    }

    // ==================== Declarators ====================

    default void visitCNameDeclarator(CNameDeclaratorNode node) {
        visitDeclarator(node);
    }

    default void visitCPtrDeclarator(CPtrDeclaratorNode node) {
        visitDeclarator(node);
    }

    default void visitCReferenceDeclarator(CReferenceDeclaratorNode node) {
        visitDeclarator(node);
    }

    default void visitCArrayDeclarator(CArrayDeclaratorNode node) {
        visitDeclarator(node);
    }

    default void visitCFuncDeclarator(CFuncDeclaratorNode node) {
        visitDeclarator(node);
    }

    // ==================== Base types ====================

    default void visitCSimpleBaseType(CSimpleBaseTypeNode node) {
        visitBaseType(node);
    }

    default void visitCComplexBaseType(CComplexBaseTypeNode node) {
        visitBaseType(node);
    }

    default void visitCNestedBaseType(CNestedBaseTypeNode node) {
        visitBaseType(node);
    }

    default void visitTemplatedType(TemplatedTypeNode node) {
        visitBaseType(node);
    }

    // ==================== Atomic expressions ====================

    default void visitName(NameNode node) {
        visitAtomicExpr(node);
    }

    default void visitInt(IntNode node) {
        visitAtomicExpr(node);
    }

    default void visitFloat(FloatNode node) {
        visitAtomicExpr(node);
    }

    default void visitBool(BoolNode node) {
        visitAtomicExpr(node);
    }

    default void visitNone(NoneNode node) {
        visitAtomicExpr(node);
    }

    default void visitNull(NullNode node) {
        visitAtomicExpr(node);
    }

    default void visitString(StringNode node) {
        visitAtomicExpr(node);
    }

    default void visitUnicode(UnicodeNode node) {
        visitAtomicExpr(node);
    }

    default void visitBytes(BytesNode node) {
        visitAtomicExpr(node);
    }

    default void visitTempRef(TempRefNode node) {
        visitAtomicExpr(node);
    }

    // ==================== Coercions ====================

    default void visitCoerceToBoolean(CoerceToBooleanNode node) {
        visitCoercion(node);
    }

    default void visitCoerceToTemp(CoerceToTempNode node) {
        visitCoercion(node);
    }

    default void visitCoerceToPyType(CoerceToPyTypeNode node) {
        visitCoercion(node);
    }

    default void visitCoerceFromPyType(CoerceFromPyTypeNode node) {
        visitCoercion(node);
    }

    // ==================== Sequences ====================

    default void visitTuple(TupleNode node) {
        visitSequence(node);
    }

    default void visitList(ListNode node) {
        visitSequence(node);
    }

    // ==================== Other expressions ====================

    default void visitNot(NotNode node) {
        visitExpr(node);
    }

    default void visitBinop(BinopNode node) {
        visitExpr(node);
    }

    default void visitBoolBinop(BoolBinopNode node) {
        visitExpr(node);
    }

    default void visitPrimaryCmp(PrimaryCmpNode node) {
        visitExpr(node);
    }

    default void visitIndex(IndexNode node) {
        visitExpr(node);
    }

    default void visitAttribute(AttributeNode node) {
        visitExpr(node);
    }

    default void visitSimpleCall(SimpleCallNode node) {
        visitExpr(node);
    }

    default void visitGeneralCall(GeneralCallNode node) {
        visitExpr(node);
    }

    default void visitAsTuple(AsTupleNode node) {
        visitExpr(node);
    }

    default void visitDict(DictNode node) {
        visitExpr(node);
    }
}
