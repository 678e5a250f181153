package com.cywriter;

import com.cywriter.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a whole code tree, statements and expressions included, as Cython source.
 *
 * <p>Compiler temporaries introduced by {@link TempsBlockNode} are named
 * {@code $<block>_<slot>}, where blocks are numbered in the order they are visited.</p>
 */
public class CodeWriter extends DeclarationWriter {
    private static final Logger log = LoggerFactory.getLogger(CodeWriter.class);

    private final Map<TempHandle, String> tempNames = new IdentityHashMap<>();
    private int tempBlockIndex = 0;

    public CodeWriter() {
        super();
    }

    public CodeWriter(LinesResult result) {
        super(result);
    }

    // ==================== Statements ====================

    @Override
    public void visitExprStat(ExprStatNode node) {
        startLine();
        visit(node.expr());
        endLine();
    }

    @Override
    public void visitSingleAssignment(SingleAssignmentNode node) {
        startLine();
        visit(node.lhs());
        put(" = ");
        visit(node.rhs());
        endLine();
    }

    @Override
    public void visitCascadedAssignment(CascadedAssignmentNode node) {
        startLine();
        for (ExprNode lhs : node.lhsList()) {
            visit(lhs);
            put(" = ");
        }
        visit(node.rhs());
        endLine();
    }

    @Override
    public void visitInPlaceAssignment(InPlaceAssignmentNode node) {
        startLine();
        visit(node.lhs());
        put(" " + node.operator() + "= ");
        visit(node.rhs());
        endLine();
    }

    @Override
    public void visitPrintStat(PrintStatNode node) {
        startLine("print");
        if (!node.args().isEmpty()) {
            put(" ");
            commaSeparatedList(node.args());
        }
        // "print," alone is not valid
        if (!node.appendNewline() && !node.args().isEmpty()) {
            put(",");
        }
        endLine();
    }

    @Override
    public void visitForInStat(ForInStatNode node) {
        startLine("for ");
        if (node.target() instanceof SequenceNode targets) {
            commaSeparatedList(targets.args());
        } else {
            visit(node.target());
        }
        put(" in ");
        visit(node.sequence());
        endLine(":");
        indented(node.body());
        if (node.elseClause() != null) {
            line("else:");
            indented(node.elseClause());
        }
    }

    @Override
    public void visitIfStat(IfStatNode node) {
        if (node.ifClauses().isEmpty()) {
            throw new UnsupportedConstructException(node, "if statement without clauses");
        }
        // The first clause is "if", the rest are "elif"
        startLine("if ");
        IfClauseNode first = node.ifClauses().get(0);
        visit(first.condition());
        endLine(":");
        indented(first.body());
        for (IfClauseNode clause : node.ifClauses().subList(1, node.ifClauses().size())) {
            startLine("elif ");
            visit(clause.condition());
            endLine(":");
            indented(clause.body());
        }
        if (node.elseClause() != null) {
            line("else:");
            indented(node.elseClause());
        }
    }

    @Override
    public void visitWhileStat(WhileStatNode node) {
        startLine("while ");
        visit(node.condition());
        endLine(":");
        indented(node.body());
        if (node.elseClause() != null) {
            line("else:");
            indented(node.elseClause());
        }
    }

    @Override
    public void visitWithStat(WithStatNode node) {
        startLine("with ");
        visit(node.manager());
        if (node.target() != null) {
            put(" as ");
            visit(node.target());
        }
        endLine(":");
        indented(node.body());
    }

    @Override
    public void visitTryFinallyStat(TryFinallyStatNode node) {
        line("try:");
        indented(node.body());
        line("finally:");
        indented(node.finallyClause());
    }

    @Override
    public void visitTryExceptStat(TryExceptStatNode node) {
        line("try:");
        indented(node.body());
        for (ExceptClauseNode clause : node.exceptClauses()) {
            visit(clause);
        }
        if (node.elseClause() != null) {
            line("else:");
            indented(node.elseClause());
        }
    }

    @Override
    public void visitExceptClause(ExceptClauseNode node) {
        startLine("except");
        if (node.pattern() != null) {
            put(" ");
            visit(node.pattern());
        }
        if (node.target() != null) {
            put(" as ");
            visit(node.target());
        }
        endLine(":");
        indented(node.body());
    }

    @Override
    public void visitReturnStat(ReturnStatNode node) {
        startLine("return");
        if (node.value() != null) {
            put(" ");
            visit(node.value());
        }
        endLine();
    }

    @Override
    public void visitRaiseStat(RaiseStatNode node) {
        startLine("raise ");
        visit(node.excType());
        if (node.excValue() != null) {
            put(", ");
            visit(node.excValue());
            if (node.excTb() != null) {
                put(", ");
                visit(node.excTb());
            }
        } else if (node.excTb() != null) {
            throw new UnsupportedConstructException(node, "traceback without exception value");
        }
        if (node.cause() != null) {
            put(" from ");
            visit(node.cause());
        }
        endLine();
    }

    @Override
    public void visitReraiseStat(ReraiseStatNode node) {
        line("raise");
    }

    @Override
    public void visitBreakStat(BreakStatNode node) {
        line("break");
    }

    @Override
    public void visitContinueStat(ContinueStatNode node) {
        line("continue");
    }

    @Override
    public void visitImport(ImportNode node) {
        startLine("import ");
        put(node.moduleName());
        if (node.asName() != null) {
            put(" as ");
            put(node.asName());
        }
        endLine();
    }

    @Override
    public void visitFromImportStat(FromImportStatNode node) {
        startLine("from ");
        put(node.moduleName());
        put(" import ");
        putImportedNames(node, node.importedNames());
        endLine();
    }

    @Override
    public void visitCFuncDef(CFuncDefNode node) {
        startFunctionHeader(node);
        for (String modifier : node.modifiers()) {
            put(modifier);
            put(" ");
        }
        putTypePrefix(node.baseType());
        visit(node.declarator());
        endLine(":");
        indented(node.body());
    }

    // ==================== Temporaries ====================

    @Override
    public void visitTempsBlock(TempsBlockNode node) {
        int block = tempBlockIndex++;
        List<TempHandle> temps = node.temps();
        for (int slot = 0; slot < temps.size(); slot++) {
            String name = "$" + block + "_" + slot;
            tempNames.put(temps.get(slot), name);
            log.trace("Allocated {} for {}", name, temps.get(slot));
        }
        visit(node.body());
    }

    @Override
    public void visitTempRef(TempRefNode node) {
        String name = tempNames.get(node.handle());
        if (name == null) {
            throw new UnsupportedConstructException(node, "reference to unallocated temporary " + node.handle());
        }
        put(name);
    }

    // ==================== Expressions ====================

    @Override
    public void visitCoercion(CoercionNode node) {
        visit(node.arg());
    }

    @Override
    public void visitPrimaryCmp(PrimaryCmpNode node) {
        if (node.comparisons().isEmpty()) {
            throw new UnsupportedConstructException(node, "comparison without operators");
        }
        visit(node.operand1());
        for (PrimaryCmpNode.Comparison comparison : node.comparisons()) {
            put(" " + comparison.operator() + " ");
            visit(comparison.operand());
        }
    }

    @Override
    public void visitBoolBinop(BoolBinopNode node) {
        visit(node.operand1());
        put(" " + node.operator() + " ");
        visit(node.operand2());
    }

    @Override
    public void visitIndex(IndexNode node) {
        visit(node.base());
        put("[");
        visit(node.index());
        put("]");
    }

    @Override
    public void visitSimpleCall(SimpleCallNode node) {
        ExprNode function = node.function();
        if (function instanceof AtomicExprNode || function instanceof SimpleCallNode
                || function instanceof AttributeNode) {
            visit(function);
        } else {
            put("(");
            visit(function);
            put(")");
        }
        put("(");
        if (node.args().isEmpty() && node.argTuple() != null) {
            commaSeparatedList(node.argTuple().args());
        } else {
            commaSeparatedList(node.args());
        }
        put(")");
    }

    @Override
    public void visitGeneralCall(GeneralCallNode node) {
        if (node.keywordArgs() != null || node.starstarArg() != null) {
            throw new UnsupportedConstructException(node, "keyword arguments");
        }
        visit(node.function());
        put("(");
        ExprNode args = node.positionalArgs();
        if (args instanceof TupleNode tuple) {
            commaSeparatedList(tuple.args());
        } else if (args instanceof AsTupleNode asTuple) {
            put("*");
            visit(asTuple.arg());
        } else {
            put("*");
            visit(args);
        }
        put(")");
    }

    @Override
    public void visitAsTuple(AsTupleNode node) {
        put("tuple(");
        visit(node.arg());
        put(")");
    }

    @Override
    public void visitDict(DictNode node) {
        put("{");
        commaSeparatedList(node.keyValuePairs());
        put("}");
    }

    @Override
    public void visitDictItem(DictItemNode node) {
        visit(node.key());
        put(": ");
        visit(node.value());
    }
}
