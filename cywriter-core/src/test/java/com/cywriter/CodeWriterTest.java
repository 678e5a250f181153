package com.cywriter;

import com.cywriter.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CodeWriterTest {

    private static List<String> write(Node tree) {
        return new CodeWriter().write(tree).lines();
    }

    private static NameNode name(String name) {
        return new NameNode(name);
    }

    private static IntNode intLit(String value) {
        return new IntNode(value);
    }

    private static StatNode expr(ExprNode expr) {
        return new ExprStatNode(expr);
    }

    private static CArgDeclNode arg(String type, String name) {
        return new CArgDeclNode(CSimpleBaseTypeNode.basic(type, 1, 0), new CNameDeclaratorNode(name));
    }

    @Test
    void testEmptyStatList() {
        assertEquals(List.of("pass"), write(new StatListNode(List.of())));
    }

    @Test
    void testForLoopWithEmptyBody() {
        Node tree = new ForInStatNode(name("x"), name("xs"), new StatListNode(List.of()));
        assertEquals(List.of("for x in xs:", "    pass"), write(tree));
    }

    @Test
    void testCascadedAssignment() {
        Node tree = new CascadedAssignmentNode(List.of(name("a"), name("b")), intLit("1"));
        assertEquals(List.of("a = b = 1"), write(tree));
    }

    @Test
    void testGeneralCallWithKeywordsIsUnsupported() {
        GeneralCallNode call = new GeneralCallNode(name("f"), new TupleNode(name("a")),
            new DictNode(List.of(new DictItemNode(new StringNode("k"), intLit("1")))), null);
        CodeWriter writer = new CodeWriter();

        UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
            () -> writer.write(expr(call)));
        assertSame(call, e.getNode());
        assertEquals("keyword arguments", e.getConstruct());
        assertEquals("", writer.result.pending().trim());
    }

    @Test
    void testStarStarArgIsUnsupported() {
        Node tree = expr(new GeneralCallNode(name("f"), new TupleNode(), null, name("kw")));
        assertThrows(UnsupportedConstructException.class, () -> write(tree));
    }

    @Test
    void testAssignments() {
        Node tree = new StatListNode(
            new SingleAssignmentNode(name("a"), intLit("1")),
            new InPlaceAssignmentNode(name("a"), "+", intLit("1")),
            new InPlaceAssignmentNode(new IndexNode(name("buf"), intLit("0")), "<<", intLit("2")),
            new SingleAssignmentNode(new AttributeNode(name("self"), "n"), new FloatNode("1e-3")));

        assertEquals(List.of(
            "a = 1",
            "a += 1",
            "buf[0] <<= 2",
            "self.n = 1e-3"
        ), write(tree));
    }

    @Test
    void testPrint() {
        Node tree = new StatListNode(
            new PrintStatNode(List.of(name("a"), name("b")), true),
            new PrintStatNode(List.of(name("a"), name("b")), false),
            new PrintStatNode(List.of(), true),
            new PrintStatNode(List.of(), false));

        assertEquals(List.of("print a, b", "print a, b,", "print", "print"), write(tree));
    }

    @Test
    void testControlFlow() {
        Node tree = new StatListNode(
            new IfStatNode(
                List.of(
                    new IfClauseNode(new PrimaryCmpNode(name("a"), "<", intLit("10")),
                        new StatListNode(new PrintStatNode(List.of(name("a")), true))),
                    new IfClauseNode(new BoolBinopNode("and", name("x"), name("y")),
                        new StatListNode(new PassStatNode()))),
                new StatListNode(new ReturnStatNode(null))),
            new WhileStatNode(name("running"),
                new StatListNode(new BreakStatNode()),
                new StatListNode(new ContinueStatNode())),
            new ForInStatNode(new TupleNode(name("k"), name("v")), name("pairs"),
                new StatListNode(new ReturnStatNode(name("v"))),
                new StatListNode()));

        assertEquals(List.of(
            "if a < 10:",
            "    print a",
            "elif x and y:",
            "    pass",
            "else:",
            "    return",
            "while running:",
            "    break",
            "else:",
            "    continue",
            "for k, v in pairs:",
            "    return v",
            "else:",
            "    pass"
        ), write(tree));
    }

    @Test
    void testIfWithoutClausesIsUnsupported() {
        assertThrows(UnsupportedConstructException.class,
            () -> write(new IfStatNode(List.of(), null)));
    }

    @Test
    void testNestedIndentation() {
        Node tree = new DefNode("f", List.of(), new StatListNode(
            new WithStatNode(name("lock"), null, new StatListNode(
                new IfStatNode(List.of(new IfClauseNode(name("x"), new StatListNode(
                    new ReturnStatNode(intLit("1"))))), null))),
            new ReturnStatNode(intLit("0"))));

        assertEquals(List.of(
            "def f():",
            "    with lock:",
            "        if x:",
            "            return 1",
            "    return 0"
        ), write(tree));
    }

    @Test
    void testExceptionHandling() {
        Node tree = new StatListNode(
            new TryExceptStatNode(
                new StatListNode(expr(new SimpleCallNode(name("work"), List.of()))),
                List.of(
                    new ExceptClauseNode(name("ValueError"), name("e"),
                        new StatListNode(new RaiseStatNode(name("RuntimeError"), name("e"), null, null))),
                    new ExceptClauseNode(null, null, new StatListNode(new ReraiseStatNode()))),
                new StatListNode(new PassStatNode())),
            new TryFinallyStatNode(
                new StatListNode(new RaiseStatNode(name("E"), null, null, name("cause"))),
                new StatListNode(expr(new SimpleCallNode(new AttributeNode(name("f"), "close"), List.of())))),
            new WithStatNode(new SimpleCallNode(name("open"), List.of(new StringNode("p"))), name("fh"),
                new StatListNode(new RaiseStatNode(name("E"), name("v"), name("tb"), null))));

        assertEquals(List.of(
            "try:",
            "    work()",
            "except ValueError as e:",
            "    raise RuntimeError, e",
            "except:",
            "    raise",
            "else:",
            "    pass",
            "try:",
            "    raise E from cause",
            "finally:",
            "    f.close()",
            "with open('p') as fh:",
            "    raise E, v, tb"
        ), write(tree));
    }

    @Test
    void testImports() {
        Node tree = new StatListNode(
            new ImportNode("os"),
            new ImportNode("numpy", "np"),
            new FromImportStatNode("collections", List.of(
                new ImportedName("OrderedDict", "OD"), new ImportedName("deque"))));

        assertEquals(List.of(
            "import os",
            "import numpy as np",
            "from collections import OrderedDict as OD, deque"
        ), write(tree));
    }

    @Test
    void testCalls() {
        Node tree = new StatListNode(
            expr(new SimpleCallNode(name("f"), List.of(name("a"), name("b")))),
            expr(new SimpleCallNode(new SimpleCallNode(name("g"), List.of()), List.of(intLit("1")))),
            expr(new SimpleCallNode(new BinopNode("or", name("a"), name("b")), List.of())),
            expr(new SimpleCallNode(name("h"), List.of(), new TupleNode(name("x"), name("y")))),
            expr(new SimpleCallNode(name("h"), List.of(), new TupleNode())),
            expr(new GeneralCallNode(name("f"), new TupleNode(name("a"), name("b")))),
            expr(new GeneralCallNode(name("f"), new AsTupleNode(name("args")))),
            expr(new GeneralCallNode(name("f"), name("seq"))));

        assertEquals(List.of(
            "f(a, b)",
            "g()(1)",
            "(a or b)()",
            "h(x, y)",
            "h()",
            "f(a, b)",
            "f(*args)",
            "f(*seq)"
        ), write(tree));
    }

    @Test
    void testExpressions() {
        Node tree = new StatListNode(
            expr(new PrimaryCmpNode(name("a"), List.of(
                new PrimaryCmpNode.Comparison("<", name("b")),
                new PrimaryCmpNode.Comparison("<=", name("c"))))),
            expr(new PrimaryCmpNode(name("x"), "is not", new NoneNode())),
            expr(new BoolBinopNode("or", new NotNode(name("a")), name("b"))),
            expr(new IndexNode(new AttributeNode(name("obj"), "items"), new UnicodeNode("key"))),
            expr(new DictNode(List.of(
                new DictItemNode(new StringNode("a"), intLit("1")),
                new DictItemNode(new BytesNode(new byte[]{'b'}), new ListNode())))),
            expr(new DictNode(List.of())),
            expr(new AsTupleNode(name("xs"))));

        assertEquals(List.of(
            "a < b <= c",
            "x is not None",
            "(not a) or b",
            "obj.items[u'key']",
            "{'a': 1, b'b': []}",
            "{}",
            "tuple(xs)"
        ), write(tree));
    }

    @Test
    void testComparisonWithoutOperatorsIsUnsupported() {
        assertThrows(UnsupportedConstructException.class,
            () -> write(expr(new PrimaryCmpNode(name("a"), List.of()))));
    }

    @Test
    void testCoercionsAreTransparent() {
        Node tree = new StatListNode(
            new SingleAssignmentNode(name("r"), new CoerceToPyTypeNode(new CoerceFromPyTypeNode(name("x")))),
            new IfStatNode(List.of(new IfClauseNode(new CoerceToBooleanNode(name("flag")),
                new StatListNode(expr(new CoerceToTempNode(new SimpleCallNode(name("f"), List.of())))))), null));

        assertEquals(List.of("r = x", "if flag:", "    f()"), write(tree));
    }

    @Test
    void testTemporaries() {
        TempHandle first = new TempHandle(1);
        TempHandle second = new TempHandle(2, "PyObject *");
        TempHandle inner = new TempHandle(3);
        TempHandle later = new TempHandle(4);

        Node tree = new StatListNode(
            new TempsBlockNode(List.of(first, second), new StatListNode(
                new SingleAssignmentNode(new TempRefNode(first), new TempRefNode(second)),
                new TempsBlockNode(List.of(inner), new StatListNode(
                    new SingleAssignmentNode(new TempRefNode(inner), new TempRefNode(first)))))),
            new TempsBlockNode(List.of(later), new StatListNode(
                expr(new TempRefNode(later)))));

        assertEquals(List.of(
            "$0_0 = $0_1",
            "$1_0 = $0_0",
            "$2_0"
        ), write(tree));
    }

    @Test
    void testTemporaryHandlesCompareByIdentity() {
        TempHandle allocated = new TempHandle(7);
        TempHandle sameId = new TempHandle(7);
        Node tree = new TempsBlockNode(List.of(allocated), new StatListNode(
            expr(new TempRefNode(allocated)),
            expr(new TempRefNode(sameId))));

        UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class, () -> write(tree));
        assertInstanceOf(TempRefNode.class, e.getNode());
    }

    @Test
    void testCFunctionDefinition() {
        CFuncDeclaratorNode add = new CFuncDeclaratorNode(new CNameDeclaratorNode("add"),
            List.of(arg("int", "a"), arg("int", "b")));
        Node tree = new StatListNode(
            new CFuncDefNode("private", true, false, List.of("inline"), CSimpleBaseTypeNode.basic("int", 1, 0), add,
                new StatListNode(new ReturnStatNode(new BinopNode("+", name("a"), name("b"))))),
            new CFuncDefNode("public", false, true, List.of(), CSimpleBaseTypeNode.basic("void", 1, 0),
                new CFuncDeclaratorNode(new CNameDeclaratorNode("reset"), List.of()),
                new StatListNode()));

        assertEquals(List.of(
            "cpdef inline int add(int a, int b):",
            "    return a + b",
            "cdef public api void reset():",
            "    pass"
        ), write(tree));
    }

    @Test
    void testIndentationIsBalanced() {
        Node tree = new ModuleNode(new StatListNode(
            new CClassDefNode("Box", null, new StatListNode(
                new CVarDefNode(CSimpleBaseTypeNode.basic("int", 1, 0), List.of(new CNameDeclaratorNode("n"))),
                new DefNode("get", List.of(), new StatListNode(
                    new TryFinallyStatNode(
                        new StatListNode(new ForInStatNode(name("i"), name("xs"),
                            new StatListNode(new WhileStatNode(name("c"), new StatListNode(), null)))),
                        new StatListNode(new ReturnStatNode(name("n")))))))),
            new CStructOrUnionDefNode("s", "struct", List.of())));

        int[] visited = {0};
        CodeWriter writer = new CodeWriter() {
            @Override
            protected void visit(Node node) {
                int before = indentLevel();
                super.visit(node);
                assertEquals(before, indentLevel(), () -> "indentation changed by " + node.type());
                visited[0]++;
            }
        };
        writer.write(tree);

        assertEquals(0, writer.indentLevel());
        assertEquals("", writer.result.pending());
        assertTrue(visited[0] > 10);
    }

    @Test
    void testDeclarationsAreWrittenToo() {
        Node tree = new StatListNode(
            new CImportStatNode("cython", null),
            new CVarDefNode(CSimpleBaseTypeNode.basic("int", 1, 0),
                List.of(new CNameDeclaratorNode("n", null, intLit("0")))),
            new SingleAssignmentNode(name("n"), intLit("1")));

        assertEquals(List.of("cimport cython", "cdef int n = 0", "n = 1"), write(tree));
    }
}
