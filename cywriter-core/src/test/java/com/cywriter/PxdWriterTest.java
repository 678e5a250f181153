package com.cywriter;

import com.cywriter.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PxdWriterTest {

    private static CSimpleBaseTypeNode cType(String name) {
        return CSimpleBaseTypeNode.basic(name, 1, 0);
    }

    private static CFuncDeclaratorNode signature(String name, CArgDeclNode... args) {
        return new CFuncDeclaratorNode(new CNameDeclaratorNode(name), List.of(args));
    }

    private static StatNode body() {
        return new StatListNode(new ReturnStatNode(new IntNode("0")));
    }

    @Test
    void testFunctionSignaturesWithoutBodies() {
        CArgDeclNode x = new CArgDeclNode(cType("int"), new CNameDeclaratorNode("x"));
        Node tree = new StatListNode(
            new CFuncDefNode(cType("int"), signature("plain", x), body()),
            new CFuncDefNode("public", true, true, List.of(), cType("double"), signature("exported"), body()),
            new CFuncDefNode("private", false, false, List.of(), cType("char"),
                new CPtrDeclaratorNode(signature("name")), body()));

        assertEquals(List.of(
            "cdef int plain(int x)",
            "cpdef public api double exported()",
            "cdef char *name()"
        ), CyWriter.writeDeclarations(tree));
    }

    @Test
    void testInlineFunctionsAreSkipped() {
        Node tree = new StatListNode(
            new CFuncDefNode("private", false, false, List.of("inline"), cType("int"), signature("fast"), body()),
            new CFuncDefNode(cType("int"), signature("slow"), body()));

        assertEquals(List.of("cdef int slow()"), CyWriter.writeDeclarations(tree));
    }

    @Test
    void testStatementsProduceNothing() {
        Node tree = new ModuleNode(new StatListNode(
            new CImportStatNode("cython", null),
            new SingleAssignmentNode(new NameNode("a"), new IntNode("1")),
            new ExprStatNode(new SimpleCallNode(new NameNode("f"), List.of())),
            new ForInStatNode(new NameNode("x"), new NameNode("xs"), new StatListNode()),
            new TempsBlockNode(List.of(new TempHandle(1)), new StatListNode()),
            new CVarDefNode(cType("int"), List.of(new CNameDeclaratorNode("n")))));

        assertEquals(List.of("cimport cython", "cdef int n"), CyWriter.writeDeclarations(tree));
    }

    @Test
    void testClassBodiesKeepDeclarations() {
        Node tree = new CClassDefNode("Box", null, new StatListNode(
            new CVarDefNode(cType("int"), List.of(new CNameDeclaratorNode("n"))),
            new CFuncDefNode(cType("int"), signature("size"), body())));

        assertEquals(List.of(
            "cdef class Box:",
            "    cdef int n",
            "    cdef int size()"
        ), CyWriter.writeDeclarations(tree));
    }

    @Test
    void testBlocksEmptiedByFilteringGetPass() {
        CFuncDefNode inline = new CFuncDefNode("private", false, false, List.of("inline"),
            cType("int"), signature("fast"), body());
        Node tree = new StatListNode(
            new CClassDefNode("Box", null, new StatListNode(inline)),
            new CDefExternNode("h.h", new StatListNode(
                new ExprStatNode(new SimpleCallNode(new NameNode("f"), List.of())))),
            new CClassDefNode("Kept", null, new StatListNode(
                new CVarDefNode(cType("int"), List.of(new CNameDeclaratorNode("n"))))));

        assertEquals(List.of(
            "cdef class Box:",
            "    pass",
            "cdef extern from \"h.h\":",
            "    pass",
            "cdef class Kept:",
            "    cdef int n"
        ), CyWriter.writeDeclarations(tree));
    }

    @Test
    void testEmptyStructStillHasPass() {
        Node tree = new CStructOrUnionDefNode("s", "struct", List.of());
        assertEquals(List.of("cdef struct s:", "    pass"), CyWriter.writeDeclarations(tree));
    }

    @Test
    void testCodeWriterKeepsBodies() {
        Node tree = new CFuncDefNode(cType("int"), signature("f"), body());
        assertEquals(List.of("cdef int f():", "    return 0"), CyWriter.writeCode(tree));
    }
}
