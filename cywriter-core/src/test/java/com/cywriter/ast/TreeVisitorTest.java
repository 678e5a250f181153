package com.cywriter.ast;

import com.cywriter.UnhandledNodeException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TreeVisitorTest {

    /**
     * Records which method handled each node.
     */
    private static class Recorder implements TreeVisitor {
        final List<String> calls = new ArrayList<>();

        @Override
        public void visitStat(StatNode node) {
            calls.add("stat:" + node.type());
        }

        @Override
        public void visitExpr(ExprNode node) {
            calls.add("expr:" + node.type());
        }

        @Override
        public void visitName(NameNode node) {
            calls.add("name:" + node.name());
        }

        @Override
        public void visitCoercion(CoercionNode node) {
            calls.add("coercion:" + node.type());
        }
    }

    @Test
    void testExactKindWins() {
        Recorder recorder = new Recorder();
        new NameNode("x").accept(recorder);
        assertEquals(List.of("name:x"), recorder.calls);
    }

    @Test
    void testCategoryFallback() {
        Recorder recorder = new Recorder();
        new PassStatNode().accept(recorder);
        new BreakStatNode().accept(recorder);
        new IntNode("1").accept(recorder);
        new TupleNode().accept(recorder);
        new BinopNode("+", new NameNode("a"), new NameNode("b")).accept(recorder);
        new CoerceToTempNode(new NameNode("a")).accept(recorder);

        assertEquals(List.of(
            "stat:PassStatNode",
            "stat:BreakStatNode",
            "expr:IntNode",
            "expr:TupleNode",
            "expr:BinopNode",
            "coercion:CoerceToTempNode"
        ), recorder.calls);
    }

    @Test
    void testNoRuleFails() {
        Recorder recorder = new Recorder();
        CNameDeclaratorNode declarator = new CNameDeclaratorNode("x");

        UnhandledNodeException e = assertThrows(UnhandledNodeException.class, () -> declarator.accept(recorder));
        assertSame(declarator, e.getNode());
        assertTrue(e.getMessage().startsWith("Node not handled by serializer: CNameDeclaratorNode"), e.getMessage());
    }

    @Test
    void testTypeNamesMatchClassNames() {
        List<Node> nodes = List.of(
            new ModuleNode(new StatListNode()),
            new NullNode(),
            new TempRefNode(new TempHandle(0)),
            new CFuncDeclaratorNode(new CNameDeclaratorNode("f"), List.of()),
            new DictItemNode(new NameNode("k"), new NameNode("v")));
        for (Node node : nodes) {
            assertEquals(node.getClass().getSimpleName(), node.type());
        }
    }
}
