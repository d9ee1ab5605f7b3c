package com.asmblr.dag.node;

import org.junit.Test;

import com.asmblr.dag.NodeFixtures.Counting;
import com.asmblr.dag.value.Values;

import static com.asmblr.dag.NodeFixtures.*;
import static org.junit.Assert.*;

public class InvalidationTest {

    @Test
    public void testCleanGraphClearsUpstreamCaches() {
        ExpressionNode c = constant("c", 2);
        ExpressionNode add = add("add");
        Connection.from(c, add, "a");
        add.inputSocket("b").set(1);
        add.evaluate();

        add.cleanGraph();
        assertFalse(add.isEvaluated());
        assertFalse(c.isEvaluated());
        assertTrue(add.outputs().isEmpty());
        assertTrue(add.resolvedInputs().isEmpty());
    }

    @Test
    public void testReevaluationSeesNewValues() {
        ExpressionNode c = constant("c", 2);
        ExpressionNode add = add("add");
        Connection.from(c, add, "a");
        add.inputSocket("b").set(1);
        assertEquals(3.0, Values.asDouble(add.evaluate().get("out")), 0.0);

        c.inputSocket("value").set(40);
        assertEquals("stale until invalidated", 3.0, Values.asDouble(add.evaluate().get("out")), 0.0);

        add.cleanGraph();
        assertEquals(41.0, Values.asDouble(add.evaluate().get("out")), 0.0);
    }

    @Test
    public void testDownstreamIsNotInvalidated() {
        ExpressionNode c = constant("c", 2);
        ExpressionNode add = add("add");
        Connection.from(c, add, "a");
        add.inputSocket("b").set(1);
        add.evaluate();

        c.cleanGraph();
        assertFalse(c.isEvaluated());
        assertTrue(add.isEvaluated());
    }

    @Test
    public void testSharedNodeInvalidatedOnce() {
        Counting srcFn = new Counting(CONST_FN);
        ExpressionNode src = new ExpressionNode("src", CONST, srcFn);
        src.inputSocket("value").set(1);
        ExpressionNode top = add("top");
        Connection.from(src, top, "a");
        Connection.from(src, top, "b");

        top.evaluate();
        top.cleanGraph();
        top.evaluate();
        assertEquals(2, srcFn.calls());
    }

    @Test
    public void testCleanGraphOnNeverEvaluatedNodeIsNoOp() {
        ExpressionNode add = add("add");
        add.cleanGraph();
        assertFalse(add.isEvaluated());
    }

    @Test
    public void testCleanGraphTerminatesOnCycle() {
        ExpressionNode a = add("a");
        ExpressionNode b = add("b");
        new Connection(a, "out", b, "a");
        new Connection(b, "out", a, "a");
        try {
            a.evaluate();
        } catch (RuntimeException expected) {
            // cycle
        }
        a.cleanGraph();
        assertFalse(a.isEvaluated());
        assertFalse(b.isEvaluated());
    }

    @Test
    public void testDiamondIsFullyInvalidatedAndRebuiltOnce() {
        // a feeds b and c, which both feed d
        Counting aFn = new Counting(CONST_FN);
        ExpressionNode a = new ExpressionNode("a", CONST, aFn);
        a.inputSocket("value").set(1);
        ExpressionNode b = add("b");
        b.inputSocket("b").set(10);
        Connection.from(a, b, "a");
        ExpressionNode c = add("c");
        c.inputSocket("b").set(100);
        Connection.from(a, c, "a");
        ExpressionNode d = add("d");
        Connection.from(b, d, "a");
        Connection.from(c, d, "b");

        assertEquals(112.0, Values.asDouble(d.evaluate().get("out")), 0.0);
        assertEquals(1, aFn.calls());

        d.cleanGraph();
        for (ExpressionNode n : new ExpressionNode[] { a, b, c, d }) {
            assertFalse(n + " still cached", n.isEvaluated());
            assertTrue(n.outputs().isEmpty());
        }

        a.inputSocket("value").set(2);
        assertEquals(114.0, Values.asDouble(d.evaluate().get("out")), 0.0);
        assertEquals(2, aFn.calls());
    }
}
