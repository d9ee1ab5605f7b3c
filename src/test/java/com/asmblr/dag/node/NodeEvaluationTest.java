package com.asmblr.dag.node;

import java.util.Map;

import org.junit.Test;

import com.asmblr.dag.NodeFixtures;
import com.asmblr.dag.NodeFixtures.Counting;
import com.asmblr.dag.api.NodeSchema;
import com.asmblr.dag.error.EvaluationException;
import com.asmblr.dag.value.Value;
import com.asmblr.dag.value.Values;

import static com.asmblr.dag.NodeFixtures.*;
import static org.junit.Assert.*;

public class NodeEvaluationTest {

    @Test
    public void testConstPlusConst() {
        ExpressionNode add = add("add");
        Connection.from(constant("two", 2), add, "a");
        Connection.from(constant("three", 3), add, "b");

        Map<String, Value> out = add.evaluate();
        assertEquals(5.0, Values.asDouble(out.get("out")), 0.0);
        assertTrue(add.isEvaluated());
        assertEquals(2, add.resolvedInputs().size());
    }

    @Test
    public void testEvaluateIsMemoized() {
        Counting counting = new Counting(ADD_FN);
        ExpressionNode add = new ExpressionNode("add", ADD, counting);
        add.inputSocket("a").set(1);
        add.inputSocket("b").set(2);

        Map<String, Value> first = add.evaluate();
        Map<String, Value> second = add.evaluate();
        assertEquals(first, second);
        assertEquals(1, counting.calls());
    }

    @Test
    public void testSharedUpstreamIsConstructedOnce() {
        // diamond: src feeds both left and right, which feed top
        Counting srcFn = new Counting(CONST_FN);
        ExpressionNode src = new ExpressionNode("src", CONST, srcFn);
        src.inputSocket("value").set(10);

        ExpressionNode left = add("left");
        left.inputSocket("b").set(1);
        Connection.from(src, left, "a");

        ExpressionNode right = add("right");
        right.inputSocket("b").set(2);
        Connection.from(src, right, "a");

        ExpressionNode top = add("top");
        new Connection(left, "out", top, "a");
        new Connection(right, "out", top, "b");

        assertEquals(23.0, Values.asDouble(top.evaluate().get("out")), 0.0);
        assertEquals(1, srcFn.calls());
    }

    @Test
    public void testMissingInputsAreOmittedFromResolved() {
        ExpressionNode col = collect("col");
        col.inputSocket("head").set("h");
        col.evaluate();
        assertEquals(Map.of("head", Values.of("h")), col.resolvedInputs());
    }

    @Test
    public void testFailureIsAttributedToFailingNode() {
        ExpressionNode c = constant("c", "not a number");
        ExpressionNode add = add("add");
        add.inputSocket("b").set(1);
        Connection.from(c, add, "a");

        try {
            add.evaluate();
            fail("Expected EvaluationException");
        } catch (EvaluationException e) {
            assertEquals("add", e.nodeId());
            assertEquals("Add", e.nodeType());
            assertEquals("a", e.parameter());
        }
        assertFalse(add.isEvaluated());
        assertTrue(add.resolvedInputs().isEmpty());
        assertTrue("upstream cache is kept", c.isEvaluated());
    }

    @Test
    public void testUpstreamFailureKeepsItsAttribution() {
        ExpressionNode s = split("s");
        s.inputSocket("pair").set(Values.tuple(1, 2, 3));
        ExpressionNode add = add("add");
        new Connection(s, "first", add, "a");
        add.inputSocket("b").set(1);

        try {
            add.evaluate();
            fail("Expected EvaluationException");
        } catch (EvaluationException e) {
            assertEquals("s", e.nodeId());
            assertEquals("pair", e.parameter());
        }
    }

    @Test
    public void testSiblingCachesSurviveFailure() {
        ExpressionNode good = constant("good", 4);
        ExpressionNode bad = constant("bad", "x");
        ExpressionNode add = add("add");
        Connection.from(good, add, "a");
        Connection.from(bad, add, "b");

        try {
            add.evaluate();
            fail("Expected EvaluationException");
        } catch (EvaluationException expected) {
            // fall through
        }
        assertTrue(good.isEvaluated());
        assertEquals(Values.of(4), good.outputs().get("out"));
    }

    @Test
    public void testBuilderExceptionIsWrapped() {
        ExpressionNode boom = new ExpressionNode("boom", CONST, args -> {
            throw new IllegalStateException("kaput");
        });
        try {
            boom.evaluate();
            fail("Expected EvaluationException");
        } catch (EvaluationException e) {
            assertEquals("boom", e.nodeId());
            assertTrue(e.getCause() instanceof IllegalStateException);
            assertTrue(e.getMessage().contains("kaput"));
        }
    }

    @Test
    public void testUndeclaredOutputRejected() {
        ExpressionNode odd = new ExpressionNode("odd", CONST, args -> Map.of("other", Values.of(1)));
        try {
            odd.evaluate();
            fail("Expected EvaluationException");
        } catch (EvaluationException e) {
            assertTrue(e.getMessage().contains("other"));
        }
    }

    @Test
    public void testCycleFailsFast() {
        ExpressionNode a = add("a");
        ExpressionNode b = add("b");
        new Connection(a, "out", b, "a");
        new Connection(b, "out", a, "a");
        a.inputSocket("b").set(1);
        b.inputSocket("b").set(1);

        try {
            a.evaluate();
            fail("Expected EvaluationException");
        } catch (EvaluationException e) {
            assertEquals("a", e.nodeId());
            assertTrue(e.getMessage().contains("cycle"));
        }
        assertFalse(a.isEvaluated());
        assertFalse(b.isEvaluated());
    }

    @Test
    public void testDefaultsAreAppliedAtConstruction() {
        NodeSchema scaled = NodeSchema.builder("Scale")
                .input("x", "float")
                .input("factor", "float", Values.of(10))
                .output("y")
                .build();
        ExpressionNode n = new ExpressionNode("n", scaled,
                args -> Map.of("y", Values.of(args.number("x") * args.number("factor"))));
        assertTrue(n.inputSocket("factor").hasValue());
        n.inputSocket("x").set(1.5);
        assertEquals(15.0, Values.asDouble(n.evaluate().get("y")), 0.0);
    }

    @Test
    public void testToString() {
        assertEquals("Add#x", NodeFixtures.add("x").toString());
    }
}
