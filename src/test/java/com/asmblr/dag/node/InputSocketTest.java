package com.asmblr.dag.node;

import org.junit.Test;

import com.asmblr.dag.value.Value;
import com.asmblr.dag.value.Values;

import static com.asmblr.dag.NodeFixtures.*;
import static org.junit.Assert.*;

public class InputSocketTest {

    @Test
    public void testUnsetSocketResolvesToNone() {
        ExpressionNode add = add("add");
        InputSocket a = add.inputSocket("a");
        assertFalse(a.hasValue());
        assertFalse(a.isConnected());
        assertTrue(a.resolve().isNone());
        assertEquals("float", a.typeHint());
    }

    @Test
    public void testDirectValue() {
        ExpressionNode add = add("add");
        InputSocket a = add.inputSocket("a");
        a.set(4);
        assertTrue(a.hasValue());
        assertEquals(Values.of(4), a.resolve());
    }

    @Test
    public void testConnectingReplacesDirectValue() {
        ExpressionNode c = constant("c", 9);
        ExpressionNode add = add("add");
        InputSocket a = add.inputSocket("a");
        a.set(4);

        Connection.from(c, add, "a");
        assertTrue(a.isConnected());
        assertFalse(a.hasValue());
        assertTrue(a.value().isNone());
        assertEquals(Values.of(9), a.resolve());
    }

    @Test
    public void testSettingValueDeletesConnectionsAtBothEnds() {
        ExpressionNode c = constant("c", 9);
        ExpressionNode add = add("add");
        Connection.from(c, add, "a");
        assertEquals(1, c.outputSocket("out").connectionCount());

        add.inputSocket("a").set(1);
        assertFalse(add.inputSocket("a").isConnected());
        assertEquals(0, c.outputSocket("out").connectionCount());
        assertTrue(c.isRoot());
    }

    @Test
    public void testFanInResolvesToTupleInConnectionOrder() {
        ExpressionNode x = constant("x", "x");
        ExpressionNode y = constant("y", "y");
        ExpressionNode z = constant("z", "z");
        ExpressionNode col = collect("col");
        Connection.from(y, col, "items");
        Connection.from(x, col, "items");
        Connection.from(z, col, "items");

        Value v = col.inputSocket("items").resolve();
        assertEquals(Values.tuple("y", "x", "z"), v);
    }

    @Test
    public void testDisconnectRestoresUnsetState() {
        ExpressionNode x = constant("x", 1);
        ExpressionNode y = constant("y", 2);
        ExpressionNode col = collect("col");
        Connection.from(x, col, "items");
        Connection.from(y, col, "items");

        InputSocket items = col.inputSocket("items");
        items.disconnect();
        assertFalse(items.isConnected());
        assertTrue(items.resolve().isNone());
        assertTrue(x.isRoot());
        assertTrue(y.isRoot());
    }

    @Test
    public void testClear() {
        ExpressionNode add = add("add");
        add.inputSocket("b").set(2.0);
        add.inputSocket("b").clear();
        assertFalse(add.inputSocket("b").hasValue());
    }
}
