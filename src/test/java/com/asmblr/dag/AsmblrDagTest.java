package com.asmblr.dag;

import org.junit.Test;

import com.asmblr.dag.api.Node;
import com.asmblr.dag.io.GraphRecord;
import com.asmblr.dag.io.LoadedGraph;
import com.asmblr.dag.node.Connection;
import com.asmblr.dag.node.ExpressionNode;
import com.asmblr.dag.value.Values;

import static com.asmblr.dag.NodeFixtures.*;
import static org.junit.Assert.*;

public class AsmblrDagTest {

    @Test
    public void testWireRoundTripThenEvaluate() {
        ExpressionNode add = add("add");
        Connection.from(constant("two", 2), add, "a");
        Connection.from(constant("three", 3), add, "b");

        GraphRecord wire = AsmblrDag.toWire(add);
        LoadedGraph loaded = AsmblrDag.fromWire(wire, NodeFixtures.registry());
        Node root = loaded.root();
        assertNotSame(add, root);
        assertEquals(5.0, Values.asDouble(root.evaluate().get("out")), 0.0);

        root.cleanGraph();
        loaded.node("two").inputSocket("value").set(10);
        assertEquals(13.0, Values.asDouble(root.evaluate().get("out")), 0.0);
    }

    @Test
    public void testInspect() {
        String text = AsmblrDag.inspect(constant("k", true));
        assertTrue(text, text.contains("Node: k"));
        assertTrue(text, text.contains("value : any = True"));
    }
}
