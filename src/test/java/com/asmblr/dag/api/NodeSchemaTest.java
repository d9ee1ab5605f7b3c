package com.asmblr.dag.api;

import java.util.List;

import org.junit.Test;

import com.asmblr.dag.error.NodeConstructionException;
import com.asmblr.dag.value.Values;

import static org.junit.Assert.*;

public class NodeSchemaTest {

    @Test
    public void testBuilder() {
        NodeSchema s = NodeSchema.builder("Lerp")
                .input("a", "float")
                .input("b", "float")
                .input("t", "float", Values.of(0.5))
                .output("out")
                .build();
        assertEquals(List.of("a", "b", "t"), s.inputNames());
        assertTrue(s.input("a").get().defaultValue().isNone());
        assertEquals(Values.of(0.5), s.input("t").get().defaultValue());
        assertFalse(s.variadicInput().isPresent());
    }

    @Test
    public void testRejectsTwoVariadicInputs() {
        try {
            NodeSchema.builder("Bad").variadicInput("x", null).variadicInput("y", null).output("o").build();
            fail("Expected NodeConstructionException");
        } catch (NodeConstructionException e) {
            assertEquals("Bad", e.nodeType());
        }
    }

    @Test(expected = NodeConstructionException.class)
    public void testRejectsDuplicateInput() {
        NodeSchema.builder("Bad").input("x").input("x").output("o").build();
    }

    @Test(expected = NodeConstructionException.class)
    public void testRejectsNoOutputs() {
        NodeSchema.builder("Bad").input("x").build();
    }

    @Test(expected = NodeConstructionException.class)
    public void testRejectsDuplicateOutputs() {
        NodeSchema.builder("Bad").output("o").output("o").build();
    }

    @Test(expected = NodeConstructionException.class)
    public void testRejectsBlankTypeName() {
        NodeSchema.builder(" ").output("o").build();
    }
}
