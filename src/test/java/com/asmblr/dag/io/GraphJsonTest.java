package com.asmblr.dag.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.asmblr.dag.NodeFixtures;
import com.asmblr.dag.api.Node;
import com.asmblr.dag.node.Connection;
import com.asmblr.dag.node.ExpressionNode;
import com.asmblr.dag.value.Value;
import com.asmblr.dag.value.Values;

import static com.asmblr.dag.NodeFixtures.*;
import static org.junit.Assert.*;

public class GraphJsonTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final GraphJson json = new GraphJson(new GraphCodec(NodeFixtures.registry()));

    private static ExpressionNode sumOfConsts() {
        ExpressionNode add = add("add");
        Connection.from(constant("two", 2), add, "a");
        Connection.from(constant("three", 3), add, "b");
        return add;
    }

    @Test
    public void testWritesFlatDocument() {
        String text = new GraphJson(json.codec(), false).toJson(sumOfConsts());
        assertTrue(text, text.startsWith("{\"nodes\":[{\"id\":\"add\",\"name\":\"Add\",\"data\":{}}"));
        assertTrue(text, text.contains("{\"source\":\"two\",\"sourceOutput\":\"out\",\"target\":\"add\",\"targetInput\":\"a\"}"));
        assertTrue(text, text.contains("\"value\":{\"type\":\"tuple\",\"data\":[2]}"));
    }

    @Test
    public void testNoneIsWrittenAsNullData() {
        String text = new GraphJson(json.codec(), false).toJson(constant("c", "x"));
        assertTrue(text, text.contains("{\"type\":\"string\",\"data\":\"x\"}"));

        ExpressionNode col = collect("col");
        String empty = new GraphJson(json.codec(), false).toJson(col);
        assertTrue(empty, empty.contains("\"data\":{}"));
    }

    @Test
    public void testRoundTripThroughText() {
        Node root = json.fromJson(json.toJson(sumOfConsts())).root();
        assertEquals(5.0, Values.asDouble(root.evaluate().get("out")), 0.0);
    }

    @Test
    public void testWrapperIsWrittenAndUnwrapped() {
        String text = json.toJson(sumOfConsts(), "graph");
        assertTrue(text.trim().startsWith("{"));
        assertTrue(text.contains("\"graph\""));
        assertEquals("add", json.fromJson(text).root().id());
    }

    @Test
    public void testReadsHandWrittenDocument() {
        String text = "{\"nodes\": ["
                + "{\"id\": \"k\", \"name\": \"Const\", \"data\": {\"value\": {\"type\": \"tuple\", \"data\": [4]}}, \"extra\": 1},"
                + "{\"id\": \"s\", \"name\": \"Add\", \"data\": {\"b\": {\"type\": \"other\", \"data\": \"0.5\", \"class\": \"float\"}}}"
                + "], \"connections\": [{\"source\": \"k\", \"sourceOutput\": \"out\", \"target\": \"s\", \"targetInput\": \"a\"}]}";
        Node root = json.fromJson(text).root();
        assertEquals("s", root.id());
        assertEquals(4.5, Values.asDouble(root.evaluate().get("out")), 0.0);
    }

    @Test
    public void testMissingConnectionsKeyIsEmptyGraphOfEdges() {
        LoadedGraph g = json.fromJson("{\"nodes\": [{\"id\": \"k\", \"name\": \"Const\"}]}");
        assertEquals(1, g.roots().size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedJson() {
        json.fromJson("{\"nodes\": [");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingNodesKey() {
        json.fromJson("{\"a\": 1, \"b\": 2}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNodesMustBeArray() {
        json.fromJson("{\"nodes\": {}}");
    }

    @Test
    public void testFileRoundTrip() throws IOException {
        Path file = tmp.newFile("graph.json").toPath();
        json.write(sumOfConsts(), file);
        assertTrue(Files.size(file) > 0);
        assertEquals("add", json.fromJson(file).root().id());
    }

    @Test
    public void testNonFiniteNumbersSurvive() {
        ExpressionNode col = collect("col");
        col.inputSocket("head").set(Double.NaN);
        col.inputSocket("items").set(Values.tuple(Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY));

        String text = new GraphJson(json.codec(), false).toJson(col);
        assertTrue(text, text.contains("[NaN]"));
        assertTrue(text, text.contains("[Infinity,-Infinity]"));

        Node back = json.fromJson(text).root();
        Value head = back.inputSocket("head").value();
        assertTrue(Values.isNumeric(head));
        assertTrue(Double.isNaN(Values.asDouble(head)));
        assertEquals(Values.tuple(Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY),
                back.inputSocket("items").value());
    }
}
