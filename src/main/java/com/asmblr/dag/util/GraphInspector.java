package com.asmblr.dag.util;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.asmblr.dag.api.Node;
import com.asmblr.dag.api.NodeSchema;
import com.asmblr.dag.io.NodeRegistry;
import com.asmblr.dag.node.Connection;
import com.asmblr.dag.node.InputSocket;
import com.asmblr.dag.node.OutputSocket;

/**
 * Diagnostic utility for inspecting graph state and topology.
 *
 * <p>
 * Generates human-readable text for a single node, for the graph upstream of a
 * node, and Mermaid diagrams. Intended for debugging sessions and error logs.
 * Nothing here evaluates a node.
 */
public final class GraphInspector {
    private GraphInspector() {
        // Utility class
    }

    /**
     * Dumps the state of a single node: id, type, whether it is evaluated, every
     * input socket's binding and every output socket's fan-out.
     */
    public static String explainNode(Node node) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(node.id()).append('\n')
                .append("  Type: ").append(node.typeName()).append('\n')
                .append("  Evaluated: ").append(node.isEvaluated()).append('\n')
                .append("  Root: ").append(node.isRoot()).append('\n');

        sb.append("  Inputs (").append(node.inputSockets().size()).append("):\n");
        for (InputSocket socket : node.inputSockets().values()) {
            sb.append("    ").append(socket.name());
            if (socket.isVariadic())
                sb.append('*');
            if (socket.typeHint() != null)
                sb.append(" : ").append(socket.typeHint());
            sb.append(" = ");
            if (socket.isConnected()) {
                sb.append("<- ");
                List<Connection> cs = socket.connections();
                for (int i = 0; i < cs.size(); i++) {
                    Connection c = cs.get(i);
                    sb.append(c.source().typeName()).append('#').append(c.source().id()).append(':')
                            .append(c.sourceOutput());
                    if (i < cs.size() - 1)
                        sb.append(", ");
                }
            } else if (socket.hasValue()) {
                sb.append(socket.value());
            } else {
                sb.append("(unconnected)");
            }
            sb.append('\n');
        }

        sb.append("  Outputs (").append(node.outputSockets().size()).append("):\n");
        for (OutputSocket socket : node.outputSockets().values()) {
            sb.append("    ").append(socket.name()).append(" -> ").append(socket.connectionCount())
                    .append(" connection(s)");
            if (node.isEvaluated() && node.outputs().containsKey(socket.name()))
                sb.append(", value ").append(node.outputs().get(socket.name()));
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Dumps the graph upstream of {@code root} as an indented tree. A node reached
     * a second time is printed as a back-reference and not expanded again.
     */
    public static String dumpGraph(Node root) {
        StringBuilder sb = new StringBuilder(1024);
        dump(root, null, 0, new HashMap<>(), sb);
        return sb.toString();
    }

    private static void dump(Node node, String viaSocket, int depth, Map<String, Boolean> seen, StringBuilder sb) {
        sb.append("  ".repeat(depth));
        if (viaSocket != null)
            sb.append(viaSocket).append(" <- ");
        sb.append(node.typeName()).append('#').append(node.id());
        if (seen.putIfAbsent(node.id(), Boolean.TRUE) != null) {
            sb.append(" (see above)\n");
            return;
        }
        List<String> values = new ArrayList<>();
        for (InputSocket socket : node.inputSockets().values()) {
            if (!socket.isConnected() && socket.hasValue())
                values.add(socket.name() + "=" + socket.value());
        }
        if (!values.isEmpty())
            sb.append(' ').append(values);
        sb.append('\n');

        for (InputSocket socket : node.inputSockets().values()) {
            for (Connection c : socket.connections())
                dump(c.source(), socket.name(), depth + 1, seen, sb);
        }
    }

    /**
     * Generates a Mermaid JS graph diagram of everything upstream of
     * {@code root}. Edges are labelled {@code output:input}. Mermaid ids carry
     * the node's visit index, so ids that sanitize alike stay distinct.
     */
    public static String toMermaid(Node root) {
        Map<String, Node> order = new LinkedHashMap<>();
        collect(root, order);

        Map<String, String> mermaidIds = new HashMap<>();
        int index = 0;
        for (String id : order.keySet())
            mermaidIds.put(id, "n" + index++ + "_" + sanitize(id));

        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph TD;\n");

        // 1. Declare nodes
        for (Node node : order.values()) {
            sb.append("  ").append(mermaidIds.get(node.id())).append("[\"").append(node.typeName()).append("<br/>")
                    .append(node.id()).append("\"];\n");
        }

        // 2. Declare edges afterwards
        for (Node node : order.values()) {
            for (InputSocket socket : node.inputSockets().values()) {
                for (Connection c : socket.connections()) {
                    sb.append("  ").append(mermaidIds.get(c.source().id())).append(" -- \"")
                            .append(c.sourceOutput()).append(':').append(socket.name()).append("\" --> ")
                            .append(mermaidIds.get(node.id())).append(";\n");
                }
            }
        }
        return sb.toString();
    }

    private static void collect(Node node, Map<String, Node> order) {
        if (order.putIfAbsent(node.id(), node) != null)
            return;
        for (InputSocket socket : node.inputSockets().values()) {
            for (Connection c : socket.connections())
                collect(c.source(), order);
        }
    }

    /** Describes a registered node type: its inputs with type hints and defaults, and its outputs. */
    public static String describeType(NodeRegistry registry, String typeName) {
        NodeSchema schema = registry.schema(typeName);
        StringBuilder sb = new StringBuilder(128);
        sb.append("Type: ").append(schema.typeName()).append('\n');
        sb.append("  Inputs:\n");
        for (NodeSchema.InputSpec in : schema.inputs()) {
            sb.append("    ").append(in.name());
            if (in.variadic())
                sb.append('*');
            if (in.typeHint() != null)
                sb.append(" : ").append(in.typeHint());
            if (!in.defaultValue().isNone())
                sb.append(" = ").append(in.defaultValue());
            sb.append('\n');
        }
        sb.append("  Outputs: ").append(String.join(", ", schema.outputs())).append('\n');
        return sb.toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
