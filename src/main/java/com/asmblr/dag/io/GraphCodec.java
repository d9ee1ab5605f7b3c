package com.asmblr.dag.io;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.asmblr.dag.api.Node;
import com.asmblr.dag.error.GraphException;
import com.asmblr.dag.error.NodeConstructionException;
import com.asmblr.dag.error.SocketReferenceException;
import com.asmblr.dag.error.ValueDecodeException;
import com.asmblr.dag.node.Connection;
import com.asmblr.dag.node.InputSocket;
import com.asmblr.dag.value.EncodedValue;
import com.asmblr.dag.value.Value;
import com.asmblr.dag.value.ValueCodec;

import lombok.extern.log4j.Log4j2;

/**
 * Converts a live graph to its flat {@link GraphRecord} form and back.
 *
 * <p>
 * <b>Serialize</b> walks depth-first from a root along input connections. Each
 * node is emitted once, however many paths reach it, with the encoded direct
 * values of its unconnected inputs. An unset input is left out unless its type
 * declares a default, in which case an explicit none is written so the default
 * is not re-applied on load. Each edge is emitted right after
 * the node that owns its target socket.
 *
 * <p>
 * <b>Deserialize</b> rebuilds in two passes: nodes first (via the
 * {@link NodeRegistry}, keeping the recorded ids), then edges by id lookup.
 * A failing node aborts the load because later edges depend on it; a failing
 * edge is skipped, logged and reported in the result. Roots are recomputed as
 * the nodes left with no outbound connection.
 */
@Log4j2
public final class GraphCodec {
    private final NodeRegistry registry;
    private final ValueCodec values;

    public GraphCodec(NodeRegistry registry) {
        this(registry, new ValueCodec());
    }

    public GraphCodec(NodeRegistry registry, ValueCodec values) {
        this.registry = registry;
        this.values = values;
    }

    public ValueCodec valueCodec() {
        return values;
    }

    // ── Serialize ───────────────────────────────────────────────────

    /**
     * Flattens the graph reachable upstream of {@code root}.
     *
     * @throws IllegalStateException if two distinct nodes share an id.
     */
    public GraphRecord serialize(Node root) {
        GraphRecord out = new GraphRecord();
        visit(root, new HashMap<>(), out);
        log.debug("Serialized graph at {}: {} nodes, {} connections", root.id(), out.getNodes().size(),
                out.getConnections().size());
        return out;
    }

    private void visit(Node node, Map<String, Node> visited, GraphRecord out) {
        Node seen = visited.putIfAbsent(node.id(), node);
        if (seen != null) {
            if (seen != node)
                throw new IllegalStateException("Two distinct nodes share id " + node.id());
            return;
        }

        Map<String, EncodedValue> data = new LinkedHashMap<>();
        for (InputSocket socket : node.inputSockets().values()) {
            if (socket.isConnected())
                continue;
            // an explicit none is kept when it overrides a default
            if (socket.hasValue() || !socket.defaultValue().isNone())
                data.put(socket.name(), values.encode(socket.value()));
        }
        out.getNodes().add(new GraphRecord.NodeRecord(node.id(), node.typeName(), data));

        for (InputSocket socket : node.inputSockets().values()) {
            for (Connection c : socket.connections()) {
                out.getConnections().add(new GraphRecord.ConnectionRecord(c.source().id(), c.sourceOutput(),
                        node.id(), socket.name()));
            }
        }
        for (InputSocket socket : node.inputSockets().values()) {
            for (Connection c : socket.connections())
                visit(c.source(), visited, out);
        }
    }

    // ── Deserialize ─────────────────────────────────────────────────

    /**
     * Rebuilds a graph.
     *
     * @throws com.asmblr.dag.error.UnknownNodeTypeException if a node record names
     *                                                       an unregistered type.
     * @throws NodeConstructionException                     if a node record is
     *                                                       incomplete, duplicated
     *                                                       or its factory fails.
     * @throws SocketReferenceException                      if a node record sets
     *                                                       an input the type
     *                                                       does not have.
     * @throws ValueDecodeException                          if a recorded value
     *                                                       cannot be decoded.
     */
    public LoadedGraph deserialize(GraphRecord record) {
        List<GraphRecord.NodeRecord> nodeRecords = record.getNodes() != null ? record.getNodes() : List.of();
        List<GraphRecord.ConnectionRecord> edgeRecords = record.getConnections() != null
                ? record.getConnections()
                : List.of();

        // 1. Nodes
        Map<String, Node> nodesById = new LinkedHashMap<>(nodeRecords.size() * 2);
        for (GraphRecord.NodeRecord nr : nodeRecords) {
            if (nr.getId() == null || nr.getName() == null)
                throw new NodeConstructionException("Node record needs both 'id' and 'name'", nr.getId(),
                        nr.getName());
            if (nodesById.containsKey(nr.getId()))
                throw new NodeConstructionException("Duplicate node id in graph record", nr.getId(), nr.getName());

            Node node = registry.create(nr.getName(), nr.getId());
            if (nr.getData() != null)
                restoreValues(node, nr.getData());
            nodesById.put(node.id(), node);
        }

        // 2. Edges
        List<GraphRecord.ConnectionRecord> skipped = new ArrayList<>();
        for (GraphRecord.ConnectionRecord cr : edgeRecords) {
            Node source = cr.getSource() != null ? nodesById.get(cr.getSource()) : null;
            Node target = cr.getTarget() != null ? nodesById.get(cr.getTarget()) : null;
            if (source == null || target == null) {
                log.warn("Skipping connection {}:{} -> {}:{}: unknown {} node", cr.getSource(), cr.getSourceOutput(),
                        cr.getTarget(), cr.getTargetInput(), source == null ? "source" : "target");
                skipped.add(cr);
                continue;
            }
            try {
                new Connection(source, cr.getSourceOutput(), target, cr.getTargetInput());
            } catch (GraphException | IllegalArgumentException e) {
                log.warn("Skipping connection {}:{} -> {}:{}: {}", cr.getSource(), cr.getSourceOutput(),
                        cr.getTarget(), cr.getTargetInput(), e.getMessage());
                skipped.add(cr);
            }
        }

        // 3. Roots
        List<Node> roots = new ArrayList<>();
        for (Node node : nodesById.values()) {
            if (node.outboundConnectionCount() == 0)
                roots.add(node);
        }

        log.debug("Deserialized {} nodes, {} connections ({} skipped), {} roots", nodesById.size(),
                edgeRecords.size() - skipped.size(), skipped.size(), roots.size());
        return new LoadedGraph(roots, nodesById, skipped);
    }

    private void restoreValues(Node node, Map<String, EncodedValue> data) {
        for (Map.Entry<String, EncodedValue> e : data.entrySet()) {
            String socketName = e.getKey();
            InputSocket socket = node.inputSockets().get(socketName);
            if (socket == null)
                throw new SocketReferenceException("Recorded value for unknown input socket", node.id(),
                        node.typeName(), socketName);
            socket.setValue(decodeFor(node, socketName, e.getValue()));
        }
    }

    private Value decodeFor(Node node, String socketName, EncodedValue ev) {
        try {
            return values.decode(ev);
        } catch (ValueDecodeException e) {
            if (ev != null && ev.getData() != null && ev.getData().isArray()) {
                log.warn("Restoring {} on {} ({}) as a tuple: {}", socketName, node.id(), node.typeName(),
                        e.getMessage());
                EncodedValue asTuple = new EncodedValue();
                asTuple.setType(ValueCodec.TUPLE);
                asTuple.setData(ev.getData());
                try {
                    return values.decode(asTuple);
                } catch (ValueDecodeException again) {
                    e.addSuppressed(again);
                }
            }
            throw new ValueDecodeException("Cannot restore recorded value: " + e.getMessage(), node.id(),
                    node.typeName(), socketName, e);
        }
    }
}
