package com.asmblr.dag;

import com.asmblr.dag.api.Node;
import com.asmblr.dag.io.GraphCodec;
import com.asmblr.dag.io.GraphRecord;
import com.asmblr.dag.io.LoadedGraph;
import com.asmblr.dag.io.NodeRegistry;
import com.asmblr.dag.util.GraphInspector;

/**
 * asmblr-dag: typed node/socket expression graphs.
 *
 * <h2>Model</h2>
 * <ul>
 * <li><b>Nodes</b> own named input and output sockets and build their outputs
 * from their inputs through an
 * {@link com.asmblr.dag.fn.ExpressionBuilder}.</li>
 * <li><b>Connections</b> wire one node's output into another node's input. The
 * graph is never stored anywhere else; it is rediscovered by walking
 * connections.</li>
 * <li><b>Evaluation</b> is lazy and memoized per node until
 * {@link Node#cleanGraph()} invalidates the upstream subgraph.</li>
 * </ul>
 *
 * <p>
 * Graphs travel as a flat {@link GraphRecord} of node and connection records
 * with tagged values; see {@link com.asmblr.dag.io.GraphJson} for the JSON text
 * form.
 */
public final class AsmblrDag {

    private AsmblrDag() {
        // Prevent instantiation of utility class
    }

    /** Flattens the graph upstream of {@code root}. */
    public static GraphRecord toWire(Node root) {
        return new GraphCodec(new NodeRegistry()).serialize(root);
    }

    /** Rebuilds a graph from its flat form using the node types in {@code registry}. */
    public static LoadedGraph fromWire(GraphRecord record, NodeRegistry registry) {
        return new GraphCodec(registry).deserialize(record);
    }

    /** Human-readable dump of one node's id, type and socket state. */
    public static String inspect(Node node) {
        return GraphInspector.explainNode(node);
    }
}
