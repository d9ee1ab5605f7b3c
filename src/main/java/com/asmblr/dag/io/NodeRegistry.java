package com.asmblr.dag.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.regex.Pattern;

import com.asmblr.dag.api.Node;
import com.asmblr.dag.api.NodeFactory;
import com.asmblr.dag.api.NodeSchema;
import com.asmblr.dag.error.NodeConstructionException;
import com.asmblr.dag.error.UnknownNodeTypeException;
import com.asmblr.dag.fn.ExpressionBuilder;
import com.asmblr.dag.node.ExpressionNode;

/**
 * Registry mapping node type names to their schemas and factories.
 *
 * <p>
 * Populated by explicit {@code register} calls at startup; nothing is discovered
 * implicitly. Consumed when a graph is rebuilt from its wire form.
 */
public final class NodeRegistry {

    /** A registered type: its socket layout and the factory that builds it. */
    public record Registration(NodeSchema schema, NodeFactory factory) {
    }

    private final Map<String, Registration> registry = new TreeMap<>();

    /**
     * Registers a type whose nodes are {@link ExpressionNode}s built by
     * {@code builder}.
     */
    public NodeRegistry register(NodeSchema schema, ExpressionBuilder builder) {
        return registerFactory(schema, id -> new ExpressionNode(id, schema, builder));
    }

    /**
     * Registers a type with a custom factory. The factory must build nodes whose
     * type name matches {@code schema.typeName()}.
     *
     * @throws IllegalArgumentException if the type name is already registered.
     */
    public NodeRegistry registerFactory(NodeSchema schema, NodeFactory factory) {
        if (registry.containsKey(schema.typeName()))
            throw new IllegalArgumentException("Node type already registered: " + schema.typeName());
        registry.put(schema.typeName(), new Registration(schema, factory));
        return this;
    }

    public boolean contains(String typeName) {
        return registry.containsKey(typeName);
    }

    /**
     * @throws UnknownNodeTypeException if the type is not registered.
     */
    public NodeFactory lookup(String typeName) {
        return registration(typeName).factory();
    }

    /**
     * @throws UnknownNodeTypeException if the type is not registered.
     */
    public NodeSchema schema(String typeName) {
        return registration(typeName).schema();
    }

    /** Creates a node with a fresh random id. */
    public Node create(String typeName) {
        return create(typeName, UUID.randomUUID().toString());
    }

    /**
     * Creates a node carrying {@code id}.
     *
     * @throws UnknownNodeTypeException  if the type is not registered.
     * @throws NodeConstructionException if the factory fails or builds a node
     *                                   with a different id or type.
     */
    public Node create(String typeName, String id) {
        Registration reg = registry.get(typeName);
        if (reg == null)
            throw new UnknownNodeTypeException(typeName, id);

        Node node;
        try {
            node = reg.factory().create(id);
        } catch (NodeConstructionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new NodeConstructionException("Node factory failed: " + e.getMessage(), id, typeName, e);
        }
        if (node == null || !id.equals(node.id()) || !typeName.equals(node.typeName()))
            throw new NodeConstructionException("Factory built " + node + " instead of a node with the requested id",
                    id, typeName);
        return node;
    }

    /** Registered type names, sorted. */
    public List<String> typeNames() {
        return List.copyOf(registry.keySet());
    }

    /** Type names matching {@code regex} anywhere, case-insensitively, sorted. */
    public List<String> search(String regex) {
        Pattern p = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        List<String> out = new ArrayList<>();
        for (String name : registry.keySet()) {
            if (p.matcher(name).find())
                out.add(name);
        }
        return Collections.unmodifiableList(out);
    }

    private Registration registration(String typeName) {
        Registration reg = registry.get(typeName);
        if (reg == null)
            throw new UnknownNodeTypeException(typeName);
        return reg;
    }
}
