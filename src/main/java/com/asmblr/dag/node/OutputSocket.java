package com.asmblr.dag.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.asmblr.dag.api.Node;

/**
 * Named output of a node. Keeps the connections reading from it (fan-out), in
 * the order they were made.
 */
public final class OutputSocket {
    private final String name;
    private final Node owner;
    private final List<Connection> connections = new ArrayList<>();

    public OutputSocket(String name, Node owner) {
        this.name = name;
        this.owner = owner;
    }

    public String name() {
        return name;
    }

    public Node owner() {
        return owner;
    }

    public List<Connection> connections() {
        return Collections.unmodifiableList(connections);
    }

    /** Number of downstream consumers of this output. */
    public int connectionCount() {
        return connections.size();
    }

    void attach(Connection c) {
        connections.add(c);
    }

    void detach(Connection c) {
        connections.remove(c);
    }

    @Override
    public String toString() {
        return owner.typeName() + ":" + name;
    }
}
