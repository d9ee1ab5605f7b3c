package com.asmblr.dag.api;

/**
 * Creates a node of one registered type.
 */
@FunctionalInterface
public interface NodeFactory {

    /**
     * @param id the id the node must carry; never {@code null}.
     * @return a fresh node with every socket in its default state.
     */
    Node create(String id);
}
