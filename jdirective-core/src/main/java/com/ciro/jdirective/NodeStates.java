package com.ciro.jdirective;

import java.util.IdentityHashMap;
import java.util.Map;
import org.jsoup.nodes.Node;

/**
 * Tabla lateral nodo → estado, por identidad. Los clones son objetos nuevos,
 * así que nacen {@link NodeState#UNVISITED}.
 */
final class NodeStates {

    private final Map<Node, NodeState> states = new IdentityHashMap<>();

    NodeState of(Node node) {
        return states.getOrDefault(node, NodeState.UNVISITED);
    }

    boolean isResolved(Node node) {
        return of(node) == NodeState.RESOLVED;
    }

    void markResolved(Node node) {
        states.put(node, NodeState.RESOLVED);
    }

    void clear(Node node) {
        states.remove(node);
    }

    int size() {
        return states.size();
    }
}
