package com.ciro.jdirective;

/** Estado de resolución de un nodo dentro de un render. */
enum NodeState {
    UNVISITED,
    RESOLVED
}
