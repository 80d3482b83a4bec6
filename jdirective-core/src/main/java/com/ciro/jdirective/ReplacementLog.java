package com.ciro.jdirective;

import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ediciones estructurales diferidas: "sustituir X por [n1..nk]". Se registran
 * durante el recorrido y se aplican una sola vez al terminar, en orden de registro.
 */
final class ReplacementLog {

    private static final Logger log = LoggerFactory.getLogger(ReplacementLog.class);

    record Edit(Node target, List<Node> replacements) {}

    private final List<Edit> edits = new ArrayList<>();
    private boolean applied;

    void record(Node target, List<? extends Node> replacements) {
        if (applied) {
            throw new IllegalStateException("Replacement log already applied");
        }
        edits.add(new Edit(target, List.copyOf(replacements)));
    }

    int size() {
        return edits.size();
    }

    /** Aplica todas las ediciones. Devuelve cuántas se aplicaron. */
    int apply() {
        if (applied) return 0;
        applied = true;

        int count = 0;
        for (Edit edit : edits) {
            Node target = edit.target();
            if (target.parentNode() == null) {
                // El nodo ya salió del árbol (p. ej. dentro de otra sustitución)
                log.debug("Skipping replacement of detached node <{}>", target.nodeName());
                continue;
            }
            for (Node n : edit.replacements()) {
                target.before(n);
            }
            target.remove();
            count++;
        }
        edits.clear();
        return count;
    }
}
