package com.ciro.jdirective;

import com.ciro.jdirective.directive.Directive;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

/**
 * Limpieza final para salidas que van directas al cliente (request/preview):
 * quita lo oculto, el andamiaje {@code s:*} (salvo los ganchos del cliente),
 * los comentarios y los {@code <s:set>}, y desenvuelve {@code <slot>} y los
 * componentes expandidos.
 */
final class Finalizer {

    private static final String SLOT = "slot";

    /** Elimina todos los nodos marcados como ocultos. */
    int removeHidden(Element root) {
        List<Element> hidden = new ArrayList<>();
        for (Element el : root.getAllElements()) {
            if (el.hasAttr(Markers.HIDE)) hidden.add(el);
        }
        for (Element el : hidden) {
            el.remove();
        }
        return hidden.size();
    }

    void tidy(Node parent) {
        List<Node> children = new ArrayList<>(parent.childNodes());
        for (Node child : children) {
            if (child instanceof Comment) {
                child.remove();
                continue;
            }
            if (!(child instanceof Element el)) continue;

            if (SLOT.equals(el.tagName()) || el.hasAttr(Directive.JIT.attribute())) {
                tidy(el);
                el.unwrap();
                continue;
            }

            if (Directive.SET.attribute().equals(el.tagName())) {
                el.remove();
                continue;
            }

            stripAttributes(el);
            tidy(el);
        }
    }

    private void stripAttributes(Element el) {
        List<String> drop = new ArrayList<>();
        for (Attribute attr : el.attributes()) {
            String key = attr.getKey();
            if (key.startsWith(Directive.PREFIX)) {
                Directive d = Directive.fromAttribute(key);
                if (d == null || !d.isClientHook()) drop.add(key);
                continue;
            }
            if (key.equals("parsed") || key.equals("is") || key.startsWith("...")) {
                drop.add(key);
            }
        }
        drop.forEach(el::removeAttr);
    }
}
