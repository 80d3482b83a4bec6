package com.ciro.jdirective;

import com.ciro.jdirective.directive.Directive;
import com.ciro.jdirective.directive.DirectiveSet;
import com.ciro.jdirective.error.ExpressionException;
import com.ciro.jdirective.template.Interpolation;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

/**
 * Asigna números de secuencia a cada atributo o texto con expresiones y
 * registra {@code clave → (tipo, expresión original)} para la hidratación.
 */
final class BindingRegistry {

    private final ParserContext ctx;
    private final Map<Integer, Binding> bindings = new LinkedHashMap<>();
    private int sequence = 0;

    BindingRegistry(ParserContext ctx) {
        this.ctx = ctx;
    }

    /** Siguiente número de secuencia (empieza en 1, nunca se reutiliza). */
    int next() {
        return ++sequence;
    }

    int current() {
        return sequence;
    }

    Map<Integer, Binding> bindings() {
        return bindings;
    }

    /**
     * Interpola los atributos del elemento y aplica sus {@code s:attr-*}, tomados
     * del {@link DirectiveSet} ya leído. No hace nada si el elemento ya está resuelto.
     */
    void bindAttributes(Element el, DirectiveSet directives) {
        if (ctx.states.isResolved(el)) return;

        for (Map.Entry<String, String> e : directives.booleanAttributes().entrySet()) {
            bindBooleanAttribute(el, e.getKey(), e.getValue());
        }

        List<Attribute> attrs = new ArrayList<>(el.attributes().asList());
        for (Attribute attr : attrs) {
            String key = attr.getKey();
            String val = attr.getValue();

            // Directivas y marcadores no se interpolan
            if (key.startsWith(Directive.PREFIX)) continue;

            Interpolation res = ctx.gateway.replace(val, ctx.data);
            if (!res.hadExpression()) continue;
            res.errors().forEach(ctx::error);

            String expression = val.trim();
            int seq = register(Binding.Kind.ATTR, key, expression);

            if (res.single() && res.value() instanceof Boolean on) {
                if (on) el.attr(key, "");
                else el.removeAttr(key);
            } else {
                el.attr(key, res.text());
            }
            el.attr(Markers.BIND_ATTR_PREFIX + key, expression);
            el.attr(Markers.KEY_ATTR_PREFIX + key, String.valueOf(seq));
        }
    }

    private void bindBooleanAttribute(Element el, String name, String expression) {
        int seq = register(Binding.Kind.ATTR, name, expression.trim());
        el.attr(Markers.BIND_ATTR_PREFIX + name, expression.trim());
        el.attr(Markers.KEY_ATTR_PREFIX + name, String.valueOf(seq));
        try {
            Object res = ctx.gateway.exec(expression, ctx.data);
            if (res instanceof Boolean on) {
                if (on) el.attr(name, "");
                else el.removeAttr(name);
            }
        } catch (ExpressionException e) {
            ctx.error(e);
        }
    }

    /**
     * Interpola un nodo de texto y marca al padre con la clave del binding.
     * Si el padre tiene varios textos interpolados, {@code s:key-text} acumula
     * las claves en orden de documento y {@code s:bind} conserva la primera expresión.
     */
    void bindText(TextNode node) {
        String original = node.getWholeText();
        Interpolation res = ctx.gateway.replace(original, ctx.data);
        if (!res.hadExpression()) return;
        res.errors().forEach(ctx::error);

        String expression = original.trim();
        int seq = register(Binding.Kind.TEXT, "text", expression);

        if (node.parent() instanceof Element parent) {
            String keys = parent.attr(Markers.KEY_TEXT);
            if (keys.isEmpty()) {
                parent.attr(Markers.BIND_TEXT, expression);
                parent.attr(Markers.KEY_TEXT, String.valueOf(seq));
            } else {
                parent.attr(Markers.KEY_TEXT, keys + Markers.KEY_SEPARATOR + seq);
            }
            if (isRawElement(parent)) {
                // s:raw: el valor sale sin escapar
                ctx.replacements.record(node, List.of(new DataNode(res.text())));
            }
        }
        node.text(res.text());
    }

    private int register(Binding.Kind kind, String name, String expression) {
        int seq = next();
        bindings.put(seq, new Binding(seq, kind, name, expression));
        return seq;
    }

    static boolean isRawElement(Element el) {
        if (!el.hasAttr(Directive.RAW.attribute())) return false;
        return !"false".equalsIgnoreCase(el.attr(Directive.RAW.attribute()).trim());
    }
}
