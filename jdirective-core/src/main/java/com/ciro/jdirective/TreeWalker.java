package com.ciro.jdirective;

import com.ciro.jdirective.directive.Directive;
import com.ciro.jdirective.directive.DirectiveSet;
import com.ciro.jdirective.error.ExpressionException;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recorrido recursivo único. Despacha por tipo de nodo y por directiva, y
 * nunca modifica la cadena de hermanos que está recorriendo: las sustituciones
 * van al {@link ReplacementLog}.
 */
final class TreeWalker {

    private static final Logger log = LoggerFactory.getLogger(TreeWalker.class);

    private final ParserContext ctx;
    private final BindingRegistry registry;
    private final Translator translator;
    private final ConditionalResolver conditionals;
    private final LoopResolver loops;

    TreeWalker(ParserContext ctx, BindingRegistry registry, Translator translator) {
        this.ctx = ctx;
        this.registry = registry;
        this.translator = translator;
        this.conditionals = new ConditionalResolver(ctx, registry);
        this.loops = new LoopResolver(ctx, registry, this);
    }

    void walk(Node node) {
        boolean skipChildren = false;

        if (node instanceof Element el) {
            DirectiveSet directives = DirectiveSet.of(el);
            if (!ctx.states.isResolved(el)) {
                resolveElement(el, directives);
            }
            // Los hijos de un bucle los recorre el propio bucle, clon a clon
            skipChildren = directives.has(Directive.FOR);
        } else if (node instanceof TextNode text) {
            resolveText(text);
        }

        if (!skipChildren) {
            walkChildren(node);
        }
    }

    void walkChildren(Node node) {
        // Copia: el padre puede cambiar de hijos (componentes) mientras se recorre
        List<Node> children = new ArrayList<>(node.childNodes());
        for (Node child : children) {
            walk(child);
        }
    }

    private void resolveElement(Element el, DirectiveSet directives) {
        translator.translateAttributes(el, directives);

        if (directives.has(Directive.FOR)) {
            loops.expand(el, directives);
            return;
        }

        if (directives.has(Directive.IF)) {
            conditionals.resolve(el, directives);
        }

        if (directives.isAssignment()) {
            assign(el);
        }

        expandComponent(el);

        registry.bindAttributes(el, directives);
        ctx.states.markResolved(el);
    }

    private void resolveText(TextNode text) {
        if (ctx.states.isResolved(text)) return;
        translator.translateText(text);
        registry.bindText(text);
        ctx.states.markResolved(text);
    }

    void expandComponent(Element el) {
        if (el.hasAttr(Directive.JIT.attribute()) || !ctx.loader.isComponent(el)) return;
        ctx.loader.expand(el, ctx.data);
        el.attr(Directive.JIT.attribute(), "true");
    }

    /** {@code <s:set name="x" value="{{ expr }}"/>} o el atributo {@code s:set}. */
    private void assign(Element el) {
        ctx.states.markResolved(el);

        String name = el.attr("name").trim();
        if (name.isEmpty()) return;

        String valueExp = el.attr("value");
        if (!ctx.gateway.hasStatement(valueExp)) {
            ctx.gateway.assign(ctx.data, name, valueExp);
            return;
        }

        try {
            ctx.gateway.assign(ctx.data, name, ctx.gateway.exec(valueExp, ctx.data));
        } catch (ExpressionException e) {
            log.warn("Set {}: {}", valueExp, e.getMessage());
            ctx.error(e);
            ctx.gateway.assign(ctx.data, name, valueExp);
        }
    }
}
