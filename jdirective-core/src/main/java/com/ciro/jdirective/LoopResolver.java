package com.ciro.jdirective;

import com.ciro.jdirective.directive.Directive;
import com.ciro.jdirective.directive.DirectiveSet;
import com.ciro.jdirective.error.ExpressionException;
import com.ciro.jdirective.error.LoopSourceException;
import com.ciro.jdirective.template.DataContext;
import com.ciro.jdirective.template.Values;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

/**
 * Expansión de {@code s:for}: un clon del nodo por elemento de la fuente.
 * El nodo original queda oculto y se sustituye por los clones al final del
 * recorrido (nunca durante).
 */
final class LoopResolver {

    static final String DEFAULT_ITEM = "item";
    static final String DEFAULT_INDEX = "index";

    private final ParserContext ctx;
    private final BindingRegistry registry;
    private final TreeWalker walker;

    LoopResolver(ParserContext ctx, BindingRegistry registry, TreeWalker walker) {
        this.ctx = ctx;
        this.registry = registry;
        this.walker = walker;
    }

    /** Devuelve los nodos que sustituirán a {@code el} (vacío si la fuente falla). */
    List<Node> expand(Element el, DirectiveSet directives) {
        ParserContext.setKey("for", el, registry.next());
        ctx.states.markResolved(el);
        ctx.hide(el);

        String source = directives.value(Directive.FOR);
        List<Object> items;
        try {
            Object value = ctx.gateway.exec(source, ctx.data);
            items = Values.toList(value);
            if (items == null) {
                throw new LoopSourceException(source, value);
            }
        } catch (ExpressionException | LoopSourceException e) {
            ctx.error(e);
            return List.of();
        }

        String itemVar = directives.valueOr(Directive.FOR_ITEM, DEFAULT_ITEM);
        String indexVar = directives.valueOr(Directive.FOR_INDEX, DEFAULT_INDEX);
        List<Node> itemNodes = new ArrayList<>();

        // Modo autor: se conserva la plantilla intacta (oculta) para el editor
        if (ctx.editor()) {
            Element template = el.clone();
            ctx.states.markResolved(template);
            itemNodes.add(template);
        }

        try (DataContext.Scope scope = ctx.data.push()) {
            for (int idx = 0; idx < items.size(); idx++) {
                Element clone = el.clone();
                ctx.states.clear(clone);
                scope.bind(itemVar, items.get(idx));
                scope.bind(indexVar, idx);

                if (directives.has(Directive.IF)) {
                    String cond = directives.value(Directive.IF);
                    Object res;
                    try {
                        res = ctx.gateway.exec(cond, ctx.data);
                    } catch (ExpressionException e) {
                        ctx.error(new ExpressionException(
                            "if statement " + registry.current() + " error: " + e.getMessage(), cond, e));
                        clone.attr(Markers.ERROR, e.getMessage());
                        ctx.states.markResolved(clone);
                        ctx.show(clone);
                        itemNodes.add(clone);
                        continue;
                    }
                    // Dentro de un bucle, s:if verdadero excluye el elemento
                    if (Boolean.TRUE.equals(res)) {
                        ctx.hide(clone);
                        continue;
                    }
                }

                registry.bindAttributes(clone, directives);
                ctx.states.markResolved(clone);

                ParserContext.setKey("for-item-index", clone, idx);
                ParserContext.setKey("for-item-key", clone, registry.next());
                ctx.show(clone);
                if (ctx.editor()) {
                    clone.attr(Markers.EDITOR_GENERATE, "true");
                }

                walker.expandComponent(clone);
                walker.walkChildren(clone);
                itemNodes.add(clone);
            }
        }

        ctx.replacements.record(el, itemNodes);
        return itemNodes;
    }
}
