package com.ciro.jdirective;

import com.ciro.jdirective.directive.Directive;
import com.ciro.jdirective.directive.DirectiveSet;
import com.ciro.jdirective.error.ExpressionException;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Element;

/**
 * Grupo {@code s:if / s:elif* / s:else?}: gana la primera rama verdadera y
 * {@code else} solo si ninguna lo fue. Las ramas no elegidas quedan ocultas,
 * no se eliminan.
 */
final class ConditionalResolver {

    /** Ramas que siguen a un {@code s:if}, en orden de documento. */
    record Group(List<Element> elifs, Element otherwise) {}

    private final ParserContext ctx;
    private final BindingRegistry registry;

    ConditionalResolver(ParserContext ctx, BindingRegistry registry) {
        this.ctx = ctx;
        this.registry = registry;
    }

    void resolve(Element el, DirectiveSet directives) {
        int seq = registry.next();
        ParserContext.setKey("if", el, seq);
        ctx.states.markResolved(el);
        ctx.hide(el);

        Group group = discover(el);

        Boolean matched = evaluate(directives.value(Directive.IF), seq);
        if (matched == null) return;
        if (matched) {
            reveal(el);
            return;
        }

        for (Element elif : group.elifs()) {
            matched = evaluate(elif.attr(Directive.ELIF.attribute()), seq);
            if (matched == null) return;
            if (matched) {
                reveal(elif);
                return;
            }
        }

        if (group.otherwise() != null) {
            reveal(group.otherwise());
        }
    }

    /**
     * Recoge los hermanos {@code s:elif} contiguos y el {@code s:else} que cierra el
     * grupo. Todos comparten la clave del {@code s:if} y nacen ocultos y resueltos.
     */
    Group discover(Element el) {
        String key = ParserContext.key("if", el);
        List<Element> elifs = new ArrayList<>();
        Element otherwise = null;

        for (Element next = el.nextElementSibling(); next != null; next = next.nextElementSibling()) {
            if (next.hasAttr(Directive.ELIF.attribute())) {
                join(next, key);
                elifs.add(next);
                continue;
            }
            if (next.hasAttr(Directive.ELSE.attribute())) {
                join(next, key);
                otherwise = next;
            }
            break;
        }
        return new Group(elifs, otherwise);
    }

    private void join(Element branch, String key) {
        ctx.states.markResolved(branch);
        ParserContext.setKey("if", branch, key);
        ctx.hide(branch);
    }

    /** {@code null} si la evaluación falló (el error queda acumulado). */
    private Boolean evaluate(String expression, int seq) {
        try {
            return Boolean.TRUE.equals(ctx.gateway.exec(expression, ctx.data));
        } catch (ExpressionException e) {
            ctx.error(new ExpressionException(
                "if statement " + seq + " error: " + e.getMessage(), e.expression(), e));
            return null;
        }
    }

    private void reveal(Element branch) {
        ctx.states.clear(branch);
        registry.bindAttributes(branch, DirectiveSet.of(branch));
        ctx.states.markResolved(branch);
        ctx.show(branch);
    }
}
