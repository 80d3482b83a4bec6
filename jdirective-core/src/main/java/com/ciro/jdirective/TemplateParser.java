package com.ciro.jdirective;

import com.ciro.jdirective.error.MarkupException;
import com.ciro.jdirective.spi.ComponentLoader;
import com.ciro.jdirective.template.DataContext;
import com.ciro.jdirective.template.ExpressionGateway;
import com.ciro.jdirective.template.PathExpressionGateway;
import java.util.Map;
import java.util.Objects;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compilador de plantillas con directivas.
 *
 * <p>Recorre el árbol una vez resolviendo {@code s:for}, {@code s:if/elif/else},
 * {@code s:set}, componentes, traducciones e interpolaciones; después aplica
 * las sustituciones diferidas, inyecta los scripts y limpia según el modo.
 *
 * <p>Una instancia sirve para un único render y no es thread-safe: el contexto
 * de datos se muta durante el recorrido. Para renders concurrentes, un parser
 * nuevo por render.
 */
public class TemplateParser {

    private static final Logger log = LoggerFactory.getLogger(TemplateParser.class);

    private final ParserContext ctx;
    private final BindingRegistry registry;
    private final Translator translator;
    private final TreeWalker walker;
    private final Finalizer finalizer = new Finalizer();
    private final Injector injector = new Injector(ObjectMapperFactory.shared());
    private boolean rendered;

    public TemplateParser(Map<String, Object> data, ParserOption option) {
        this(new DataContext(data), option, new PathExpressionGateway(), ComponentLoader.NONE);
    }

    public TemplateParser(DataContext data, ParserOption option, ExpressionGateway gateway, ComponentLoader loader) {
        this.ctx = new ParserContext(
            Objects.requireNonNull(data, "data must not be null"),
            option != null ? option : ParserOption.defaults(),
            Objects.requireNonNull(gateway, "gateway must not be null"),
            loader != null ? loader : ComponentLoader.NONE);
        this.registry = new BindingRegistry(ctx);
        this.translator = new Translator(ctx.locale);
        this.walker = new TreeWalker(ctx, registry, translator);
    }

    /**
     * Renderiza la plantilla.
     *
     * @throws MarkupException si el markup no se puede parsear (único error fatal)
     */
    public RenderResult render(String html) {
        if (rendered) {
            throw new IllegalStateException("TemplateParser instances are single-use; create one per render");
        }
        rendered = true;
        long start = System.nanoTime();

        Document doc = JsoupMarkup.parse(html);
        Element root = doc.getElementsByTag("html").first();
        if (root == null) {
            throw new MarkupException("Template has no <html> root");
        }

        walk(root);
        int replaced = ctx.replacements.apply();

        injector.injectHead(doc, ctx.locale);
        if (!ctx.option.isComponent()) {
            injector.injectBody(doc, ctx.data.asMap(), ctx.option.isDebug());
        }

        translator.format(doc);

        String out;
        if (ctx.option.isEditor()) {
            out = doc.body().html();
        } else {
            if (ctx.option.isClientOutput()) {
                finalizer.removeHidden(doc);
                finalizer.tidy(doc);
            }
            out = JsoupMarkup.serialize(doc);
        }

        if (log.isDebugEnabled()) {
            log.debug("Rendered template in {} µs: {} bindings, {} replacements, {} errors",
                (System.nanoTime() - start) / 1_000, registry.bindings().size(), replaced, ctx.errors.size());
        }
        return new RenderResult(out, ctx.errors, registry.bindings());
    }

    /** Recorre un nodo. Un nodo ya resuelto no se vuelve a procesar. */
    void walk(Node node) {
        walker.walk(node);
    }

    int sequence() {
        return registry.current();
    }

    ParserContext context() {
        return ctx;
    }
}
