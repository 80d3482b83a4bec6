package com.ciro.jdirective.runtime;

import com.ciro.jdirective.ParserOption;
import com.ciro.jdirective.RenderResult;
import com.ciro.jdirective.TemplateParser;
import com.ciro.jdirective.error.MarkupException;
import com.ciro.jdirective.error.TemplateException;
import com.ciro.jdirective.spi.ComponentLoader;
import com.ciro.jdirective.store.CaffeineTemplateStore;
import com.ciro.jdirective.store.TemplateStore;
import com.ciro.jdirective.template.DataContext;
import com.ciro.jdirective.template.ExpressionGateway;
import com.ciro.jdirective.template.PathExpressionGateway;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fachada del motor. Thread-safe: cada render usa un {@link TemplateParser}
 * nuevo y una copia de los datos; lo único compartido son las cachés.
 */
public class TemplateEngine {

    private static final Logger log = LoggerFactory.getLogger(TemplateEngine.class);

    private final EngineConfig config;
    private final ExpressionGateway gateway;
    private final TemplateStore pages;
    private final TemplateComponentLoader components;
    private final LocaleRepository locales;

    public TemplateEngine(EngineConfig config) {
        this(config, new PathExpressionGateway());
    }

    public TemplateEngine(EngineConfig config, ExpressionGateway gateway) {
        this.config = config;
        this.gateway = gateway;
        this.pages = new CaffeineTemplateStore(config.getCacheMaxSize(), config.getCacheExpireMinutes());
        this.components = new TemplateComponentLoader(
            Paths.get(config.getComponentRoot()), config.getTemplateSuffix(),
            new CaffeineTemplateStore(config.getCacheMaxSize(), config.getCacheExpireMinutes()));
        this.locales = new LocaleRepository(
            Paths.get(config.getLocaleRoot()), config.getCacheMaxSize(), config.getCacheExpireMinutes());
    }

    public EngineConfig config() {
        return config;
    }

    public TemplateComponentLoader components() {
        return components;
    }

    public LocaleRepository locales() {
        return locales;
    }

    /** Renderiza markup. Los datos no se modifican: el render trabaja sobre una copia. */
    public RenderResult render(String html, Map<String, Object> data, ParserOption option) {
        ParserOption opt = prepare(option);
        boolean bypass = opt.cacheDisabled();

        ComponentLoader loader = bypass ? components.uncached() : components;
        DataContext ctx = new DataContext(data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data));

        RenderResult result = new TemplateParser(ctx, opt, gateway, loader).render(html);
        report(result, opt);
        return result;
    }

    /** Renderiza {@code <templateRoot>/<name><sufijo>}. */
    public RenderResult renderFile(String name, Map<String, Object> data, ParserOption option) {
        ParserOption opt = prepare(option);
        TemplateStore store = opt.cacheDisabled() ? TemplateStore.direct() : pages;
        String source = store.get(name, this::loadPage);
        if (source == null) {
            throw new MarkupException("Template not found: " + name);
        }
        return render(source, data, opt);
    }

    public void invalidateCaches() {
        pages.invalidateAll();
        locales.invalidateAll();
    }

    // Los valores por defecto del motor se aplican sobre una copia de las opciones del llamador
    private ParserOption prepare(ParserOption option) {
        ParserOption opt = option != null ? option.copy() : ParserOption.defaults();
        if (config.isDebug()) opt.setDebug(true);
        if (config.isDisableCache()) opt.setDisableCache(true);
        if (opt.getLocale() == null && !config.getDefaultLocale().isBlank()) {
            locales.find(config.getDefaultLocale(), opt.cacheDisabled()).ifPresent(opt::setLocale);
        }
        return opt;
    }

    private void report(RenderResult result, ParserOption opt) {
        if (!result.hasErrors()) return;
        if (opt.isClientOutput() && config.isLogRenderErrors()) {
            for (TemplateException e : result.errors()) {
                log.warn("Render error [{}] {}: {}", opt.getRoute(), e.category(), e.getMessage());
            }
        } else {
            log.debug("Render finished with {} errors", result.errors().size());
        }
    }

    private String loadPage(String name) {
        if (name.contains("..")) return null;
        Path file = Paths.get(config.getTemplateRoot()).resolve(name + config.getTemplateSuffix());
        if (!Files.isRegularFile(file)) return null;
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new MarkupException("Cannot read template " + file, e);
        }
    }
}
