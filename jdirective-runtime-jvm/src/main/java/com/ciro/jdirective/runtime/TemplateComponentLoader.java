package com.ciro.jdirective.runtime;

import com.ciro.jdirective.error.MarkupException;
import com.ciro.jdirective.spi.ComponentLoader;
import com.ciro.jdirective.store.TemplateStore;
import com.ciro.jdirective.template.DataContext;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Componentes declarados con {@code is="nombre"}. La fuente sale del registro
 * en memoria o de {@code <root>/<nombre><sufijo>}; los hijos originales del
 * elemento se inyectan en cada {@code <slot>} de la plantilla.
 */
public class TemplateComponentLoader implements ComponentLoader {

    private static final Logger log = LoggerFactory.getLogger(TemplateComponentLoader.class);

    public static final String IS_ATTR = "is";
    private static final String SLOT = "slot";
    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_-]+(/[A-Za-z0-9_-]+)*");

    private final Path root;
    private final String suffix;
    private final TemplateStore store;
    private final Map<String, String> registry;

    public TemplateComponentLoader(Path root, String suffix, TemplateStore store) {
        this(root, suffix, store, new ConcurrentHashMap<>());
    }

    private TemplateComponentLoader(Path root, String suffix, TemplateStore store, Map<String, String> registry) {
        this.root = root;
        this.suffix = suffix;
        this.store = store;
        this.registry = registry;
    }

    /** Registra un componente en memoria; tiene prioridad sobre el disco. */
    public TemplateComponentLoader register(String name, String html) {
        registry.put(name, html);
        store.invalidate(name);
        return this;
    }

    /** Misma fuente y registro, sin caché (renders debug o disableCache). */
    public TemplateComponentLoader uncached() {
        return new TemplateComponentLoader(root, suffix, TemplateStore.direct(), registry);
    }

    @Override
    public boolean isComponent(Element el) {
        String name = el.attr(IS_ATTR).trim();
        return !name.isEmpty() && source(name) != null;
    }

    @Override
    public void expand(Element el, DataContext data) {
        String name = el.attr(IS_ATTR).trim();
        String source = source(name);
        if (source == null) {
            throw new MarkupException("Unknown component '" + name + "'");
        }

        String slotHtml = el.html();
        el.html(source);
        for (Element slot : el.getElementsByTag(SLOT)) {
            slot.html(slotHtml);
        }
        log.debug("Expanded component {}", name);
    }

    String source(String name) {
        if (!NAME.matcher(name).matches()) return null;
        return store.get(name, this::load);
    }

    private String load(String name) {
        String registered = registry.get(name);
        if (registered != null) return registered;
        if (root == null) return null;

        Path file = root.resolve(name + suffix);
        if (!Files.isRegularFile(file)) return null;
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new MarkupException("Cannot read component " + file, e);
        }
    }
}
