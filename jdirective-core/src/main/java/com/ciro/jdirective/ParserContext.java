package com.ciro.jdirective;

import com.ciro.jdirective.error.TemplateException;
import com.ciro.jdirective.spi.ComponentLoader;
import com.ciro.jdirective.template.DataContext;
import com.ciro.jdirective.template.ExpressionGateway;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Element;

/**
 * Estado de un único render: se crea con el parser y se descarta con él.
 */
final class ParserContext {

    final DataContext data;
    final ParserOption option;
    final ExpressionGateway gateway;
    final ComponentLoader loader;
    final Locale locale;

    final NodeStates states = new NodeStates();
    final ReplacementLog replacements = new ReplacementLog();
    final List<TemplateException> errors = new ArrayList<>();

    ParserContext(DataContext data, ParserOption option, ExpressionGateway gateway, ComponentLoader loader) {
        this.data = data;
        this.option = option;
        this.gateway = gateway;
        this.loader = loader;
        this.locale = option.getLocale();
    }

    void error(TemplateException e) {
        errors.add(e);
    }

    boolean editor() {
        return option.isEditor();
    }

    // ---------------------------------------------------------------- visibilidad

    void hide(Element el) {
        if (option.isEditor()) {
            el.attr(Markers.EDITOR_HIDE, "true");
            return;
        }
        el.attr(Markers.HIDE, "true");
    }

    void show(Element el) {
        if (option.isEditor()) {
            el.removeAttr(Markers.EDITOR_HIDE);
            return;
        }
        el.removeAttr(Markers.HIDE);
    }

    // ---------------------------------------------------------------- claves

    static String key(String prefix, Element el) {
        return el.attr(Markers.key(prefix));
    }

    static void setKey(String prefix, Element el, Object key) {
        el.attr(Markers.key(prefix), String.valueOf(key));
    }
}
