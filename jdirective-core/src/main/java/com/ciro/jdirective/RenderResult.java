package com.ciro.jdirective;

import com.ciro.jdirective.error.TemplateException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Salida de un render: markup resuelto, errores no fatales y mapa de bindings.
 */
public record RenderResult(String html, List<TemplateException> errors, Map<Integer, Binding> bindings) {

    public RenderResult {
        errors = List.copyOf(errors);
        bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
