package com.ciro.jdirective.directive;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;

/**
 * Directivas de un elemento, leídas una sola vez antes de resolver nada.
 * Es una foto: si el elemento cambia después, hay que volver a leerla.
 */
public final class DirectiveSet {

    private static final DirectiveSet EMPTY = new DirectiveSet(
        new EnumMap<>(Directive.class), Map.of(), Map.of(), false);

    private final EnumMap<Directive, String> values;
    private final Map<String, String> translatedAttrs;
    private final Map<String, String> booleanAttrs;
    private final boolean setElement;

    private DirectiveSet(EnumMap<Directive, String> values,
                         Map<String, String> translatedAttrs,
                         Map<String, String> booleanAttrs,
                         boolean setElement) {
        this.values = values;
        this.translatedAttrs = translatedAttrs;
        this.booleanAttrs = booleanAttrs;
        this.setElement = setElement;
    }

    public static DirectiveSet of(Element el) {
        boolean setElement = Directive.SET.attribute().equals(el.tagName());
        if (el.attributesSize() == 0 && !setElement) return EMPTY;

        EnumMap<Directive, String> values = new EnumMap<>(Directive.class);
        Map<String, String> translated = new LinkedHashMap<>();
        Map<String, String> booleans = new LinkedHashMap<>();

        for (Attribute attr : el.attributes()) {
            String key = attr.getKey();
            if (!key.startsWith(Directive.PREFIX)) continue;

            if (key.startsWith(Directive.TRANS_ATTR_PREFIX)) {
                translated.put(key.substring(Directive.TRANS_ATTR_PREFIX.length()), attr.getValue());
            } else if (key.startsWith(Directive.ATTR_PREFIX)) {
                booleans.put(key.substring(Directive.ATTR_PREFIX.length()), attr.getValue());
            } else {
                Directive d = Directive.fromAttribute(key);
                if (d != null) values.put(d, attr.getValue());
            }
        }
        return new DirectiveSet(values, Collections.unmodifiableMap(translated),
            Collections.unmodifiableMap(booleans), setElement);
    }

    public boolean has(Directive d) {
        return values.containsKey(d);
    }

    public String value(Directive d) {
        return values.get(d);
    }

    public String valueOr(Directive d, String fallback) {
        String v = values.get(d);
        return (v == null || v.isBlank()) ? fallback : v.trim();
    }

    /** {@code <s:set>} como elemento o {@code s:set} como atributo. */
    public boolean isAssignment() {
        return setElement || values.containsKey(Directive.SET);
    }

    /** nombre de atributo → claves de traducción ({@code s:trans-attr-*}). */
    public Map<String, String> translatedAttributes() {
        return translatedAttrs;
    }

    /** nombre de atributo → expresión ({@code s:attr-*}). */
    public Map<String, String> booleanAttributes() {
        return booleanAttrs;
    }

    public boolean isEmpty() {
        return values.isEmpty() && translatedAttrs.isEmpty() && booleanAttrs.isEmpty() && !setElement;
    }
}
