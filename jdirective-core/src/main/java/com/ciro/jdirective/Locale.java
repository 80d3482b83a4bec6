package com.ciro.jdirective;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Diccionario de traducciones de un idioma.
 *
 * <ul>
 *   <li>{@code keys}: clave declarada en la plantilla → texto traducido</li>
 *   <li>{@code messages}: texto literal → texto traducido</li>
 *   <li>{@code scriptMessages}: mensajes que se inyectan en el {@code <head>} para el cliente</li>
 *   <li>formatos con nombre para {@code s:trans-fmt}</li>
 * </ul>
 */
public final class Locale {

    private final String name;
    private final Map<String, String> keys;
    private final Map<String, String> messages;
    private final Map<String, String> scriptMessages;
    private final Map<String, UnaryOperator<String>> formats;

    private Locale(Builder b) {
        this.name = b.name;
        this.keys = Collections.unmodifiableMap(new LinkedHashMap<>(b.keys));
        this.messages = Collections.unmodifiableMap(new LinkedHashMap<>(b.messages));
        this.scriptMessages = Collections.unmodifiableMap(new LinkedHashMap<>(b.scriptMessages));
        this.formats = Collections.unmodifiableMap(new LinkedHashMap<>(b.formats));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() { return name; }
    public Map<String, String> keys() { return keys; }
    public Map<String, String> messages() { return messages; }
    public Map<String, String> scriptMessages() { return scriptMessages; }

    /** Aplica el formato con nombre; si no existe devuelve el texto tal cual. */
    public String format(String formatName, String text) {
        UnaryOperator<String> f = formats.get(formatName);
        return f == null ? text : f.apply(text);
    }

    public static final class Builder {
        private final String name;
        private final Map<String, String> keys = new LinkedHashMap<>();
        private final Map<String, String> messages = new LinkedHashMap<>();
        private final Map<String, String> scriptMessages = new LinkedHashMap<>();
        private final Map<String, UnaryOperator<String>> formats = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder key(String key, String text) { keys.put(key, text); return this; }
        public Builder keys(Map<String, String> values) { if (values != null) keys.putAll(values); return this; }
        public Builder message(String literal, String text) { messages.put(literal, text); return this; }
        public Builder messages(Map<String, String> values) { if (values != null) messages.putAll(values); return this; }
        public Builder scriptMessages(Map<String, String> values) { if (values != null) scriptMessages.putAll(values); return this; }
        public Builder format(String formatName, UnaryOperator<String> formatter) { formats.put(formatName, formatter); return this; }

        public Locale build() {
            return new Locale(this);
        }
    }
}
