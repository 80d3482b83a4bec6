package com.ciro.jdirective;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scripts que acompañan al documento: mensajes del idioma en el {@code <head>}
 * y el contexto de datos final en el {@code <body>} para que el cliente hidrate.
 */
final class Injector {

    private static final Logger log = LoggerFactory.getLogger(Injector.class);

    static final String LOCALE_SCRIPT = "sui-locale";
    static final String DATA_SCRIPT = "sui-data";

    private final ObjectMapper mapper;

    Injector(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    void injectHead(Document doc, Locale locale) {
        Element head = doc.head();
        if (head == null) return;

        Map<String, String> messages = (locale != null) ? locale.scriptMessages() : Map.of();
        String json = toJson(messages, "{}");
        head.append(script(LOCALE_SCRIPT, "self.__sui_locale = " + json + ";"));
    }

    void injectBody(Document doc, Map<String, Object> data, boolean debug) {
        Element body = doc.body();
        if (body == null) return;

        String json = toJson(data, null);
        if (json == null) {
            json = toJson(Map.of("error", "data is not serializable"), "{}");
        }
        StringBuilder js = new StringBuilder("self.__sui_data = ").append(json).append(";");
        if (debug) {
            js.append(" self.__sui_debug = true;");
        }
        body.append(script(DATA_SCRIPT, js.toString()));
    }

    private String toJson(Object value, String fallback) {
        try {
            // "</" cerraría el <script> antes de tiempo
            return mapper.writeValueAsString(value).replace("</", "<\\/");
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialize injection payload: {}", e.getOriginalMessage());
            return fallback;
        }
    }

    private static String script(String name, String body) {
        return "<script name=\"" + name + "\" type=\"text/javascript\">" + body + "</script>";
    }
}
