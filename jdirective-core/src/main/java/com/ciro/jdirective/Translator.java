package com.ciro.jdirective;

import com.ciro.jdirective.directive.Directive;
import com.ciro.jdirective.directive.DirectiveSet;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Traducción y escape de literales dentro de los bloques {@code {{ ... }}},
 * antes de que lleguen al registro de bindings.
 *
 * <p>Un literal {@code '::Hola'} es traducible; {@code ':::Hola'} es un escape y
 * queda como {@code '::Hola'} sin traducir.
 */
final class Translator {

    static final Pattern STMT = Pattern.compile("\\{\\{([\\s\\S]*?)\\}\\}");
    static final Pattern TRANS_SINGLE = Pattern.compile("'::([\\s\\S]*?)'");
    static final Pattern TRANS_DOUBLE = Pattern.compile("\"::([\\s\\S]*?)\"");

    private static final String[][] ESCAPES = {
        {"':::", "'::"},
        {"&#39;:::", "&#39;::"},
        {"\":::", "\"::"},
        {"&#34;:::", "&#34;::"},
    };

    private final Locale locale;

    Translator(Locale locale) {
        this.locale = locale;
    }

    // ---------------------------------------------------------------- nodos

    /** Aplica {@code s:trans-node}, {@code s:trans-escape} y {@code s:trans-text} del padre. */
    void translateText(TextNode node) {
        if (!(node.parent() instanceof Element parent)) return;

        String whole = node.getWholeText();
        String text = whole.trim();
        if (text.isEmpty()) return;

        String original = text;
        String nodeKey = attr(parent, Directive.TRANS_NODE);
        if (nodeKey != null) {
            text = translateNode(nodeKey, text);
        }
        if (attr(parent, Directive.TRANS_ESCAPE) != null) {
            text = escapeText(text);
        }
        String keys = attr(parent, Directive.TRANS_TEXT);
        if (keys != null) {
            text = translateText(text, splitKeys(keys));
        }

        if (!text.equals(original)) {
            node.text(replaceTrimmed(whole, original, text));
        }
    }

    /** Aplica cada {@code s:trans-attr-<nombre>} sobre el atributo {@code <nombre>}. */
    void translateAttributes(Element el, DirectiveSet directives) {
        for (Map.Entry<String, String> e : directives.translatedAttributes().entrySet()) {
            String name = e.getKey();
            String value = el.attr(name);
            if (value.isEmpty()) continue;
            el.attr(name, translateText(value, splitKeys(e.getValue())));
        }
    }

    /** {@code s:trans-fmt}: sustituye el texto del elemento por el formato con nombre. */
    void format(Document doc) {
        if (locale == null) return;
        String directive = Directive.TRANS_FMT.attribute();
        for (Element el : doc.getAllElements()) {
            if (!el.hasAttr(directive)) continue;
            el.text(locale.format(el.attr(directive), el.text()));
        }
    }

    // ---------------------------------------------------------------- texto

    /** Traducción de nodo completo: {@code keys[key]} y después {@code messages[texto]}. */
    String translateNode(String key, String message) {
        return lookup(key, message);
    }

    /**
     * Traduce los literales marcados de cada bloque. La i-ésima marca del texto
     * usa la i-ésima clave; si faltan claves se busca solo por el literal.
     * Cada bloque se reescribe en su sitio.
     */
    String translateText(String content, List<String> keys) {
        Matcher stmts = STMT.matcher(content);
        StringBuilder out = new StringBuilder();
        int keyIndex = 0;

        while (stmts.find()) {
            String inner = stmts.group(1);
            String stmt = inner.trim();
            String rewritten;
            if (isEscaped(stmt)) {
                rewritten = replaceTrimmed(inner, stmt, escape(stmt));
            } else {
                Pattern pattern = TRANS_SINGLE.matcher(stmt).find() ? TRANS_SINGLE : TRANS_DOUBLE;
                char quote = pattern == TRANS_SINGLE ? '\'' : '"';
                Matcher lits = pattern.matcher(inner);
                StringBuilder block = new StringBuilder();
                while (lits.find()) {
                    String key = keyIndex < keys.size() ? keys.get(keyIndex) : null;
                    keyIndex++;
                    String translated = lookup(key, lits.group(1).trim());
                    lits.appendReplacement(block, Matcher.quoteReplacement(quote + quote(translated, quote) + quote));
                }
                lits.appendTail(block);
                rewritten = block.toString();
            }
            stmts.appendReplacement(out, Matcher.quoteReplacement("{{" + rewritten + "}}"));
        }
        stmts.appendTail(out);
        return out.toString();
    }

    /** Reescribe {@code ':::x'} como {@code '::x'} en cada bloque. */
    String escapeText(String content) {
        Matcher m = STMT.matcher(content);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String inner = m.group(1);
            String text = inner.trim();
            m.appendReplacement(out, Matcher.quoteReplacement("{{" + replaceTrimmed(inner, text, escape(text)) + "}}"));
        }
        m.appendTail(out);
        return out.toString();
    }

    static String escape(String value) {
        for (String[] e : ESCAPES) {
            if (value.startsWith(e[0])) return e[1] + value.substring(e[0].length());
        }
        return value;
    }

    static boolean isEscaped(String value) {
        for (String[] e : ESCAPES) {
            if (value.startsWith(e[0])) return true;
        }
        return false;
    }

    private String lookup(String key, String message) {
        if (locale == null) return message;

        if (key != null && !key.isEmpty()) {
            String byKey = locale.keys().get(key);
            // Una clave que resuelve al propio literal es un placeholder
            if (byKey != null && !byKey.equals(message)) return byKey;
        }
        String byMessage = locale.messages().get(message);
        return byMessage != null ? byMessage : message;
    }

    // ---------------------------------------------------------------- utilidades

    // Sustituye el contenido recortado conservando los espacios de alrededor
    private static String replaceTrimmed(String inner, String trimmed, String replacement) {
        int lead = inner.indexOf(trimmed);
        return inner.substring(0, lead) + replacement + inner.substring(lead + trimmed.length());
    }

    private static String quote(String text, char quote) {
        return text.replace(String.valueOf(quote), "\\" + quote);
    }

    static List<String> splitKeys(String keys) {
        return Arrays.stream(keys.split(",")).map(String::trim).toList();
    }

    private static String attr(Node node, Directive d) {
        return node.hasAttr(d.attribute()) ? node.attr(d.attribute()) : null;
    }
}
