package com.ciro.jdirective;

import com.ciro.jdirective.error.MarkupException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;

/**
 * Entrada/salida de markup sobre jsoup.
 */
public final class JsoupMarkup {

    private static final String DOCUMENT_OPEN = "<!DOCTYPE html><html lang=\"en-us\">";
    private static final String DOCUMENT_CLOSE = "</html>";

    private JsoupMarkup() {}

    /** Parsea un documento; un fragmento sin {@code <html} se envuelve en uno. */
    public static Document parse(String html) {
        if (html == null) {
            throw new MarkupException("Template source is null");
        }
        String source = html.contains("<html") ? html : DOCUMENT_OPEN + html + DOCUMENT_CLOSE;
        try {
            Document doc = Jsoup.parse(source, "", Parser.htmlParser());
            doc.outputSettings().prettyPrint(false);
            return doc;
        } catch (RuntimeException e) {
            throw new MarkupException("Cannot parse template: " + e.getMessage(), e);
        }
    }

    public static String serialize(Document doc) {
        return doc.outerHtml();
    }
}
