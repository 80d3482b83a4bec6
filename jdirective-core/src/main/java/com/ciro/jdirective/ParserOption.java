package com.ciro.jdirective;

/**
 * Opciones de un render.
 */
public class ParserOption {

    /** Render de un componente: sin inyección de datos en el body. */
    private boolean component;
    /** Modo autor: conserva ramas y plantillas ocultas (marcadas) y devuelve solo el body. */
    private boolean editor;
    /** Vista previa: elimina lo oculto y limpia andamiaje, igual que request. */
    private boolean preview;
    private boolean debug;
    private boolean disableCache;
    /** Render para el cliente final: elimina lo oculto y limpia andamiaje. */
    private boolean request;
    private String route;
    private Locale locale;

    public static ParserOption defaults() {
        return new ParserOption();
    }

    /** Copia independiente: cambiarla no afecta a esta. */
    public ParserOption copy() {
        return new ParserOption()
            .setComponent(component)
            .setEditor(editor)
            .setPreview(preview)
            .setDebug(debug)
            .setDisableCache(disableCache)
            .setRequest(request)
            .setRoute(route)
            .setLocale(locale);
    }

    public boolean isComponent() { return component; }
    public ParserOption setComponent(boolean component) { this.component = component; return this; }

    public boolean isEditor() { return editor; }
    public ParserOption setEditor(boolean editor) { this.editor = editor; return this; }

    public boolean isPreview() { return preview; }
    public ParserOption setPreview(boolean preview) { this.preview = preview; return this; }

    public boolean isDebug() { return debug; }
    public ParserOption setDebug(boolean debug) { this.debug = debug; return this; }

    public boolean isDisableCache() { return disableCache; }
    public ParserOption setDisableCache(boolean disableCache) { this.disableCache = disableCache; return this; }

    public boolean isRequest() { return request; }
    public ParserOption setRequest(boolean request) { this.request = request; return this; }

    public String getRoute() { return route; }
    public ParserOption setRoute(String route) { this.route = route; return this; }

    public Locale getLocale() { return locale; }
    public ParserOption setLocale(Locale locale) { this.locale = locale; return this; }

    /** Debug implica no usar caché. */
    public boolean cacheDisabled() {
        return disableCache || debug;
    }

    /** Salida destinada directamente al cliente (sin andamiaje). */
    public boolean isClientOutput() {
        return !editor && (request || preview);
    }
}
