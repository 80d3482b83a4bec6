package com.ciro.jdirective.runtime;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Configuración del motor. Se carga de {@code jdirective.properties} en el
 * classpath y cada clave se puede sobrescribir con la propiedad de sistema
 * {@code jdirective.<clave>}.
 */
public class EngineConfig {

    public static final String RESOURCE = "jdirective.properties";
    public static final String PREFIX = "jdirective.";

    /** Directorio de páginas */
    private String templateRoot = "templates";
    /** Directorio de componentes ({@code <x is="nombre">} → {@code nombre.html}) */
    private String componentRoot = "components";
    /** Directorio de idiomas ({@code <nombre>.json}) */
    private String localeRoot = "locales";
    private String templateSuffix = ".html";
    /** Idioma por defecto cuando el render no pide ninguno; vacío = sin traducción */
    private String defaultLocale = "";

    private long cacheMaxSize = 1_000;
    private long cacheExpireMinutes = 30;
    private boolean disableCache = false;
    private boolean debug = false;
    /** Loguear en WARN los errores acumulados de renders request/preview */
    private boolean logRenderErrors = true;

    public static EngineConfig load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static EngineConfig load(ClassLoader cl) {
        Properties props = new Properties();
        try (InputStream in = cl == null ? null : cl.getResourceAsStream(RESOURCE)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                props.setProperty(name.substring(PREFIX.length()), System.getProperty(name));
            }
        }
        return from(props);
    }

    /** Claves sin prefijo: {@code templateRoot}, {@code cacheMaxSize}, ... */
    public static EngineConfig from(Properties props) {
        EngineConfig c = new EngineConfig();
        c.setTemplateRoot(props.getProperty("templateRoot", c.templateRoot));
        c.setComponentRoot(props.getProperty("componentRoot", c.componentRoot));
        c.setLocaleRoot(props.getProperty("localeRoot", c.localeRoot));
        c.setTemplateSuffix(props.getProperty("templateSuffix", c.templateSuffix));
        c.setDefaultLocale(props.getProperty("defaultLocale", c.defaultLocale));
        c.setCacheMaxSize(parseLong(props, "cacheMaxSize", c.cacheMaxSize));
        c.setCacheExpireMinutes(parseLong(props, "cacheExpireMinutes", c.cacheExpireMinutes));
        c.setDisableCache(parseBoolean(props, "disableCache", c.disableCache));
        c.setDebug(parseBoolean(props, "debug", c.debug));
        c.setLogRenderErrors(parseBoolean(props, "logRenderErrors", c.logRenderErrors));
        return c;
    }

    private static long parseLong(Properties props, String key, long fallback) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return fallback;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + v, e);
        }
    }

    private static boolean parseBoolean(Properties props, String key, boolean fallback) {
        String v = props.getProperty(key);
        return (v == null || v.isBlank()) ? fallback : Boolean.parseBoolean(v.trim());
    }

    /** Debug implica no usar caché. */
    public boolean cacheDisabled() {
        return disableCache || debug;
    }

    public String getTemplateRoot() { return templateRoot; }
    public void setTemplateRoot(String templateRoot) { this.templateRoot = templateRoot; }

    public String getComponentRoot() { return componentRoot; }
    public void setComponentRoot(String componentRoot) { this.componentRoot = componentRoot; }

    public String getLocaleRoot() { return localeRoot; }
    public void setLocaleRoot(String localeRoot) { this.localeRoot = localeRoot; }

    public String getTemplateSuffix() { return templateSuffix; }
    public void setTemplateSuffix(String templateSuffix) { this.templateSuffix = templateSuffix; }

    public String getDefaultLocale() { return defaultLocale; }
    public void setDefaultLocale(String defaultLocale) { this.defaultLocale = defaultLocale; }

    public long getCacheMaxSize() { return cacheMaxSize; }
    public void setCacheMaxSize(long cacheMaxSize) { this.cacheMaxSize = cacheMaxSize; }

    public long getCacheExpireMinutes() { return cacheExpireMinutes; }
    public void setCacheExpireMinutes(long cacheExpireMinutes) { this.cacheExpireMinutes = cacheExpireMinutes; }

    public boolean isDisableCache() { return disableCache; }
    public void setDisableCache(boolean disableCache) { this.disableCache = disableCache; }

    public boolean isDebug() { return debug; }
    public void setDebug(boolean debug) { this.debug = debug; }

    public boolean isLogRenderErrors() { return logRenderErrors; }
    public void setLogRenderErrors(boolean logRenderErrors) { this.logRenderErrors = logRenderErrors; }
}
