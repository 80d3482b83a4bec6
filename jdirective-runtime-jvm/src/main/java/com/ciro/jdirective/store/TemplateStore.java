package com.ciro.jdirective.store;

import java.util.function.Function;

/**
 * Caché de fuentes de plantilla (páginas y componentes) por nombre.
 */
public interface TemplateStore {

    /** Devuelve la fuente cacheada o la carga con {@code loader}. {@code null} si no existe. */
    String get(String name, Function<String, String> loader);

    void invalidate(String name);

    void invalidateAll();

    /** Store sin caché: siempre delega en el loader. */
    static TemplateStore direct() {
        return DirectTemplateStore.INSTANCE;
    }
}
