package com.ciro.jdirective.spi;

import com.ciro.jdirective.template.DataContext;
import org.jsoup.nodes.Element;

/**
 * Cargador de componentes JIT. El motor solo decide cuándo expandir; el
 * contenido de la expansión es opaco para él.
 */
public interface ComponentLoader {

    /** Cargador nulo: ningún elemento es componente. */
    ComponentLoader NONE = new ComponentLoader() {
        @Override public boolean isComponent(Element el) { return false; }
        @Override public void expand(Element el, DataContext data) { }
    };

    boolean isComponent(Element el);

    /**
     * Expande el componente en sitio: el elemento pasa a contener el subárbol
     * del componente. El motor recorre después ese subárbol y el finalizador
     * desenvuelve el elemento (marcado con {@code s:jit}).
     */
    void expand(Element el, DataContext data);
}
