package com.ciro.jdirective.template;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Contexto de datos mutable compartido por todo un render.
 *
 * <p>Las variables de bucle no copian el contexto: se apilan en un frame que
 * sombrea a la raíz y se descarta al cerrar el {@link Scope}, devolviendo a
 * cada nombre el valor que tenía antes del bucle.
 *
 * <p>No es thread-safe. Un contexto pertenece a un único render.
 */
public class DataContext {

    private final Map<String, Object> root;
    private final Deque<Map<String, Object>> frames = new ArrayDeque<>();

    public DataContext() {
        this(new LinkedHashMap<>());
    }

    /** Usa el mapa recibido como raíz (por referencia, no se copia). */
    public DataContext(Map<String, Object> root) {
        this.root = root != null ? root : new LinkedHashMap<>();
    }

    public static DataContext of(Map<String, ?> values) {
        return new DataContext(new LinkedHashMap<>(values));
    }

    /** Busca primero en los frames (del más interno al más externo) y luego en la raíz. */
    public Object get(String name) {
        for (Map<String, Object> frame : frames) {
            if (frame.containsKey(name)) return frame.get(name);
        }
        return root.get(name);
    }

    public boolean has(String name) {
        for (Map<String, Object> frame : frames) {
            if (frame.containsKey(name)) return true;
        }
        return root.containsKey(name);
    }

    /**
     * Asigna un nombre. Si un frame activo ya lo sombrea, escribe en ese frame;
     * si no, en la raíz (y sobrevive al bucle).
     */
    public void put(String name, Object value) {
        for (Map<String, Object> frame : frames) {
            if (frame.containsKey(name)) {
                frame.put(name, value);
                return;
            }
        }
        root.put(name, value);
    }

    public void remove(String name) {
        root.remove(name);
    }

    /** Abre un frame de sombreado. Debe cerrarse (try-with-resources). */
    public Scope push() {
        Map<String, Object> frame = new HashMap<>();
        frames.push(frame);
        return new Scope(frame);
    }

    public int depth() {
        return frames.size();
    }

    /** Vista de solo lectura de la raíz (sin variables de bucle). */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(root);
    }

    public final class Scope implements AutoCloseable {

        private final Map<String, Object> frame;
        private boolean closed;

        private Scope(Map<String, Object> frame) {
            this.frame = frame;
        }

        /** Sobrescribe la variable en este frame (no anida una copia por iteración). */
        public void bind(String name, Object value) {
            frame.put(name, value);
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            // Puede haber frames internos sin cerrar si alguien olvidó su Scope
            Iterator<Map<String, Object>> it = frames.iterator();
            while (it.hasNext()) {
                Map<String, Object> top = it.next();
                it.remove();
                if (top == frame) break;
            }
        }
    }
}
