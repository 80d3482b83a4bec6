package com.ciro.jdirective;

/**
 * Atributos que el motor escribe en la salida (no son directivas de autor).
 */
public final class Markers {

    /** Rama/plantilla oculta en modo render. Request y preview eliminan estos nodos. */
    public static final String HIDE = "sui-hide";
    /** Rama/plantilla oculta en modo autor (se conserva en el árbol para el editor). */
    public static final String EDITOR_HIDE = "data-sui-hide";
    /** Clon generado por un bucle, solo en modo autor. */
    public static final String EDITOR_GENERATE = "data-sui-generate";
    /** Error de evaluación pegado al nodo que lo produjo. */
    public static final String ERROR = "s:error";

    /** {@code s:key-<prefijo>}: claves estructurales (if, for, for-item-index, for-item-key, text). */
    public static final String KEY_PREFIX = "s:key-";
    /** {@code s:bind:<atributo>}: expresión original de un atributo interpolado. */
    public static final String BIND_ATTR_PREFIX = "s:bind:";
    /** {@code s:key-attr-<atributo>}: clave de secuencia de un atributo interpolado. */
    public static final String KEY_ATTR_PREFIX = "s:key-attr-";
    /** Expresión original del texto interpolado, sobre el elemento padre. */
    public static final String BIND_TEXT = "s:bind";
    /** Claves de secuencia de los textos interpolados, sobre el elemento padre. */
    public static final String KEY_TEXT = "s:key-text";
    /** Separador de {@link #KEY_TEXT} cuando el padre tiene varios textos. */
    public static final String KEY_SEPARATOR = ",";

    private Markers() {}

    public static String key(String prefix) {
        return KEY_PREFIX + prefix;
    }
}
