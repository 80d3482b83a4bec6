package com.ciro.jdirective;

/**
 * Entrada del mapa de bindings: la posición {@code key} de la salida se produjo
 * evaluando {@code expression}. El runtime del cliente usa {@code key} para
 * reevaluar solo ese fragmento.
 *
 * @param key        número de secuencia (único y creciente dentro del render)
 * @param kind       origen: atributo o texto
 * @param name       nombre del atributo, o {@code "text"}
 * @param expression texto original, antes de evaluar
 */
public record Binding(int key, Kind kind, String name, String expression) {

    public enum Kind { ATTR, TEXT }
}
