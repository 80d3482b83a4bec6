package com.ciro.jdirective.template;

import com.ciro.jdirective.error.ExpressionException;

/**
 * Puerta de entrada al evaluador de expresiones. El motor de directivas solo
 * consume este contrato: no conoce la sintaxis de las expresiones.
 */
public interface ExpressionGateway {

    /**
     * Evalúa una expresión contra el contexto. Acepta la expresión desnuda
     * ({@code score > 50}) o envuelta en un único bloque {@code {{ ... }}}.
     *
     * @throws ExpressionException si la expresión no compila o falla al evaluarse
     */
    Object exec(String expression, DataContext ctx);

    /**
     * Sustituye cada bloque {@code {{ ... }}} del texto por su valor. Nunca lanza:
     * los bloques que fallan quedan como texto literal y el error viaja en el resultado.
     */
    Interpolation replace(String text, DataContext ctx);

    /** Asigna una variable con nombre en el contexto. */
    default void assign(DataContext ctx, String name, Object value) {
        ctx.put(name, value);
    }

    /** {@code true} si el texto contiene al menos un bloque {@code {{ ... }}}. */
    default boolean hasStatement(String text) {
        return text != null && StatementLexer.hasStatement(text);
    }
}
