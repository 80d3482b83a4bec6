package com.ciro.jdirective.template;

import com.ciro.jdirective.error.ExpressionException;
import java.util.List;

/**
 * Resultado de {@link ExpressionGateway#replace}.
 *
 * @param text          texto con los bloques sustituidos
 * @param hadExpression {@code true} si el texto original contenía algún bloque
 * @param single        {@code true} si el texto era exactamente un bloque (sin texto alrededor)
 * @param value         valor sin convertir a texto cuando {@code single}; {@code null} en otro caso
 * @param errors        errores de los bloques que no se pudieron evaluar
 */
public record Interpolation(String text, boolean hadExpression, boolean single, Object value,
                            List<ExpressionException> errors) {

    public Interpolation {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static Interpolation unchanged(String text) {
        return new Interpolation(text, false, false, null, List.of());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
