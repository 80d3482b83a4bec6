package com.ciro.jdirective.error;

/**
 * Falla de evaluación o de sintaxis de una expresión (condición, fuente de un
 * bucle, asignación o interpolación). Siempre se acumula, nunca aborta el render.
 */
public class ExpressionException extends TemplateException {

    private static final long serialVersionUID = 1L;

    private final String expression;

    public ExpressionException(String message, String expression) {
        super(message, Category.EXPRESSION);
        this.expression = expression;
    }

    public ExpressionException(String message, String expression, Throwable cause) {
        super(message, cause, Category.EXPRESSION);
        this.expression = expression;
    }

    /** Texto original de la expresión que falló. */
    public String expression() {
        return expression;
    }
}
