package com.ciro.jdirective.error;

/**
 * La fuente de un {@code s:for} no se puede convertir en una secuencia ordenada.
 */
public final class LoopSourceException extends TemplateException {

    private static final long serialVersionUID = 1L;

    private final String expression;

    public LoopSourceException(String expression, Object value) {
        super("Cannot convert " + describe(value) + " to array", Category.SHAPE);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value + " (" + value.getClass().getSimpleName() + ")";
    }
}
