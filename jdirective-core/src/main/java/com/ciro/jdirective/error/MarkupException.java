package com.ciro.jdirective.error;

/** Markup que no se pudo parsear. Es el único error fatal de un render. */
public final class MarkupException extends TemplateException {

    private static final long serialVersionUID = 1L;

    public MarkupException(String message) {
        super(message, Category.STRUCTURAL);
    }

    public MarkupException(String message, Throwable cause) {
        super(message, cause, Category.STRUCTURAL);
    }
}
