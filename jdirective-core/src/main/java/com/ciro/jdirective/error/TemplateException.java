package com.ciro.jdirective.error;

/**
 * Base de todos los errores del motor de directivas.
 * Nunca se lanza directamente: usar {@link ExpressionException},
 * {@link LoopSourceException} o {@link MarkupException}.
 */
public abstract class TemplateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Categoría del error. Solo {@link Category#STRUCTURAL} aborta un render. */
    public enum Category {
        EXPRESSION,
        SHAPE,
        STRUCTURAL
    }

    private final Category category;

    protected TemplateException(String message, Category category) {
        super(message);
        this.category = category;
    }

    protected TemplateException(String message, Throwable cause, Category category) {
        super(message, cause);
        this.category = category;
    }

    public Category category() {
        return category;
    }

    public boolean isFatal() {
        return category == Category.STRUCTURAL;
    }
}
