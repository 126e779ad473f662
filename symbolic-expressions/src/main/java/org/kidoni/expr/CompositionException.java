package org.kidoni.expr;

/**
 * An operator was applied to an operand that is neither an {@link Expr} nor a number.
 */
public class CompositionException extends ExpressionException {
    public CompositionException() {
        super();
    }

    public CompositionException(final String message) {
        super(message);
    }

    public CompositionException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public CompositionException(final Throwable cause) {
        super(cause);
    }

    protected CompositionException(final String message, final Throwable cause, final boolean enableSuppression, final boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
