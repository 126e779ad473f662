package org.kidoni.expr;

/**
 * Base class of all failures raised while building, folding or differentiating expressions.
 */
public class ExpressionException extends RuntimeException {
    public ExpressionException() {
        super();
    }

    public ExpressionException(final String message) {
        super(message);
    }

    public ExpressionException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ExpressionException(final Throwable cause) {
        super(cause);
    }

    protected ExpressionException(final String message, final Throwable cause, final boolean enableSuppression, final boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
