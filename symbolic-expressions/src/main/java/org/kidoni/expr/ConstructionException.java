package org.kidoni.expr;

/**
 * A terminal was given a payload of the wrong kind, e.g. a {@code null} symbol name.
 */
public class ConstructionException extends ExpressionException {
    public ConstructionException() {
        super();
    }

    public ConstructionException(final String message) {
        super(message);
    }

    public ConstructionException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ConstructionException(final Throwable cause) {
        super(cause);
    }

    protected ConstructionException(final String message, final Throwable cause, final boolean enableSuppression, final boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
