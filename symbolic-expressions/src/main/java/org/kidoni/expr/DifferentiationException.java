package org.kidoni.expr;

/**
 * An expression has no derivative under the supported rules, e.g. a power whose exponent
 * depends on the differentiation variable.
 */
public class DifferentiationException extends ExpressionException {
    public DifferentiationException() {
        super();
    }

    public DifferentiationException(final String message) {
        super(message);
    }

    public DifferentiationException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public DifferentiationException(final Throwable cause) {
        super(cause);
    }

    protected DifferentiationException(final String message, final Throwable cause, final boolean enableSuppression, final boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
