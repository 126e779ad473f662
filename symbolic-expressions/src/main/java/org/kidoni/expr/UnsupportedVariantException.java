package org.kidoni.expr;

/**
 * A fold function was applied to an expression variant it has no rule for.
 */
public class UnsupportedVariantException extends ExpressionException {
    private final String variant;

    public UnsupportedVariantException(final String variant, final String message) {
        super(message);
        this.variant = variant;
    }

    public UnsupportedVariantException(final String variant, final String message, final Throwable cause) {
        super(message, cause);
        this.variant = variant;
    }

    public static UnsupportedVariantException of(final Expr expr, final String operation) {
        return new UnsupportedVariantException(expr.variant(),
                "no " + operation + " rule for " + expr.variant());
    }

    public String variant() {
        return variant;
    }
}
