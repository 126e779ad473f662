package org.kidoni.expr;

/**
 * Builders for expressions.
 * <p>
 * Each binary builder accepts a plain number on either side, which is wrapped in a
 * {@link Expr.NumberExpr} before the operator node is built.
 */
public final class Expressions {
    private Expressions() {
    }

    public static Expr number(final Number value) {
        return new Expr.NumberExpr(value);
    }

    public static Expr symbol(final String name) {
        return new Expr.SymbolExpr(name);
    }

    public static Expr add(final Expr left, final Expr right) {
        return combine(Op.ADD, left, right);
    }

    public static Expr add(final Expr left, final Number right) {
        return combine(Op.ADD, left, right);
    }

    public static Expr add(final Number left, final Expr right) {
        return combine(Op.ADD, left, right);
    }

    public static Expr sub(final Expr left, final Expr right) {
        return combine(Op.SUB, left, right);
    }

    public static Expr sub(final Expr left, final Number right) {
        return combine(Op.SUB, left, right);
    }

    public static Expr sub(final Number left, final Expr right) {
        return combine(Op.SUB, left, right);
    }

    public static Expr mul(final Expr left, final Expr right) {
        return combine(Op.MUL, left, right);
    }

    public static Expr mul(final Expr left, final Number right) {
        return combine(Op.MUL, left, right);
    }

    public static Expr mul(final Number left, final Expr right) {
        return combine(Op.MUL, left, right);
    }

    public static Expr div(final Expr left, final Expr right) {
        return combine(Op.DIV, left, right);
    }

    public static Expr div(final Expr left, final Number right) {
        return combine(Op.DIV, left, right);
    }

    public static Expr div(final Number left, final Expr right) {
        return combine(Op.DIV, left, right);
    }

    public static Expr pow(final Expr left, final Expr right) {
        return combine(Op.POW, left, right);
    }

    public static Expr pow(final Expr left, final Number right) {
        return combine(Op.POW, left, right);
    }

    public static Expr pow(final Number left, final Expr right) {
        return combine(Op.POW, left, right);
    }

    /**
     * Builds {@code left op right} from operands of any type.
     *
     * @throws CompositionException if an operand is neither an {@link Expr} nor a {@link Number}
     */
    public static Expr combine(final Op op, final Object left, final Object right) {
        return new Expr.OpExpr(op, operand(op, left), operand(op, right));
    }

    /**
     * Coerces a value to an operand: expressions pass through, numbers are wrapped.
     *
     * @throws CompositionException for any other value, including {@code null}
     */
    public static Expr operand(final Op op, final Object value) {
        if (value instanceof Expr expr) {
            return expr;
        }
        if (value instanceof Number n) {
            try {
                return number(n);
            }
            catch (ConstructionException e) {
                throw new CompositionException("unsupported operand for " + op.glyph() + ": "
                        + n.getClass().getName(), e);
            }
        }
        throw new CompositionException("unsupported operand for " + op.glyph() + ": "
                + (value == null ? "null" : value.getClass().getName()));
    }
}
