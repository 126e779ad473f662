package org.kidoni.expr;

import java.util.List;

import org.kidoni.expr.fold.FoldFunction;
import org.kidoni.expr.fold.PostorderFold;

/**
 * Renders the structure of an expression, e.g. {@code Add(Mul('x', 2), 1)}.
 * <p>
 * Symbols are quoted and every operator is written as its variant name applied to its operands,
 * so two expressions with different shapes never produce the same text.
 */
public final class Repr implements FoldFunction<Void, String> {
    public static final Repr INSTANCE = new Repr();

    private Repr() {
    }

    public static String repr(final Expr expr) {
        return PostorderFold.fold(expr, INSTANCE);
    }

    @Override
    public String apply(final Expr node, final List<String> operands, final Void params) {
        if (node instanceof Expr.NumberExpr number) {
            return String.valueOf(number.value());
        }
        if (node instanceof Expr.SymbolExpr symbol) {
            return quote(symbol.name());
        }
        return node.variant() + "(" + String.join(", ", operands) + ")";
    }

    private static String quote(final String name) {
        return "'" + name.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
