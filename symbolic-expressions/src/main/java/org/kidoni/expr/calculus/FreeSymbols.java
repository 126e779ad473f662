package org.kidoni.expr.calculus;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.kidoni.expr.Expr;
import org.kidoni.expr.fold.FoldFunction;
import org.kidoni.expr.fold.PostorderFold;

/**
 * Collects the names of the symbols occurring in an expression.
 */
public final class FreeSymbols implements FoldFunction<Void, Set<String>> {
    public static final FreeSymbols INSTANCE = new FreeSymbols();

    private FreeSymbols() {
    }

    public static Set<String> of(final Expr expr) {
        return Set.copyOf(PostorderFold.fold(expr, INSTANCE));
    }

    @Override
    public Set<String> apply(final Expr node, final List<Set<String>> operands, final Void params) {
        if (node instanceof Expr.SymbolExpr symbol) {
            return Set.of(symbol.name());
        }
        if (operands.isEmpty()) {
            return Set.of();
        }
        if (operands.size() == 1) {
            return operands.get(0);
        }

        final Set<String> names = new HashSet<>();
        operands.forEach(names::addAll);
        return names;
    }
}
