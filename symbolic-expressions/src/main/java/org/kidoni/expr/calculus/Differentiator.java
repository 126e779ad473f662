package org.kidoni.expr.calculus;

import java.util.List;
import java.util.Objects;

import org.kidoni.expr.DifferentiationException;
import org.kidoni.expr.Expr;
import org.kidoni.expr.UnsupportedVariantException;
import org.kidoni.expr.fold.FoldFunction;
import org.kidoni.expr.fold.PostorderFold;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.kidoni.expr.Expressions.add;
import static org.kidoni.expr.Expressions.div;
import static org.kidoni.expr.Expressions.mul;
import static org.kidoni.expr.Expressions.number;
import static org.kidoni.expr.Expressions.pow;
import static org.kidoni.expr.Expressions.sub;

/**
 * Symbolic differentiation with respect to a named variable.
 * <p>
 * The result is a new expression built from the sum, difference, product, quotient and power
 * rules, without any simplification. The original operands of a product, quotient or power are
 * shared into the result rather than copied.
 * <p>
 * Only constant exponents are supported: differentiating {@code a ^ b} where {@code b} mentions
 * the variable fails with {@link DifferentiationException}.
 */
public final class Differentiator implements FoldFunction<String, Expr> {
    private static final Logger log = LoggerFactory.getLogger(Differentiator.class);

    public static final Differentiator INSTANCE = new Differentiator();

    private Differentiator() {
    }

    /**
     * Derivative of {@code expr} with respect to {@code var}.
     */
    public static Expr differentiate(final Expr expr, final String var) {
        Objects.requireNonNull(var, "var");
        log.debug("differentiating {} with respect to {}", expr.variant(), var);
        return PostorderFold.fold(expr, INSTANCE, var);
    }

    @Override
    public Expr apply(final Expr node, final List<Expr> operands, final String var) {
        if (node instanceof Expr.NumberExpr) {
            return number(0);
        }
        if (node instanceof Expr.SymbolExpr symbol) {
            return number(symbol.name().equals(var) ? 1 : 0);
        }
        if (node instanceof Expr.OpExpr op) {
            return operator(op, operands.get(0), operands.get(1), var);
        }
        throw UnsupportedVariantException.of(node, "differentiation");
    }

    private static Expr operator(final Expr.OpExpr node, final Expr da, final Expr db, final String var) {
        final Expr a = node.left();
        final Expr b = node.right();

        return switch (node.op()) {
            case ADD -> add(da, db);
            case SUB -> sub(da, db);
            case MUL -> add(mul(da, b), mul(db, a));
            case DIV -> div(sub(mul(da, b), mul(a, db)), pow(b, 2));
            case POW -> {
                if (FreeSymbols.of(b).contains(var)) {
                    log.debug("exponent depends on {}", var);
                    throw new DifferentiationException("cannot differentiate a power whose exponent depends on " + var);
                }
                yield mul(mul(b, pow(a, sub(b, 1))), da);
            }
        };
    }
}
