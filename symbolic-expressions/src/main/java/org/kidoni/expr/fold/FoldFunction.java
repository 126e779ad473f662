package org.kidoni.expr.fold;

import java.util.List;

import org.kidoni.expr.Expr;

/**
 * Computes the value of one node from the already computed values of its operands.
 *
 * @param <P> type of the parameters passed unchanged to every invocation
 * @param <R> type of the folded value
 */
@FunctionalInterface
public interface FoldFunction<P, R> {
    /**
     * @param node the node being folded
     * @param operands the folded values of {@code node.operands()}, in the same order
     * @param params the parameters given to {@link PostorderFold#fold(Expr, FoldFunction, Object)}
     */
    R apply(Expr node, List<R> operands, P params);
}
