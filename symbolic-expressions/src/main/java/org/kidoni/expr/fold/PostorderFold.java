package org.kidoni.expr.fold;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.kidoni.expr.Expr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bottom-up evaluation of a {@link FoldFunction} over an expression graph.
 * <p>
 * The walk uses an explicit stack, so the depth of an expression is bounded by the heap and not
 * by the call stack. Results are memoized by node identity: a node shared by several parents is
 * folded once and its value reused by each of them, while structurally equal nodes built
 * independently are folded separately.
 * <p>
 * All state is local to one call, so folds over the same expression may run concurrently.
 */
public final class PostorderFold {
    private static final Logger log = LoggerFactory.getLogger(PostorderFold.class);

    private PostorderFold() {
    }

    public static <R> R fold(final Expr root, final FoldFunction<Void, R> fn) {
        return fold(root, fn, null);
    }

    public static <P, R> R fold(final Expr root, final FoldFunction<P, R> fn, final P params) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(fn, "fn");

        final Deque<Expr> stack = new ArrayDeque<>();
        final Map<Expr, R> memo = new IdentityHashMap<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            final Expr e = stack.pop();
            if (memo.containsKey(e)) {
                // pushed again through another parent before it was resolved
                continue;
            }

            final List<Expr> operands = e.operands();
            final List<Expr> pending = new ArrayList<>(operands.size());
            for (Expr operand : operands) {
                if (!memo.containsKey(operand)) {
                    pending.add(operand);
                }
            }

            if (pending.isEmpty()) {
                final List<R> results = new ArrayList<>(operands.size());
                for (Expr operand : operands) {
                    results.add(memo.get(operand));
                }
                log.trace("folding {}", e.variant());
                memo.put(e, fn.apply(e, results, params));
            }
            else {
                stack.push(e);
                pending.forEach(stack::push);
            }
        }

        log.debug("folded {} distinct nodes under {}", memo.size(), root.variant());
        return memo.get(root);
    }

    /**
     * Number of distinct node instances reachable from {@code root}.
     */
    public static int count(final Expr root) {
        final int[] visits = {0};
        fold(root, (node, operands, params) -> {
            ++visits[0];
            return null;
        });
        return visits[0];
    }
}
