package org.kidoni.expr;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAccumulator;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;

/**
 * An immutable arithmetic expression node.
 * <p>
 * The core variants are numbers, symbols and binary operators. Nodes may be shared between
 * several parents, so an expression is in general a DAG rather than a tree. Records compare
 * structurally; anything that needs node identity (see {@code PostorderFold}) must not rely on
 * {@code equals}.
 * <p>
 * Variants defined outside this package implement {@link Extension}.
 */
public sealed interface Expr permits Expr.NumberExpr, Expr.SymbolExpr, Expr.OpExpr, Expr.Extension {
    int TERMINAL_PRECEDENCE = 3;

    /**
     * The child expressions, in order. Empty for terminals.
     */
    List<Expr> operands();

    int precedence();

    /**
     * Display name of the variant, e.g. {@code Number} or {@code Add}.
     */
    String variant();

    record NumberExpr(Number value) implements Expr {
        private static final Set<Class<?>> MUTABLE_NUMBERS = Set.of(
                AtomicInteger.class, AtomicLong.class, LongAdder.class,
                DoubleAdder.class, LongAccumulator.class, DoubleAccumulator.class);

        public NumberExpr {
            if (value == null) {
                throw new ConstructionException("Number value must be a number, got null");
            }
            if (MUTABLE_NUMBERS.contains(value.getClass())) {
                throw new ConstructionException("Number value must not be a mutable number, got "
                        + value.getClass().getName());
            }
        }

        @Override
        public List<Expr> operands() {
            return List.of();
        }

        @Override
        public int precedence() {
            return TERMINAL_PRECEDENCE;
        }

        @Override
        public String variant() {
            return "Number";
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record SymbolExpr(String name) implements Expr {
        public SymbolExpr {
            if (name == null) {
                throw new ConstructionException("Symbol value must be a string, got null");
            }
        }

        @Override
        public List<Expr> operands() {
            return List.of();
        }

        @Override
        public int precedence() {
            return TERMINAL_PRECEDENCE;
        }

        @Override
        public String variant() {
            return "Symbol";
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record OpExpr(Op op, Expr left, Expr right) implements Expr {
        public OpExpr {
            if (op == null || left == null || right == null) {
                throw new ConstructionException("operator and both operands are required");
            }
        }

        @Override
        public List<Expr> operands() {
            return List.of(left, right);
        }

        @Override
        public int precedence() {
            return op.precedence();
        }

        @Override
        public String variant() {
            return op.displayName();
        }

        @Override
        public String toString() {
            return Renderer.render(this);
        }
    }

    /**
     * Open extension point for variants beyond the core set. Fold functions that only know the
     * core variants reject these with {@link UnsupportedVariantException}.
     */
    non-sealed interface Extension extends Expr {
        @Override
        default String variant() {
            return getClass().getSimpleName();
        }
    }
}
