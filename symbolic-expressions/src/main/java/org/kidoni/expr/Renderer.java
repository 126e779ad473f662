package org.kidoni.expr;

import java.util.List;

import org.kidoni.expr.fold.FoldFunction;
import org.kidoni.expr.fold.PostorderFold;

/**
 * Renders expressions with the minimal parentheses implied by operator precedence.
 * <p>
 * An operand is parenthesized only when its precedence is strictly lower than its parent's,
 * so operands of equal precedence are never wrapped, even under {@code -} or {@code /}.
 */
public final class Renderer implements FoldFunction<Void, String> {
    public static final Renderer INSTANCE = new Renderer();

    private Renderer() {
    }

    public static String render(final Expr expr) {
        return PostorderFold.fold(expr, INSTANCE);
    }

    @Override
    public String apply(final Expr node, final List<String> operands, final Void params) {
        if (node instanceof Expr.OpExpr op) {
            return side(op, op.left(), operands.get(0)) + " " + op.op().glyph() + " "
                    + side(op, op.right(), operands.get(1));
        }
        if (node instanceof Expr.Extension) {
            return node.variant() + "(" + String.join(", ", operands) + ")";
        }
        return node.toString();
    }

    private static String side(final Expr parent, final Expr child, final String rendered) {
        return child.precedence() < parent.precedence() ? "(" + rendered + ")" : rendered;
    }
}
