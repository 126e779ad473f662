package org.kidoni.expr;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.kidoni.expr.Expressions.add;
import static org.kidoni.expr.Expressions.div;
import static org.kidoni.expr.Expressions.mul;
import static org.kidoni.expr.Expressions.number;
import static org.kidoni.expr.Expressions.pow;
import static org.kidoni.expr.Expressions.sub;
import static org.kidoni.expr.Expressions.symbol;

class RendererTest {
    record Neg(Expr operand) implements Expr.Extension {
        @Override
        public List<Expr> operands() {
            return List.of(operand);
        }

        @Override
        public int precedence() {
            return TERMINAL_PRECEDENCE;
        }
    }

    private final Expr x = symbol("x");
    private final Expr y = symbol("y");
    private final Expr z = symbol("z");

    @Test
    void terminals() {
        assertEquals("5", number(5).toString());
        assertEquals("2.5", number(2.5).toString());
        assertEquals("x", x.toString());
    }

    @Test
    void simpleOperators() {
        assertEquals("x + 1", add(x, 1).toString());
        assertEquals("1 - x", sub(1, x).toString());
        assertEquals("x * y", mul(x, y).toString());
        assertEquals("x / 2", div(x, 2).toString());
        assertEquals("x ^ 3", pow(x, 3).toString());
    }

    @Test
    void lowerPrecedenceOperandsAreParenthesized() {
        assertEquals("(x + 1) * y", mul(add(x, 1), y).toString());
        assertEquals("y / (x - 1)", div(y, sub(x, 1)).toString());
        assertEquals("(x * y) ^ 2", pow(mul(x, y), 2).toString());
        assertEquals("x ^ (y + 1)", pow(x, add(y, 1)).toString());
    }

    @Test
    void higherPrecedenceOperandsAreNot() {
        assertEquals("x * y + z", add(mul(x, y), z).toString());
        assertEquals("x + y ^ 2", add(x, pow(y, 2)).toString());
    }

    @Test
    void equalPrecedenceIsNeverParenthesized() {
        assertEquals("x - y - z", sub(x, sub(y, z)).toString());
        assertEquals("x - y - z", sub(sub(x, y), z).toString());
        assertEquals("x / y * z", div(x, mul(y, z)).toString());
        assertEquals("x ^ y ^ z", pow(pow(x, y), z).toString());
        assertEquals("x + y - z", add(x, sub(y, z)).toString());
    }

    @Test
    void renderMatchesToString() {
        var e = div(add(x, 1), pow(y, 2));
        assertEquals(e.toString(), Renderer.render(e));
        assertEquals("(x + 1) / y ^ 2", Renderer.render(e));
    }

    @Test
    void deepExpressionRendersWithoutOverflow() {
        Expr e = x;
        for (int i = 0; i < 10_000; i++) {
            e = i % 2 == 0 ? add(e, 1) : sub(e, 1);
        }

        var rendered = e.toString();
        assertEquals(1 + 4 * 10_000, rendered.length());
        assertTrue(rendered.startsWith("x + 1 - 1 + 1"));
        assertTrue(rendered.endsWith("+ 1 - 1"));
    }

    @Test
    void extensionsRenderAsCalls() {
        assertEquals("Neg(x + 1)", Renderer.render(new Neg(add(x, 1))));
        assertEquals("Neg(x) * 2", mul(new Neg(x), 2).toString());
    }
}
