package org.kidoni.expr;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.kidoni.expr.Expressions.add;
import static org.kidoni.expr.Expressions.div;
import static org.kidoni.expr.Expressions.mul;
import static org.kidoni.expr.Expressions.number;
import static org.kidoni.expr.Expressions.pow;
import static org.kidoni.expr.Expressions.sub;
import static org.kidoni.expr.Expressions.symbol;
import static org.kidoni.expr.Repr.repr;
import static org.kidoni.expr.calculus.Differentiator.differentiate;

class ReprTest {
    private final Expr x = symbol("x");
    private final Expr y = symbol("y");

    @Test
    void terminals() {
        assertEquals("3", repr(number(3)));
        assertEquals("2.5", repr(number(2.5)));
        assertEquals("'x'", repr(x));
        assertEquals("'it\\'s'", repr(symbol("it's")));
    }

    @Test
    void operators() {
        assertEquals("Add('x', 1)", repr(add(x, 1)));
        assertEquals("Sub(1, 'x')", repr(sub(1, x)));
        assertEquals("Div(Mul('x', 'y'), Pow('y', 2))", repr(div(mul(x, y), pow(y, 2))));
    }

    @Test
    void showsShapeThatRenderingHides() {
        var right = sub(x, sub(y, 1));
        var left = sub(sub(x, y), 1);

        assertEquals(left.toString(), right.toString());
        assertNotEquals(repr(left), repr(right));
        assertEquals("Sub('x', Sub('y', 1))", repr(right));
    }

    @Test
    void showsUnsimplifiedDerivative() {
        assertEquals("Mul(Mul(3, Pow('x', Sub(3, 1))), 1)", repr(differentiate(pow(x, 3), "x")));
        assertEquals("Add(Mul(1, 'x'), Mul(1, 'x'))", repr(differentiate(mul(x, x), "x")));
    }

    @Test
    void extensionsUseTheirVariantName() {
        assertEquals("Neg(Add('x', 1))", repr(new RendererTest.Neg(add(x, 1))));
    }

    @Test
    void deepExpression() {
        Expr e = x;
        for (int i = 0; i < 10_000; i++) {
            e = add(e, 1);
        }

        assertEquals("Add(".repeat(10_000) + "'x'" + ", 1)".repeat(10_000), repr(e));
    }
}
