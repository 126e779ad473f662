package org.kidoni.expr;

/**
 * The binary operators of {@link Expr.OpExpr}, with their precedence tier and display glyph.
 */
public enum Op {
    ADD("Add", "+", 0),
    SUB("Sub", "-", 0),
    MUL("Mul", "*", 1),
    DIV("Div", "/", 1),
    POW("Pow", "^", 2);

    private final String displayName;
    private final String glyph;
    private final int precedence;

    Op(final String displayName, final String glyph, final int precedence) {
        this.displayName = displayName;
        this.glyph = glyph;
        this.precedence = precedence;
    }

    public String displayName() {
        return displayName;
    }

    public String glyph() {
        return glyph;
    }

    public int precedence() {
        return precedence;
    }
}
