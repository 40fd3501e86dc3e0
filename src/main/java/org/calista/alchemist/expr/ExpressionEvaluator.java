package org.calista.alchemist.expr;

import org.calista.alchemist.number.Rational;

import java.util.Objects;

/**
 * Exact evaluator for arithmetic text (target input, rendered proofs).
 *
 * <pre>
 * expr    := term (('+' | '-') term)*
 * term    := power (('*' | '/' | '%') power)*
 * power   := unary (('^' | '**') power)?
 * unary   := '-' unary | '+' unary | primary
 * primary := number | '(' expr ')'
 * </pre>
 *
 * Unary minus binds tighter than {@code ^}, matching how {@link Expr} renders.
 */
public final class ExpressionEvaluator {

    private final String src;
    private int pos;

    private ExpressionEvaluator(String src) {
        this.src = src;
    }

    /**
     * @throws ExpressionSyntaxException on malformed text
     * @throws org.calista.alchemist.number.ArithmeticDomainException on undefined arithmetic
     */
    public static Rational evaluate(String text) {
        Objects.requireNonNull(text, "text");
        ExpressionEvaluator p = new ExpressionEvaluator(text);
        p.skipWs();
        if (p.atEnd()) throw new ExpressionSyntaxException("Empty expression", 0);
        Rational v = p.expr();
        p.skipWs();
        if (!p.atEnd()) throw new ExpressionSyntaxException("Unexpected '" + p.src.charAt(p.pos) + "'", p.pos);
        return v;
    }

    /** Rewrites {@code ^} as {@code **} for evaluators that use that exponent syntax. */
    public static String toHostSyntax(String rendered) {
        return Objects.requireNonNull(rendered, "rendered").replace("^", "**");
    }

    // ---------------------------------------------------------------------
    // Grammar
    // ---------------------------------------------------------------------

    private Rational expr() {
        Rational v = term();
        while (true) {
            if (eat('+')) v = v.add(term());
            else if (eat('-')) v = v.subtract(term());
            else return v;
        }
    }

    private Rational term() {
        Rational v = power();
        while (true) {
            if (eat('*')) v = v.multiply(power());
            else if (eat('/')) v = v.divide(power());
            else if (eat('%')) v = v.mod(power());
            else return v;
        }
    }

    private Rational power() {
        Rational base = unary();
        skipWs();
        if (src.startsWith("**", pos)) {
            pos += 2;
            return base.pow(power());
        }
        if (eat('^')) return base.pow(power());
        return base;
    }

    private Rational unary() {
        if (eat('-')) return unary().negate();
        if (eat('+')) return unary();
        return primary();
    }

    private Rational primary() {
        skipWs();
        if (eat('(')) {
            Rational v = expr();
            if (!eat(')')) throw new ExpressionSyntaxException("Expected ')'", pos);
            return v;
        }
        int start = pos;
        while (!atEnd() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '.')) pos++;
        if (start == pos) {
            throw new ExpressionSyntaxException(atEnd() ? "Unexpected end of input" : "Unexpected '" + src.charAt(pos) + "'", pos);
        }
        String literal = src.substring(start, pos);
        try {
            return Rational.parse(literal);
        } catch (NumberFormatException e) {
            throw new ExpressionSyntaxException("Bad number '" + literal + "'", start);
        }
    }

    // ---------------------------------------------------------------------
    // Lexing helpers
    // ---------------------------------------------------------------------

    private boolean eat(char c) {
        skipWs();
        if (!atEnd() && src.charAt(pos) == c) {
            pos++;
            return true;
        }
        return false;
    }

    private void skipWs() {
        while (!atEnd() && Character.isWhitespace(src.charAt(pos))) pos++;
    }

    private boolean atEnd() {
        return pos >= src.length();
    }
}
