package org.calista.alchemist.expr;

import org.calista.alchemist.number.Rational;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/** Leaf: a literal numeral, rendered exactly as written (leading zeros included). */
final class NumberNode extends ExprNode {

    private static final Pattern NUMERAL = Pattern.compile("-?\\d+(\\.\\d+)?");

    final String numeral;

    NumberNode(String numeral) {
        Objects.requireNonNull(numeral, "numeral");
        if (!NUMERAL.matcher(numeral).matches()) {
            throw new IllegalArgumentException("Not a numeral: '" + numeral + "'");
        }
        this.numeral = numeral;
    }

    @Override
    String renderBare() {
        return numeral;
    }

    @Override
    Rational compute() {
        return Rational.parse(numeral);
    }

    @Override
    Trace computeTrace() {
        return new Trace(numeral, evaluate());
    }

    @Override
    Operator operator() {
        return null;
    }

    @Override
    List<Expr> children() {
        return List.of();
    }
}
