package org.calista.alchemist.dictionary;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.alchemist.expr.Expr;
import org.calista.alchemist.expr.Operator;
import org.calista.alchemist.number.ArithmeticDomainException;
import org.calista.alchemist.number.Rational;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DictionaryMerger — cross product of two dictionaries under every binary operator.
 *
 * <p>
 * For each pair {@code (a, b)}: {@code a+b}, {@code a-b}, {@code a*b}, {@code a%b};
 * {@code a/b} only when the quotient is an integer; {@code a^b} only when both magnitudes
 * are within the decimal length of the bound. Undefined results skip that operator for that
 * pair and nothing else.
 * </p>
 */
public final class DictionaryMerger {

    private static final Logger log = LogManager.getLogger(DictionaryMerger.class);

    private final Rational exponentLimit;

    /**
     * @param bound conventionally the base digits repeated twice; only its length matters
     */
    public DictionaryMerger(String bound) {
        Objects.requireNonNull(bound, "bound");
        this.exponentLimit = Rational.of(bound.length());
    }

    public Rational exponentLimit() {
        return exponentLimit;
    }

    public ExpressionDictionary merge(ExpressionDictionary left, ExpressionDictionary right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");

        List<Rational> lk = new ArrayList<>(left.size());
        List<Expr> lv = new ArrayList<>(left.size());
        unpack(left, lk, lv);
        List<Rational> rk = new ArrayList<>(right.size());
        List<Expr> rv = new ArrayList<>(right.size());
        unpack(right, rk, rv);

        ExpressionDictionary out = new ExpressionDictionary();
        long skipped = 0;

        for (int i = 0; i < lk.size(); i++) {
            Rational a = lk.get(i);
            Expr ea = lv.get(i);
            for (int j = 0; j < rk.size(); j++) {
                Rational b = rk.get(j);
                Expr eb = rv.get(j);

                out.add(a.add(b), Expr.of(Operator.ADD, ea, eb));
                out.add(a.subtract(b), Expr.of(Operator.SUBTRACT, ea, eb));
                out.add(a.multiply(b), Expr.of(Operator.MULTIPLY, ea, eb));

                if (b.isZero()) {
                    skipped += 2; // % and /
                } else {
                    out.add(a.mod(b), Expr.of(Operator.MODULO, ea, eb));
                    Rational q = a.divide(b);
                    if (q.isInteger()) out.add(q, Expr.of(Operator.DIVIDE, ea, eb));
                }

                if (a.abs().greaterThan(exponentLimit) || b.abs().greaterThan(exponentLimit)) continue;
                try {
                    out.add(a.pow(b), Expr.of(Operator.POWER, ea, eb));
                } catch (ArithmeticDomainException e) {
                    skipped++;
                }
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("merge {}x{} -> {} entries ({} undefined skipped)", lk.size(), rk.size(), out.size(), skipped);
        }
        return out;
    }

    private static void unpack(ExpressionDictionary d, List<Rational> keys, List<Expr> values) {
        for (Map.Entry<String, Expr> e : d.entries().entrySet()) {
            keys.add(Rational.parse(e.getKey()));
            values.add(e.getValue());
        }
    }
}
