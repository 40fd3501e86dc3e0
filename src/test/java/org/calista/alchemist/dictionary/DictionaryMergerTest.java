package org.calista.alchemist.dictionary;

import org.calista.alchemist.expr.Expr;
import org.calista.alchemist.number.Rational;
import org.junit.Assert;
import org.junit.Test;

import java.util.Map;

public class DictionaryMergerTest {

    private static ExpressionDictionary single(String numeral) {
        ExpressionDictionary d = new ExpressionDictionary();
        d.put(Rational.parse(numeral).toString(), Expr.number(numeral));
        return d;
    }

    private static String render(ExpressionDictionary d, long key) {
        return d.get(Rational.of(key)).get().render();
    }

    @Test
    public void allOperatorsOfAPair() {
        ExpressionDictionary out = new DictionaryMerger("123").merge(single("2"), single("3"));

        Assert.assertEquals("2+3", render(out, 5));
        Assert.assertEquals("2-3", render(out, -1));
        Assert.assertEquals("2*3", render(out, 6));
        Assert.assertEquals("2%3", render(out, 2));
        Assert.assertEquals("2^3", render(out, 8));
        Assert.assertFalse("non-integral quotient", out.contains(Rational.parse("2/3")));

        Assert.assertEquals("-(2+3)", render(out, -5));
        Assert.assertEquals("-(2-3)", render(out, 1));
    }

    @Test
    public void exponentsBoundedByDecimalLengthOfBound() {
        DictionaryMerger merger = new DictionaryMerger("12");
        Assert.assertEquals(Rational.of(2), merger.exponentLimit());

        ExpressionDictionary out = merger.merge(single("2"), single("3"));
        Assert.assertFalse(out.contains(Rational.of(8)));

        out = merger.merge(single("3"), single("2"));
        Assert.assertFalse("base above limit", out.contains(Rational.of(9)));

        out = merger.merge(single("2"), single("2"));
        Assert.assertEquals("2+2", render(out, 4));
    }

    @Test
    public void integralQuotientsOnly() {
        ExpressionDictionary out = new DictionaryMerger("1").merge(single("6"), single("3"));
        Assert.assertEquals("6/3", render(out, 2));
        Assert.assertEquals("6%3", render(out, 0));
        Assert.assertEquals("6-3", render(out, 3));
    }

    @Test
    public void zeroDivisorSkipsOnlyUndefinedOperators() {
        ExpressionDictionary out = new DictionaryMerger("1234").merge(single("4"), single("0"));
        Assert.assertEquals("4+0", render(out, 4));
        Assert.assertEquals("4*0", render(out, 0));
        Assert.assertEquals("4^0", render(out, 1));
        Assert.assertEquals(5, out.size()); // 4, -4, 0, 1, -1
    }

    @Test
    public void everyEntryEvaluatesToItsKey() {
        ExpressionDictionary a = new ExpressionDictionary();
        a.add(Rational.of(2), Expr.number("2"));
        a.add(Rational.of(3), Expr.number("3"));
        ExpressionDictionary out = new DictionaryMerger("123123").merge(a, a);

        for (Map.Entry<String, Expr> e : out.entries().entrySet()) {
            Assert.assertEquals(e.getValue().render(), Rational.parse(e.getKey()), e.getValue().evaluate());
            Assert.assertTrue(out.contains(Rational.parse(e.getKey()).negate()));
        }
        Assert.assertEquals("2^-3", out.get(Rational.parse("1/8")).get().render());
    }
}
