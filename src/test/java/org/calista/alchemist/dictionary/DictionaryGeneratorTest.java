package org.calista.alchemist.dictionary;

import org.calista.alchemist.expr.Expr;
import org.calista.alchemist.number.Rational;
import org.junit.Assert;
import org.junit.Test;

import java.util.Map;

public class DictionaryGeneratorTest {

    @Test
    public void stripsNonDigits() {
        Assert.assertEquals("123", DictionaryGenerator.digitsOf("1a2-3 "));
        Assert.assertEquals("123", new DictionaryGenerator("1,2,3").base());
        Assert.assertEquals(SplitPolicy.LAST_SPLIT, new DictionaryGenerator("1").splitPolicy());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsBaseWithoutDigits() {
        new DictionaryGenerator("abc");
    }

    @Test
    public void singleDigitIsLiteralAndNegation() {
        ExpressionDictionary d = new DictionaryGenerator("7").generate("7");
        Assert.assertEquals(2, d.size());
        Assert.assertEquals("7", d.get("7").get().render());
        Assert.assertEquals("-7", d.get("-7").get().render());
    }

    @Test
    public void splitsAreMergedAndLiteralAlwaysAdded() {
        DictionaryGenerator g = new DictionaryGenerator("12");
        ExpressionDictionary d = g.generate("12");
        Assert.assertEquals("12", d.get("12").get().render());
        Assert.assertEquals("1+2", d.get("3").get().render());
        Assert.assertEquals("1-2", d.get("-1").get().render());
        Assert.assertSame(d, g.generate("12"));
        assertConsistent(d);
    }

    @Test
    public void literalKeepsLeadingZeros() {
        ExpressionDictionary d = new DictionaryGenerator("07").generate("07");
        Assert.assertEquals("07", d.get("7").get().numeral());
        Assert.assertEquals("0*7", d.get("0").get().render());
        Assert.assertEquals("0-7", d.get("-7").get().render());
    }

    @Test
    public void literalReplacesLongerMergeEntryInPlace() {
        DictionaryGenerator g = new DictionaryGenerator("07");
        ExpressionDictionary merged = new DictionaryMerger("0707").merge(g.generate("0"), g.generate("7"));
        Expr held = merged.get("7").get();
        Assert.assertEquals("0+7", held.render());

        merged.add(Rational.of(7), Expr.number("07"));
        Assert.assertEquals("07", held.render());
        Assert.assertEquals("0-7", merged.get("-7").get().render());
    }

    @Test
    public void allSplitsIsASupersetOfLastSplit() {
        ExpressionDictionary last = new DictionaryGenerator("123", SplitPolicy.LAST_SPLIT, 0).generate("123");
        ExpressionDictionary all = new DictionaryGenerator("123", SplitPolicy.ALL_SPLITS, 0).generate("123");
        Assert.assertTrue(all.size() >= last.size());
        for (String key : last.entries().keySet()) {
            Assert.assertTrue(key, all.contains(key));
            Assert.assertTrue(all.get(key).get().length() <= last.get(key).get().length());
        }
        assertConsistent(all);
    }

    @Test
    public void bootstrapForBase123() {
        ExpressionDictionary d = new DictionaryGenerator("123").bootstrap();
        Assert.assertEquals("123", d.get("123").get().render());
        Assert.assertEquals("-123", d.get("-123").get().render());
        Assert.assertEquals("123+123", d.get("246").get().render());
        Assert.assertTrue(d.contains(Rational.ZERO));
        Assert.assertTrue(d.contains(Rational.of(6)));
        assertConsistent(d);
    }

    @Test
    public void selfMergeAddsOneCompositionLevel() {
        ExpressionDictionary flat = new DictionaryGenerator("12", SplitPolicy.LAST_SPLIT, 0).bootstrap();
        ExpressionDictionary merged = new DictionaryGenerator("12", SplitPolicy.LAST_SPLIT, 1).bootstrap();
        Assert.assertTrue(merged.size() > flat.size());
        for (String key : flat.entries().keySet()) Assert.assertTrue(key, merged.contains(key));
    }

    private static void assertConsistent(ExpressionDictionary d) {
        for (Map.Entry<String, Expr> e : d.entries().entrySet()) {
            Rational key = Rational.parse(e.getKey());
            Assert.assertEquals(e.getValue().render(), key, e.getValue().evaluate());
            Assert.assertTrue("negation of " + key, d.contains(key.negate()));
        }
    }
}
