package org.calista.alchemist.prove;

import org.calista.alchemist.dictionary.DictionaryGenerator;
import org.calista.alchemist.dictionary.ExpressionDictionary;
import org.calista.alchemist.dictionary.SplitPolicy;
import org.calista.alchemist.expr.Expr;
import org.calista.alchemist.expr.ExpressionEvaluator;
import org.calista.alchemist.number.Rational;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public class ProofEngineTest {

    private ProofEngine engine;

    @Before
    public void setUp() {
        ExpressionDictionary dict = new DictionaryGenerator("123", SplitPolicy.LAST_SPLIT, 0).bootstrap();
        engine = new ProofEngine(dict, seeded(0.0));
    }

    private static ProofEngine.Config seeded(double continueProbability) {
        ProofEngine.Config c = new ProofEngine.Config();
        c.seed = 42L;
        c.continueProbability = continueProbability;
        return c;
    }

    private static ExpressionDictionary twos() {
        ExpressionDictionary d = new ExpressionDictionary();
        d.add(Rational.of(2), Expr.number("2"));
        return d;
    }

    @Test
    public void baseItselfAndItsNegation() {
        Assert.assertEquals("123", engine.prove("123"));
        Assert.assertEquals("-123", engine.prove("-123"));
        Assert.assertEquals(Rational.ZERO, ExpressionEvaluator.evaluate(engine.prove("0")));
    }

    @Test
    public void defaultBootstrapForBase123() {
        ProofEngine shipped = ProofEngine.forBase("123");
        Assert.assertEquals("123", shipped.prove("123"));
        Assert.assertEquals("-123", shipped.prove("-123"));
        Assert.assertEquals(Rational.ZERO, ExpressionEvaluator.evaluate(shipped.prove("0")));

        Random rnd = new Random(123);
        for (int i = 0; i < 10; i++) {
            long n = rnd.nextInt(10_000_000);
            String proof = shipped.prove(Long.toString(n));
            Assert.assertEquals(proof, Rational.of(n), ExpressionEvaluator.evaluate(proof));
            Assert.assertTrue(shipped.dictionary().contains(Rational.of(-n)));
        }
    }

    @Test
    public void seededRandomIntegersEvaluateBack() {
        Random rnd = new Random(7);
        for (int i = 0; i < 25; i++) {
            long n = rnd.nextInt(10_000_000) - 5_000_000;
            String proof = engine.prove(Long.toString(n));
            Assert.assertEquals(proof, Rational.of(n), ExpressionEvaluator.evaluate(proof));
        }
    }

    @Test
    public void derivationsAreRecordedWithTheirNegation() {
        String proof = engine.prove("4567");
        Assert.assertTrue(engine.dictionary().contains("4567"));
        Assert.assertTrue(engine.dictionary().contains("-4567"));
        Assert.assertEquals(proof, engine.prove("4567"));
        Assert.assertEquals(Rational.of(-4567), ExpressionEvaluator.evaluate(engine.prove("-4567")));
    }

    @Test
    public void fractionsAndDecimals() {
        Assert.assertEquals(Rational.parse("-7/3"), ExpressionEvaluator.evaluate(engine.prove("-7/3")));
        Assert.assertEquals(Rational.parse("5/2"), ExpressionEvaluator.evaluate(engine.prove("2.5")));
    }

    @Test(expected = DepthExhaustedException.class)
    public void zeroDepthOnlyLooksUp() {
        engine.prove("1000000000039", 0);
    }

    @Test
    public void depthBudgetIsReportedAsExhaustion() {
        ProofEngine small = new ProofEngine(twos(), seeded(0.0));
        try {
            small.prove("3", 1);
            Assert.fail("expected depth exhaustion");
        } catch (DepthExhaustedException e) {
            Assert.assertEquals(Rational.of(3), e.target());
        }
        Assert.assertEquals(Rational.of(3), ExpressionEvaluator.evaluate(small.prove("3", 2)));
    }

    @Test
    public void singleKeyDictionaryStillReachesSmallIntegers() {
        ProofEngine small = new ProofEngine(twos(), seeded(0.0));
        Assert.assertEquals("2/2", small.prove("1"));
        Assert.assertEquals("2-2", small.prove("0"));
        for (int n = -20; n <= 20; n++) {
            Assert.assertEquals(Rational.of(n), ExpressionEvaluator.evaluate(small.prove(Integer.toString(n))));
        }
    }

    @Test(expected = ProofNotFoundException.class)
    public void emptyDictionaryProvesNothing() {
        new ProofEngine(new ExpressionDictionary(), seeded(0.0)).prove("6");
    }

    @Test
    public void listenerSeesImprovementsEndingWithTheResult() {
        List<String> seen = new ArrayList<>();
        String proof = engine.prove(Rational.of(98765), ProofEngine.UNBOUNDED, seen::add);

        Assert.assertFalse(seen.isEmpty());
        Assert.assertEquals(proof, seen.get(seen.size() - 1));
        for (int i = 1; i < seen.size(); i++) Assert.assertNotEquals(seen.get(i - 1), seen.get(i));
    }

    @Test
    public void reentrantCallIsRejected() {
        try {
            engine.proveAst(Rational.of(123), ProofEngine.UNBOUNDED, (t, best) -> engine.prove("5"));
            Assert.fail("expected IllegalStateException");
        } catch (IllegalStateException expected) {
            // engine stays usable afterwards
        }
        Assert.assertEquals("123", engine.prove("123"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeDepthIsRejected() {
        engine.prove("5", -1);
    }

    @Test
    public void randomizedPassesStayCorrect() {
        ProofEngine restless = new ProofEngine(new DictionaryGenerator("123", SplitPolicy.LAST_SPLIT, 0).bootstrap(), seeded(1.0));
        for (int n = 1000; n < 1040; n++) {
            Assert.assertEquals(Rational.of(n), ExpressionEvaluator.evaluate(restless.prove(Integer.toString(n))));
        }
    }

    @Test
    public void configIsClamped() {
        ProofEngine.Config c = new ProofEngine.Config();
        c.continueProbability = 3.0;
        c.maxRestartsPerPass = -2;
        c.validate();
        Assert.assertEquals(1.0, c.continueProbability, 0.0);
        Assert.assertEquals(0, c.maxRestartsPerPass);

        c.continueProbability = Double.NaN;
        Assert.assertEquals(0.0, c.validate().continueProbability, 0.0);
    }
}
