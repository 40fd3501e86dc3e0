package org.calista.alchemist.prove;

import org.calista.alchemist.number.Rational;
import org.junit.Assert;
import org.junit.Test;

import java.math.BigInteger;

public class FactorizerTest {

    @Test
    public void smallestFactorComesFirst() {
        Factorizer.Factors f = Factorizer.factorize(BigInteger.valueOf(12));
        Assert.assertEquals(BigInteger.valueOf(2), f.small);
        Assert.assertEquals(BigInteger.valueOf(6), f.large);
        Assert.assertFalse(f.isTrivial());

        f = Factorizer.factorize(BigInteger.valueOf(91));
        Assert.assertEquals(BigInteger.valueOf(7), f.small);
        Assert.assertEquals(BigInteger.valueOf(13), f.large);
    }

    @Test
    public void signStaysOnTheLargeFactor() {
        Factorizer.Factors f = Factorizer.factorize(Rational.of(-15));
        Assert.assertEquals(BigInteger.valueOf(3), f.small);
        Assert.assertEquals(BigInteger.valueOf(-5), f.large);
    }

    @Test
    public void primesAndUnitsAreTrivial() {
        Assert.assertTrue(Factorizer.factorize(BigInteger.valueOf(97)).isTrivial());
        Assert.assertTrue(Factorizer.factorize(BigInteger.valueOf(-97)).isTrivial());
        Assert.assertTrue(Factorizer.factorize(BigInteger.ONE).isTrivial());
        Assert.assertTrue(Factorizer.factorize(BigInteger.ZERO).isTrivial());
        Assert.assertEquals(BigInteger.ZERO, Factorizer.factorize(BigInteger.ZERO).large);
    }

    @Test
    public void bigIntegersBeyondLongRange() {
        BigInteger n = BigInteger.ONE.shiftLeft(80).multiply(BigInteger.valueOf(3));
        Factorizer.Factors f = Factorizer.factorize(n);
        Assert.assertEquals(BigInteger.valueOf(2), f.small);

        BigInteger odd = BigInteger.TEN.pow(20).add(BigInteger.ONE).multiply(BigInteger.valueOf(101 * 101));
        Assert.assertEquals(0, odd.mod(BigInteger.valueOf(101)).signum());
        BigInteger d = Factorizer.factorize(odd).small;
        Assert.assertTrue(d.compareTo(BigInteger.valueOf(101)) <= 0);
        Assert.assertEquals(0, odd.mod(d).signum());
    }

    @Test
    public void trialDivisionStopsAtTheCap() {
        BigInteger p = BigInteger.valueOf(10_000_019L);
        Assert.assertTrue(p.longValue() > Factorizer.MAX_TRIAL_DIVISOR);
        Assert.assertTrue(Factorizer.factorize(p.multiply(p)).isTrivial());
    }

    @Test(expected = IllegalArgumentException.class)
    public void fractionsAreRejected() {
        Factorizer.factorize(Rational.parse("3/2"));
    }
}
