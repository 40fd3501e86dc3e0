package org.calista.alchemist.prove;

import org.calista.alchemist.number.Rational;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Two-factor split by trial division, smallest factor first.
 *
 * <p>
 * For {@code |n| <= 1} or when no divisor is found up to {@code min(sqrt|n|, MAX_TRIAL_DIVISOR)}
 * the result is the trivial pair {@code (1, n)}. The sign of a negative input goes to the large factor.
 * </p>
 */
public final class Factorizer {

    public static final long MAX_TRIAL_DIVISOR = 10_000_000L;

    private Factorizer() {
    }

    public static final class Factors {
        public final BigInteger small;
        public final BigInteger large;

        Factors(BigInteger small, BigInteger large) {
            this.small = small;
            this.large = large;
        }

        /** One of the factors is 1 or -1. */
        public boolean isTrivial() {
            return small.abs().equals(BigInteger.ONE) || large.abs().equals(BigInteger.ONE);
        }

        @Override
        public String toString() {
            return small + " * " + large;
        }
    }

    public static Factors factorize(Rational n) {
        Objects.requireNonNull(n, "n");
        if (!n.isInteger()) throw new IllegalArgumentException("Not an integer: " + n);
        return factorize(n.numerator());
    }

    public static Factors factorize(BigInteger n) {
        Objects.requireNonNull(n, "n");
        BigInteger abs = n.abs();
        if (abs.compareTo(BigInteger.ONE) <= 0) return new Factors(BigInteger.ONE, n);

        long d = abs.bitLength() < 63 ? smallestDivisor(abs.longValueExact()) : smallestDivisor(abs);
        if (d == 1) return new Factors(BigInteger.ONE, n);

        BigInteger small = BigInteger.valueOf(d);
        BigInteger large = abs.divide(small);
        return new Factors(small, n.signum() < 0 ? large.negate() : large);
    }

    private static long smallestDivisor(long n) {
        if ((n & 1L) == 0) return 2;
        for (long i = 3; i <= MAX_TRIAL_DIVISOR && i <= n / i; i += 2) {
            if (n % i == 0) return i;
        }
        return 1;
    }

    private static long smallestDivisor(BigInteger n) {
        if (!n.testBit(0)) return 2;
        for (long i = 3; i <= MAX_TRIAL_DIVISOR; i += 2) {
            BigInteger bi = BigInteger.valueOf(i);
            if (bi.multiply(bi).compareTo(n) > 0) break;
            if (n.mod(bi).signum() == 0) return i;
        }
        return 1;
    }
}
