package org.calista.alchemist.number;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Rational — exact arbitrary-precision number (integer or fraction).
 *
 * <p>
 * Invariants:
 * - numerator/denominator are coprime
 * - denominator is always positive
 * - there is no infinity/NaN: undefined results throw {@link ArithmeticDomainException}
 * </p>
 *
 * Canonical string: {@code "-12"} for integers, {@code "-1/3"} for fractions.
 * Dictionary keys are built from this form, so it must stay stable.
 */
public final class Rational implements Comparable<Rational> {

    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
    public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);
    public static final Rational MINUS_ONE = new Rational(BigInteger.ONE.negate(), BigInteger.ONE);

    /** Largest exponent magnitude accepted by {@link #pow(Rational)}. */
    public static final int MAX_EXPONENT = 1 << 16;

    /** Upper bound for the bit length of a power result. */
    public static final long MAX_BITS = 1L << 22;

    private final BigInteger num;
    private final BigInteger den;

    private Rational(BigInteger num, BigInteger den) {
        this.num = num;
        this.den = den;
    }

    // ---------------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------------

    public static Rational of(long value) {
        if (value == 0L) return ZERO;
        if (value == 1L) return ONE;
        return new Rational(BigInteger.valueOf(value), BigInteger.ONE);
    }

    public static Rational of(BigInteger value) {
        Objects.requireNonNull(value, "value");
        return new Rational(value, BigInteger.ONE);
    }

    public static Rational of(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "numerator");
        Objects.requireNonNull(denominator, "denominator");
        if (denominator.signum() == 0) throw new ArithmeticDomainException("Division by zero: " + numerator + "/0");

        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger g = numerator.gcd(denominator);
        if (!g.equals(BigInteger.ONE) && g.signum() != 0) {
            numerator = numerator.divide(g);
            denominator = denominator.divide(g);
        }
        if (numerator.signum() == 0) return ZERO;
        return new Rational(numerator, denominator);
    }

    /**
     * Parses "123", "-7", "+4", "1/3", "-2/6", "1.25", "1e3".
     *
     * @throws NumberFormatException on malformed input
     */
    public static Rational parse(String text) {
        Objects.requireNonNull(text, "text");
        String s = text.trim();
        if (s.isEmpty()) throw new NumberFormatException("Empty number");

        int slash = s.indexOf('/');
        if (slash >= 0) {
            BigInteger n = new BigInteger(s.substring(0, slash).trim());
            BigInteger d = new BigInteger(s.substring(slash + 1).trim());
            if (d.signum() == 0) throw new NumberFormatException("Zero denominator: " + text);
            return of(n, d);
        }

        BigDecimal dec = new BigDecimal(s);
        if (dec.scale() <= 0) return of(dec.toBigIntegerExact());
        return of(dec.unscaledValue(), BigInteger.TEN.pow(dec.scale()));
    }

    // ---------------------------------------------------------------------
    // Accessors / predicates
    // ---------------------------------------------------------------------

    public BigInteger numerator() {
        return num;
    }

    public BigInteger denominator() {
        return den;
    }

    public boolean isInteger() {
        return den.equals(BigInteger.ONE);
    }

    public boolean isZero() {
        return num.signum() == 0;
    }

    public int signum() {
        return num.signum();
    }

    /**
     * Exact conversion.
     *
     * @throws ArithmeticException when the value is not an integer
     */
    public BigInteger toBigInteger() {
        if (!isInteger()) throw new ArithmeticException("Not an integer: " + this);
        return num;
    }

    // ---------------------------------------------------------------------
    // Arithmetic
    // ---------------------------------------------------------------------

    public Rational add(Rational o) {
        if (isInteger() && o.isInteger()) return of(num.add(o.num));
        return of(num.multiply(o.den).add(o.num.multiply(den)), den.multiply(o.den));
    }

    public Rational subtract(Rational o) {
        if (isInteger() && o.isInteger()) return of(num.subtract(o.num));
        return of(num.multiply(o.den).subtract(o.num.multiply(den)), den.multiply(o.den));
    }

    public Rational multiply(Rational o) {
        if (isInteger() && o.isInteger()) return of(num.multiply(o.num));
        return of(num.multiply(o.num), den.multiply(o.den));
    }

    public Rational divide(Rational o) {
        if (o.isZero()) throw new ArithmeticDomainException("Division by zero: " + this + "/0");
        return of(num.multiply(o.den), den.multiply(o.num));
    }

    /**
     * Floored modulo: {@code a - b*floor(a/b)}; the result carries the divisor's sign.
     */
    public Rational mod(Rational o) {
        if (o.isZero()) throw new ArithmeticDomainException("Modulo by zero: " + this + "%0");
        if (isInteger() && o.isInteger()) {
            BigInteger r = num.mod(o.num.abs());
            if (o.num.signum() < 0 && r.signum() != 0) r = r.add(o.num);
            return of(r);
        }
        return subtract(o.multiply(divide(o).floor()));
    }

    /**
     * Exact power. The exponent must be an integer.
     */
    public Rational pow(Rational exponent) {
        if (!exponent.isInteger()) {
            throw new ArithmeticDomainException("Non-integral exponent: " + this + "^" + exponent);
        }
        BigInteger e = exponent.num;
        if (e.abs().compareTo(BigInteger.valueOf(MAX_EXPONENT)) > 0) {
            throw new ArithmeticDomainException("Exponent too large: " + exponent);
        }
        int n = e.intValue();
        if (n == 0) return ONE;
        if (isZero()) {
            if (n < 0) throw new ArithmeticDomainException("Zero to a negative power: 0^" + exponent);
            return ZERO;
        }

        int k = Math.abs(n);
        long bits = (long) Math.max(num.bitLength(), den.bitLength()) * k;
        if (bits > MAX_BITS) throw new ArithmeticDomainException("Power result too large: " + this + "^" + exponent);

        BigInteger pn = num.pow(k);
        BigInteger pd = den.pow(k);
        return n > 0 ? of(pn, pd) : of(pd, pn);
    }

    public Rational negate() {
        if (isZero()) return this;
        return new Rational(num.negate(), den);
    }

    public Rational abs() {
        return num.signum() < 0 ? negate() : this;
    }

    public Rational floor() {
        if (isInteger()) return this;
        // BigInteger.mod is non-negative for a positive modulus -> floor division
        return of(num.subtract(num.mod(den)).divide(den));
    }

    // ---------------------------------------------------------------------
    // Comparison
    // ---------------------------------------------------------------------

    @Override
    public int compareTo(Rational o) {
        if (den.equals(o.den)) return num.compareTo(o.num);
        return num.multiply(o.den).compareTo(o.num.multiply(den));
    }

    /** Compares absolute values. */
    public int compareMagnitude(Rational o) {
        return abs().compareTo(o.abs());
    }

    public boolean lessThan(Rational o) {
        return compareTo(o) < 0;
    }

    public boolean greaterThan(Rational o) {
        return compareTo(o) > 0;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Rational r)) return false;
        return num.equals(r.num) && den.equals(r.den);
    }

    @Override
    public int hashCode() {
        return 31 * num.hashCode() + den.hashCode();
    }

    @Override
    public String toString() {
        if (isInteger()) return num.toString();
        return num + "/" + den;
    }
}
