package org.calista.alchemist.number;

/**
 * Raised when an operation has no exact value: division by zero, zero modulus,
 * fractional or oversized exponents.
 *
 * <p>Callers use it to tell "undefined" apart from a legitimate zero result.</p>
 */
public final class ArithmeticDomainException extends ArithmeticException {

    public ArithmeticDomainException(String message) {
        super(message);
    }
}
