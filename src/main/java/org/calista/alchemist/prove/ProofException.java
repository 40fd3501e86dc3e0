package org.calista.alchemist.prove;

import org.calista.alchemist.number.Rational;

/** Base of the search failures surfaced to callers of {@link ProofEngine}. */
public class ProofException extends RuntimeException {

    private final Rational target;

    public ProofException(Rational target, String message) {
        super(message);
        this.target = target;
    }

    public ProofException(Rational target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public Rational target() {
        return target;
    }
}
