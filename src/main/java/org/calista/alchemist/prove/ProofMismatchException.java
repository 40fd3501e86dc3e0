package org.calista.alchemist.prove;

import org.calista.alchemist.number.Rational;

/**
 * A rendered proof re-evaluated to a different value. Carries the step trace for debugging.
 */
public final class ProofMismatchException extends ProofException {

    private final String proof;
    private final Rational actual;
    private final String steps;

    public ProofMismatchException(Rational target, String proof, Rational actual, String steps) {
        super(target, "Proof '" + proof + "' evaluates to " + actual + ", expected " + target + "\n" + steps);
        this.proof = proof;
        this.actual = actual;
        this.steps = steps;
    }

    public String proof() {
        return proof;
    }

    public Rational actual() {
        return actual;
    }

    public String steps() {
        return steps;
    }
}
