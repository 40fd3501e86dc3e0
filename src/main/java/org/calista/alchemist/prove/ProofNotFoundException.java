package org.calista.alchemist.prove;

import org.calista.alchemist.number.Rational;

/** Every strategy and key was tried without success. Not a proof of impossibility. */
public final class ProofNotFoundException extends ProofException {

    public ProofNotFoundException(Rational target) {
        super(target, "Cannot prove " + target);
    }

    public ProofNotFoundException(Rational target, String reason) {
        super(target, "Cannot prove " + target + ": " + reason);
    }
}
