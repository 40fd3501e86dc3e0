package org.calista.alchemist.prove;

import org.calista.alchemist.number.Rational;

/** The target is not a known key and no depth budget is left to derive it. */
public final class DepthExhaustedException extends ProofException {

    public DepthExhaustedException(Rational target) {
        super(target, "Cannot prove " + target + " within the given depth");
    }
}
