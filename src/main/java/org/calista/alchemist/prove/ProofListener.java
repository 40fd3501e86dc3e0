package org.calista.alchemist.prove;

import org.calista.alchemist.expr.Expr;
import org.calista.alchemist.number.Rational;

/**
 * Receives the best expression known so far for the requested target while the search is still running.
 */
@FunctionalInterface
public interface ProofListener {

    ProofListener NONE = (target, best) -> { };

    void onProgress(Rational target, Expr best);
}
