package org.calista.alchemist.prove;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.alchemist.expr.Expr;
import org.calista.alchemist.expr.ExpressionEvaluator;
import org.calista.alchemist.number.Rational;

import java.util.Objects;

/**
 * Self-check: prove, re-evaluate the rendered string independently, compare.
 */
public final class ProofVerifier {
    private static final Logger log = LogManager.getLogger(ProofVerifier.class);

    private ProofVerifier() {
    }

    /**
     * @return the verified rendering
     * @throws ProofMismatchException when the rendering evaluates to something else
     */
    public static String verify(ProofEngine engine, Rational target, int maxDepth) {
        Objects.requireNonNull(engine, "engine");
        Expr proof = engine.proveAst(target, maxDepth, ProofListener.NONE);
        return check(target, proof);
    }

    /** Checks an already built proof. */
    public static String check(Rational target, Expr proof) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(proof, "proof");

        String rendered = proof.render();
        Rational actual = ExpressionEvaluator.evaluate(rendered);
        if (!actual.equals(target)) {
            log.error("Proof mismatch for {}: '{}' = {}", target, rendered, actual);
            throw new ProofMismatchException(target, rendered, actual, proof.trace().steps);
        }
        return rendered;
    }
}
