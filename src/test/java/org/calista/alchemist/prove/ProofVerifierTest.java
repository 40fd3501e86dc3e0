package org.calista.alchemist.prove;

import org.calista.alchemist.dictionary.DictionaryGenerator;
import org.calista.alchemist.dictionary.SplitPolicy;
import org.calista.alchemist.expr.Expr;
import org.calista.alchemist.expr.Operator;
import org.calista.alchemist.number.Rational;
import org.junit.Assert;
import org.junit.Test;

public class ProofVerifierTest {

    @Test
    public void verifiedProofIsReturned() {
        ProofEngine engine = new ProofEngine(new DictionaryGenerator("123", SplitPolicy.LAST_SPLIT, 0).bootstrap());
        String proof = ProofVerifier.verify(engine, Rational.of(2024), ProofEngine.UNBOUNDED);
        Assert.assertEquals(engine.dictionary().get("2024").get().render(), proof);
    }

    @Test
    public void mismatchCarriesTheTrace() {
        Expr wrong = Expr.of(Operator.ADD, Expr.number("2"), Expr.number("3"));
        try {
            ProofVerifier.check(Rational.of(6), wrong);
            Assert.fail("expected mismatch");
        } catch (ProofMismatchException e) {
            Assert.assertEquals(Rational.of(6), e.target());
            Assert.assertEquals("2+3", e.proof());
            Assert.assertEquals(Rational.of(5), e.actual());
            Assert.assertEquals("(2) + (3) = 5", e.steps());
        }
    }
}
