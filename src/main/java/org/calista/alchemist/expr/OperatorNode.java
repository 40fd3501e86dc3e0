package org.calista.alchemist.expr;

import org.calista.alchemist.number.Rational;

import java.util.List;
import java.util.Objects;

/**
 * Operator body: tag + ordered operand handles.
 * Registers itself as a parent of every operand body on construction.
 */
final class OperatorNode extends ExprNode {

    private final Operator op;
    private final List<Expr> operands;

    OperatorNode(Operator op, List<Expr> operands) {
        this.op = Objects.requireNonNull(op, "op");
        this.operands = List.copyOf(operands);
        if (this.operands.size() != op.arity()) {
            throw new IllegalArgumentException(op + " expects " + op.arity() + " operand(s), got " + this.operands.size());
        }
        for (Expr operand : this.operands) operand.node().registerParent(this);
    }

    @Override
    String renderBare() {
        if (op.isUnary()) return op.glyph() + operands.get(0).render(op, false);
        return operands.get(0).render(op, true) + op.glyph() + operands.get(1).render(op, false);
    }

    @Override
    Rational compute() {
        if (op.isUnary()) return operands.get(0).evaluate().negate();
        return op.apply(operands.get(0).evaluate(), operands.get(1).evaluate());
    }

    @Override
    Trace computeTrace() {
        if (op.isUnary()) {
            Trace inner = operands.get(0).trace();
            Rational v = inner.value.negate();
            return new Trace("-(" + inner.steps + ") = " + v, v);
        }
        Trace left = operands.get(0).trace();
        Trace right = operands.get(1).trace();
        Rational v = evaluate();
        return new Trace("(" + left.steps + ") " + op.glyph() + " (" + right.steps + ") = " + v, v);
    }

    @Override
    Operator operator() {
        return op;
    }

    @Override
    List<Expr> children() {
        return operands;
    }
}
