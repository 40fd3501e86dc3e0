package org.calista.alchemist.expr;

import org.calista.alchemist.number.Rational;

import java.util.List;
import java.util.Objects;

/**
 * Expr — handle onto an expression body.
 *
 * <p>
 * Everything that holds an expression (operator nodes, dictionary entries, callers)
 * holds an {@code Expr}. {@link #replace(Expr)} redirects the handle to another body, so every
 * holder sees the cheaper expression at once and cached renderings above it are dropped.
 * </p>
 *
 * <p>
 * Construction goes through {@link #number(String)} and {@link #of(Operator, Expr...)}; the latter
 * applies sign normalization once:
 * </p>
 * <ul>
 *   <li>{@code -(-A) -> A}</li>
 *   <li>{@code (-A)*(-B) -> A*B}, {@code A*(-B) -> -(A*B)} (same for {@code /})</li>
 *   <li>{@code A+(-B) -> A-B}, {@code A-(-B) -> A+B}</li>
 * </ul>
 *
 * Not thread-safe.
 */
public final class Expr {

    private ExprNode node;

    private Expr(ExprNode node) {
        this.node = node;
    }

    // ---------------------------------------------------------------------
    // Construction
    // ---------------------------------------------------------------------

    public static Expr number(String numeral) {
        return new Expr(new NumberNode(numeral));
    }

    public static Expr of(Operator op, Expr... operands) {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(operands, "operands");
        for (Expr e : operands) Objects.requireNonNull(e, "operand");
        if (operands.length != op.arity()) {
            throw new IllegalArgumentException(op + " expects " + op.arity() + " operand(s), got " + operands.length);
        }

        switch (op) {
            case NEGATE -> {
                if (operands[0].isNegation()) return operands[0].child(0);
            }
            case MULTIPLY, DIVIDE -> {
                Expr l = operands[0];
                Expr r = operands[1];
                boolean ln = l.isNegation();
                boolean rn = r.isNegation();
                if (ln && rn) return of(op, l.child(0), r.child(0));
                if (ln) return of(Operator.NEGATE, of(op, l.child(0), r));
                if (rn) return of(Operator.NEGATE, of(op, l, r.child(0)));
            }
            case ADD -> {
                if (operands[1].isNegation()) return of(Operator.SUBTRACT, operands[0], operands[1].child(0));
            }
            case SUBTRACT -> {
                if (operands[1].isNegation()) return of(Operator.ADD, operands[0], operands[1].child(0));
            }
            default -> {
                // no rewrite
            }
        }
        return new Expr(new OperatorNode(op, List.of(operands)));
    }

    public static Expr negate(Expr operand) {
        return of(Operator.NEGATE, operand);
    }

    // ---------------------------------------------------------------------
    // Shape
    // ---------------------------------------------------------------------

    public boolean isLeaf() {
        return node.operator() == null;
    }

    public boolean isNegation() {
        return node.operator() == Operator.NEGATE;
    }

    /** Operator tag, {@code null} for a leaf. */
    public Operator operator() {
        return node.operator();
    }

    public List<Expr> children() {
        return node.children();
    }

    public Expr child(int index) {
        return node.children().get(index);
    }

    /** Literal text of a leaf. */
    public String numeral() {
        if (!(node instanceof NumberNode n)) throw new IllegalStateException("Not a leaf: " + render());
        return n.numeral;
    }

    /** True when both handles currently resolve to the same body. */
    public boolean sameBody(Expr other) {
        return other != null && other.node == node;
    }

    ExprNode node() {
        return node;
    }

    // ---------------------------------------------------------------------
    // Rendering / evaluation
    // ---------------------------------------------------------------------

    /** Top-level rendering, minimal parentheses. */
    public String render() {
        return node.render();
    }

    /**
     * Rendering as an operand of {@code enclosing}.
     *
     * @param leftOperand whether this expression is the left operand
     */
    public String render(Operator enclosing, boolean leftOperand) {
        String bare = node.render();
        return needsParentheses(enclosing, leftOperand) ? "(" + bare + ")" : bare;
    }

    private boolean needsParentheses(Operator enclosing, boolean leftOperand) {
        Operator own = node.operator();
        if (own == null || enclosing == null) return false;
        if (own.precedence() > enclosing.precedence()) return false;
        return !(own == enclosing && own.chainsOn(leftOperand));
    }

    public int length() {
        return render().length();
    }

    /**
     * @throws org.calista.alchemist.number.ArithmeticDomainException when a sub-expression is undefined
     */
    public Rational evaluate() {
        return node.evaluate();
    }

    public Trace trace() {
        return node.trace();
    }

    // ---------------------------------------------------------------------
    // Replacement
    // ---------------------------------------------------------------------

    /**
     * Points this handle at {@code other}'s body. Parents of the old body are carried over and
     * every cache above it is cleared.
     */
    public void replace(Expr other) {
        Objects.requireNonNull(other, "other");
        ExprNode previous = this.node;
        ExprNode next = other.node;
        if (previous == next) return;

        next.adoptParents(previous);
        this.node = next;
        previous.invalidateParents();
    }

    @Override
    public String toString() {
        return render();
    }
}
