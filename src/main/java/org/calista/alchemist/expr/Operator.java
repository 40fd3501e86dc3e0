package org.calista.alchemist.expr;

import org.calista.alchemist.number.Rational;

/**
 * Operator tags of the expression tree.
 *
 * <p>{@link #symbol()} is the serialization tag ("u-" for negation);
 * {@link #glyph()} is what appears in rendered strings.</p>
 */
public enum Operator {

    ADD("+", 1, 2),
    SUBTRACT("-", 1, 2),
    MULTIPLY("*", 2, 2),
    DIVIDE("/", 2, 2),
    MODULO("%", 2, 2),
    POWER("^", 3, 2),
    NEGATE("u-", 4, 1);

    private final String symbol;
    private final int precedence;
    private final int arity;

    Operator(String symbol, int precedence, int arity) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.arity = arity;
    }

    public String symbol() {
        return symbol;
    }

    public String glyph() {
        return this == NEGATE ? "-" : symbol;
    }

    public int precedence() {
        return precedence;
    }

    public int arity() {
        return arity;
    }

    public boolean isUnary() {
        return arity == 1;
    }

    /**
     * Whether an operand using this same operator may be written without parentheses
     * on the given side.
     */
    public boolean chainsOn(boolean leftOperand) {
        return switch (this) {
            case ADD, MULTIPLY -> true;
            case SUBTRACT, DIVIDE -> leftOperand;
            case POWER -> !leftOperand; // right-associative
            default -> false;
        };
    }

    /**
     * Applies a binary operator.
     *
     * @throws org.calista.alchemist.number.ArithmeticDomainException when the result is undefined
     */
    public Rational apply(Rational left, Rational right) {
        return switch (this) {
            case ADD -> left.add(right);
            case SUBTRACT -> left.subtract(right);
            case MULTIPLY -> left.multiply(right);
            case DIVIDE -> left.divide(right);
            case MODULO -> left.mod(right);
            case POWER -> left.pow(right);
            case NEGATE -> throw new IllegalStateException("Unary operator applied to two operands");
        };
    }

    public static Operator fromSymbol(String symbol) {
        if (symbol != null) {
            for (Operator op : values()) {
                if (op.symbol.equals(symbol)) return op;
            }
        }
        throw new SerializationException("Unknown operator: " + symbol);
    }
}
