package org.calista.alchemist.expr;

/** Malformed arithmetic expression text. */
public final class ExpressionSyntaxException extends IllegalArgumentException {

    private final int position;

    public ExpressionSyntaxException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int position() {
        return position;
    }
}
