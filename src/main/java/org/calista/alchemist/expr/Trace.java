package org.calista.alchemist.expr;

import org.calista.alchemist.number.Rational;

import java.util.Objects;

/**
 * Human-readable calculation steps of a node, with the value they produce.
 */
public final class Trace {
    public final String steps;
    public final Rational value;

    public Trace(String steps, Rational value) {
        this.steps = Objects.requireNonNull(steps, "steps");
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return steps;
    }
}
