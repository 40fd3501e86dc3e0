package org.calista.alchemist.expr;

import org.calista.alchemist.number.Rational;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.WeakHashMap;

/**
 * ExprNode — the body an {@link Expr} handle currently points at.
 *
 * <p>
 * Owns the lazily filled caches (bare rendering, value, trace) and the set of
 * operator nodes that use it as an operand. The parent set is weak: it exists only to
 * push cache invalidation upwards and never keeps a parent alive. Collected parents are
 * expunged by the backing {@link WeakHashMap} on the next access.
 * </p>
 */
abstract class ExprNode {

    private String rendered;
    private Rational value;
    private Trace trace;

    private final Set<OperatorNode> parents = Collections.newSetFromMap(new WeakHashMap<>());

    // ---------------------------------------------------------------------
    // Variant contract
    // ---------------------------------------------------------------------

    /** Rendering without the parentheses an enclosing operator may add. */
    abstract String renderBare();

    abstract Rational compute();

    abstract Trace computeTrace();

    /** {@code null} for leaves. */
    abstract Operator operator();

    abstract List<Expr> children();

    // ---------------------------------------------------------------------
    // Memoized accessors
    // ---------------------------------------------------------------------

    final String render() {
        String r = rendered;
        if (r == null) rendered = r = renderBare();
        return r;
    }

    final Rational evaluate() {
        Rational v = value;
        if (v == null) value = v = compute();
        return v;
    }

    final Trace trace() {
        Trace t = trace;
        if (t == null) trace = t = computeTrace();
        return t;
    }

    final boolean hasCache() {
        return rendered != null || value != null || trace != null;
    }

    final void clearCache() {
        rendered = null;
        value = null;
        trace = null;
    }

    // ---------------------------------------------------------------------
    // Parent tracking
    // ---------------------------------------------------------------------

    final void registerParent(OperatorNode parent) {
        parents.add(parent);
    }

    final void unregisterParent(OperatorNode parent) {
        parents.remove(parent);
    }

    final int parentCount() {
        return parents.size();
    }

    final boolean hasParent(OperatorNode parent) {
        return parents.contains(parent);
    }

    /** Union of parent sets; identity-deduplicated, stale entries are never copied. */
    final void adoptParents(ExprNode from) {
        if (from == this) return;
        parents.addAll(new ArrayList<>(from.parents));
    }

    /**
     * Clears the caches of every transitively reachable parent. A parent whose cache is
     * already empty stops the walk: whatever sits above it was cleared together with it.
     */
    final void invalidateParents() {
        for (OperatorNode parent : new ArrayList<>(parents)) {
            boolean hadCache = parent.hasCache();
            parent.clearCache();
            if (hadCache) parent.invalidateParents();
        }
    }
}
