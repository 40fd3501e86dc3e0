package org.calista.alchemist.dictionary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.alchemist.expr.Expr;
import org.calista.alchemist.expr.ExprJson;
import org.calista.alchemist.number.Rational;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ExpressionDictionary — canonical value string -> cheapest known expression.
 *
 * <p>
 * "Cheapest" is the shortest rendering seen so far; ties keep the first entry.
 * A cheaper expression for a known key is not stored next to the old one: the existing
 * handle is {@linkplain Expr#replace(Expr) replaced in place}, so every expression that already
 * uses it as an operand shrinks with it.
 * </p>
 *
 * <p>
 * {@link #add(Rational, Expr)} keeps the dictionary closed under negation.
 * Insertion order is preserved (snapshots, JSON export).
 * </p>
 *
 * Not thread-safe: one in-flight search per dictionary.
 */
public final class ExpressionDictionary {

    private static final Logger log = LogManager.getLogger(ExpressionDictionary.class);

    private static final Comparator<Rational> BY_MAGNITUDE_DESC = (a, b) -> {
        int c = b.compareMagnitude(a);
        if (c != 0) return c;
        return Integer.compare(b.signum(), a.signum()); // positive first
    };

    private final Map<String, Expr> entries = new LinkedHashMap<>();

    /** All key values, kept in {@link #BY_MAGNITUDE_DESC} order. */
    private final List<Rational> ordered = new ArrayList<>();
    private List<Rational> sortedKeys = List.of();
    private int sortedAtSize = -1;

    public ExpressionDictionary() {
    }

    public ExpressionDictionary(Map<String, Expr> initial) {
        Objects.requireNonNull(initial, "initial");
        for (Map.Entry<String, Expr> e : initial.entrySet()) put(e.getKey(), e.getValue());
    }

    // =========================
    // Insertion
    // =========================

    /**
     * Cheapest-wins insert of a single key.
     *
     * @return true when the key was new or its expression got shorter
     */
    public boolean put(String key, Expr expr) {
        Objects.requireNonNull(key, "key");
        return put(key, null, expr);
    }

    private boolean put(String key, Rational value, Expr expr) {
        Objects.requireNonNull(expr, "expr");

        Expr existing = entries.get(key);
        if (existing == null) {
            Rational v = (value != null) ? value : Rational.parse(key);
            if (!v.toString().equals(key)) throw new IllegalArgumentException("Non-canonical key: '" + key + "'");
            entries.put(key, expr);
            insertOrdered(v);
            return true;
        }
        if (existing.sameBody(expr)) return false;
        if (expr.length() >= existing.length()) return false;

        if (log.isTraceEnabled()) log.trace("{}: '{}' -> '{}'", key, existing.render(), expr.render());
        existing.replace(expr);
        return true;
    }

    /** Inserts {@code value -> expr} and {@code -value -> -(expr)}. */
    public boolean add(Rational value, Expr expr) {
        Objects.requireNonNull(value, "value");
        boolean changed = put(value.toString(), value, expr);
        Rational negated = value.negate();
        changed |= put(negated.toString(), negated, Expr.negate(expr));
        return changed;
    }

    /** Union with cheapest-wins per key. */
    public void absorb(ExpressionDictionary other) {
        Objects.requireNonNull(other, "other");
        if (other == this) return;
        absorb(other.entries);
    }

    public void absorb(Map<String, Expr> other) {
        for (Map.Entry<String, Expr> e : new ArrayList<>(other.entrySet())) put(e.getKey(), e.getValue());
    }

    // =========================
    // Lookup
    // =========================

    public Optional<Expr> get(String key) {
        if (key == null) return Optional.empty();
        return Optional.ofNullable(entries.get(key));
    }

    public Optional<Expr> get(Rational value) {
        return value == null ? Optional.empty() : get(value.toString());
    }

    public boolean contains(Rational value) {
        return value != null && entries.containsKey(value.toString());
    }

    public boolean contains(String key) {
        return key != null && entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Read-only, insertion-ordered view. */
    public Map<String, Expr> entries() {
        return Collections.unmodifiableMap(entries);
    }

    /**
     * Keys by descending magnitude, positive before negative on ties.
     * The returned list is an immutable snapshot: later insertions do not show up in it.
     */
    public List<Rational> keysByMagnitude() {
        if (sortedAtSize != entries.size()) {
            sortedKeys = List.copyOf(ordered);
            sortedAtSize = entries.size();
        }
        return sortedKeys;
    }

    private void insertOrdered(Rational v) {
        int at = Collections.binarySearch(ordered, v, BY_MAGNITUDE_DESC);
        ordered.add(at < 0 ? -at - 1 : at, v);
    }

    // =========================
    // JSON
    // =========================

    public ArrayNode toJson() {
        return ExprJson.entriesToJson(entries);
    }

    public static ExpressionDictionary fromJson(JsonNode json) {
        return new ExpressionDictionary(ExprJson.entriesFromJson(json));
    }
}
