package org.calista.alchemist.prove;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.alchemist.dictionary.DictionaryGenerator;
import org.calista.alchemist.dictionary.ExpressionDictionary;
import org.calista.alchemist.expr.Expr;
import org.calista.alchemist.expr.Operator;
import org.calista.alchemist.number.ArithmeticDomainException;
import org.calista.alchemist.number.Rational;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.function.Consumer;

/**
 * ProofEngine — finds or derives an expression over the dictionary that evaluates to a target.
 *
 * <p>
 * Per (sub)target, depth-bounded:
 * </p>
 * <ol>
 *   <li>non-integer: prove numerator and denominator, combine with {@code /} (not recorded)</li>
 *   <li>dictionary hit</li>
 *   <li>depth exhausted -> {@link DepthExhaustedException}</li>
 *   <li>factor pass: {@code a * b} from a non-trivial factorization</li>
 *   <li>key passes over keys by descending magnitude, in order
 *       division, multiplication, modulo, subtraction, addition;
 *       the first pass that yields a result wins</li>
 * </ol>
 *
 * <p>
 * Every derived integer result is recorded into the dictionary (with its negation), so later
 * queries reuse it. Every recursive sub-target is smaller in magnitude than its parent or is
 * already a dictionary key; an in-progress set additionally rejects cycles through fractional keys.
 * For that reason the modulo pass requires both the remainder and the floored quotient to be
 * smaller than the target, which also skips the keys 1 and -1.
 * </p>
 *
 * <p>
 * The division and modulo passes may keep scanning after a success from a random earlier key
 * ({@link Config#continueProbability}, at most {@link Config#maxRestartsPerPass} times per pass),
 * so repeated queries do not always settle on the same shape.
 * </p>
 *
 * One top-level call at a time; re-entrant or concurrent calls fail with {@link IllegalStateException}.
 */
public final class ProofEngine {
    private static final Logger log = LogManager.getLogger(ProofEngine.class);

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static final class Config {
        /** Probability of continuing a division/modulo pass after a success. */
        public double continueProbability = 1.0 / 3.0;
        public int maxRestartsPerPass = 4;
        /** Within one top-level call, do not retry a target that already failed at this depth or deeper. */
        public boolean memoizeFailures = true;
        /** 0 = time based. */
        public long seed = 0L;

        public Config validate() {
            if (Double.isNaN(continueProbability)) continueProbability = 0.0;
            continueProbability = Math.max(0.0, Math.min(1.0, continueProbability));
            maxRestartsPerPass = Math.max(0, maxRestartsPerPass);
            return this;
        }
    }

    private final ExpressionDictionary dictionary;
    private final Config cfg;
    private final Random random;

    private Session session;

    public ProofEngine(ExpressionDictionary dictionary) {
        this(dictionary, new Config());
    }

    public ProofEngine(ExpressionDictionary dictionary, Config cfg) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
        this.cfg = (cfg == null ? new Config() : cfg).validate();
        this.random = (this.cfg.seed == 0L) ? new Random() : new Random(this.cfg.seed);
    }

    /** Builds the dictionary for {@code base} with default generation settings. */
    public static ProofEngine forBase(String base) {
        return new ProofEngine(new DictionaryGenerator(base).bootstrap());
    }

    public ExpressionDictionary dictionary() {
        return dictionary;
    }

    public Config config() {
        return cfg;
    }

    // ---------------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------------

    public String prove(String target) {
        return prove(target, UNBOUNDED);
    }

    /**
     * @param target integer, fraction ("n/d") or decimal literal
     */
    public String prove(String target, int maxDepth) {
        Objects.requireNonNull(target, "target");
        return prove(Rational.parse(target), maxDepth, null);
    }

    public String prove(Rational target, int maxDepth, Consumer<String> onProgress) {
        ProofListener listener = (onProgress == null) ? ProofListener.NONE : (t, best) -> onProgress.accept(best.render());
        return proveAst(target, maxDepth, listener).render();
    }

    /**
     * @throws DepthExhaustedException when the budget runs out before a derivation is found
     * @throws ProofNotFoundException  when every strategy failed
     */
    public Expr proveAst(Rational target, int maxDepth, ProofListener listener) {
        Objects.requireNonNull(target, "target");
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth < 0: " + maxDepth);

        if (session != null) throw new IllegalStateException("ProofEngine is already proving " + session.target);
        Session s = new Session(target, listener == null ? ProofListener.NONE : listener);
        session = s;
        long t0 = System.nanoTime();
        try {
            Expr result = proveAt(target, maxDepth);
            s.notifyFinal(result);
            if (log.isDebugEnabled()) {
                log.debug("prove {} -> '{}' (depth={}, calls={}, candidates={}, failed={}, dict={}, {} ms)",
                        target, result.render(), maxDepth == UNBOUNDED ? "inf" : maxDepth, s.calls, s.candidates,
                        s.failedCandidates, dictionary.size(), (System.nanoTime() - t0) / 1_000_000L);
            }
            return result;
        } finally {
            session = null;
        }
    }

    // ---------------------------------------------------------------------
    // Search
    // ---------------------------------------------------------------------

    private Expr proveAt(Rational target, int depth) {
        Session s = session;
        s.calls++;

        if (!target.isInteger()) {
            Expr num = proveAt(Rational.of(target.numerator()), depth - 1);
            Expr den = proveAt(Rational.of(target.denominator()), depth - 1);
            return Expr.of(Operator.DIVIDE, num, den);
        }

        String key = target.toString();
        Expr hit = dictionary.get(key).orElse(null);
        if (hit != null) return hit;

        if (depth <= 0) throw new DepthExhaustedException(target);

        if (cfg.memoizeFailures) {
            Integer failedAt = s.failedAt.get(key);
            if (failedAt != null && failedAt >= depth) throw new ProofNotFoundException(target, "failed before at depth " + failedAt);
        }
        if (!s.active.add(key)) throw new ProofNotFoundException(target, "already being proved");

        long depthFailuresBefore = s.depthFailures;
        try {
            Expr result = factorPass(target, depth);
            if (result == null) result = divisionPass(target, depth);
            if (result == null) result = multiplicationPass(target);
            if (result == null) result = moduloPass(target, depth);
            if (result == null) result = subtractionPass(target, depth);
            if (result == null) result = additionPass(target, depth);

            if (result != null) return result;

            if (cfg.memoizeFailures) s.failedAt.merge(key, depth, Math::max);
            if (s.depthFailures > depthFailuresBefore) throw new DepthExhaustedException(target);
            throw new ProofNotFoundException(target);
        } finally {
            s.active.remove(key);
        }
    }

    private Expr factorPass(Rational target, int depth) {
        if (target.abs().compareTo(Rational.ONE) <= 0) return null;

        Factorizer.Factors f = Factorizer.factorize(target);
        if (f.isTrivial()) return null;
        try {
            session.candidates++;
            Expr a = proveAt(Rational.of(f.small), depth - 1);
            Expr b = proveAt(Rational.of(f.large), depth - 1);
            return record(target, Expr.of(Operator.MULTIPLY, a, b));
        } catch (ProofException | ArithmeticDomainException e) {
            candidateFailed("factor", target, f.toString(), e);
            return null;
        }
    }

    /** {@code key^times * q}: divide repeatedly while the quotient stays integral and shrinks. */
    private Expr divisionPass(Rational target, int depth) {
        List<Rational> keys = dictionary.keysByMagnitude();
        Expr result = null;
        int restarts = 0;

        for (int i = 0; i < keys.size(); i++) {
            Rational k = keys.get(i);
            if (k.isZero()) continue;

            Rational q = target;
            int times = 0;
            while (true) {
                Rational next = q.divide(k);
                if (!next.isInteger() || next.compareMagnitude(q) >= 0) break;
                q = next;
                times++;
            }
            if (times == 0) continue;

            try {
                session.candidates++;
                Expr keyExpr = keyExpr(k);
                Expr head = keyExpr;
                if (times > 1) head = Expr.of(Operator.POWER, keyExpr, proveAt(Rational.of(times), depth - 1));
                Expr quotient = proveAt(q, depth - 1);
                result = record(target, Expr.of(Operator.MULTIPLY, head, quotient));
            } catch (ProofException | ArithmeticDomainException e) {
                candidateFailed("division", target, k + "^" + times, e);
                continue;
            }

            if (restarts >= cfg.maxRestartsPerPass || random.nextDouble() >= cfg.continueProbability) break;
            restarts++;
            i = random.nextInt(i + 1) - 1;
        }
        return result;
    }

    /** {@code (target*key) / key} when the product is already a key. No recursion. */
    private Expr multiplicationPass(Rational target) {
        for (Rational k : dictionary.keysByMagnitude()) {
            if (k.isZero()) continue;
            Rational product = target.multiply(k);
            Expr productExpr = dictionary.get(product).orElse(null);
            if (productExpr == null) continue;

            session.candidates++;
            return record(target, Expr.of(Operator.DIVIDE, productExpr, keyExpr(k)));
        }
        return null;
    }

    /** {@code key * floor(target/key) + target mod key}. */
    private Expr moduloPass(Rational target, int depth) {
        List<Rational> keys = dictionary.keysByMagnitude();
        Rational magnitude = target.abs();
        Expr result = null;
        int restarts = 0;

        for (int i = 0; i < keys.size(); i++) {
            Rational k = keys.get(i);
            if (k.isZero()) continue;

            Rational r = target.mod(k);
            if (!r.abs().lessThan(magnitude)) continue;
            Rational q = target.divide(k).floor();
            if (!q.abs().lessThan(magnitude)) continue;

            try {
                session.candidates++;
                Expr quotient = proveAt(q, depth - 1);
                Expr remainder = proveAt(r, depth - 1);
                result = record(target, Expr.of(Operator.ADD, Expr.of(Operator.MULTIPLY, keyExpr(k), quotient), remainder));
            } catch (ProofException | ArithmeticDomainException e) {
                candidateFailed("modulo", target, k.toString(), e);
                continue;
            }

            if (restarts >= cfg.maxRestartsPerPass || random.nextDouble() >= cfg.continueProbability) break;
            restarts++;
            i = random.nextInt(i + 1) - 1;
        }
        return result;
    }

    /** {@code key + (target - key)}. */
    private Expr subtractionPass(Rational target, int depth) {
        Rational magnitude = target.abs();
        for (Rational k : dictionary.keysByMagnitude()) {
            Rational diff = target.subtract(k);
            if (!diff.abs().lessThan(magnitude)) continue;
            try {
                session.candidates++;
                Expr d = proveAt(diff, depth - 1);
                return record(target, Expr.of(Operator.ADD, keyExpr(k), d));
            } catch (ProofException | ArithmeticDomainException e) {
                candidateFailed("subtraction", target, k.toString(), e);
            }
        }
        return null;
    }

    /** {@code (target + key) - key} when the sum is known or smaller. */
    private Expr additionPass(Rational target, int depth) {
        Rational magnitude = target.abs();
        for (Rational k : dictionary.keysByMagnitude()) {
            Rational sum = target.add(k);
            if (!dictionary.contains(sum) && !sum.abs().lessThan(magnitude)) continue;
            try {
                session.candidates++;
                Expr s = proveAt(sum, depth - 1);
                return record(target, Expr.of(Operator.SUBTRACT, s, keyExpr(k)));
            } catch (ProofException | ArithmeticDomainException e) {
                candidateFailed("addition", target, k.toString(), e);
            }
        }
        return null;
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private Expr keyExpr(Rational k) {
        return dictionary.get(k).orElseThrow(() -> new IllegalStateException("Key vanished: " + k));
    }

    /** Adds the derivation (cheapest wins) and returns the dictionary's entry for the target. */
    private Expr record(Rational target, Expr derived) {
        dictionary.add(target, derived);
        session.notifyProgress();
        return keyExpr(target);
    }

    private void candidateFailed(String pass, Rational target, String candidate, RuntimeException e) {
        session.failedCandidates++;
        if (e instanceof DepthExhaustedException) session.depthFailures++;
        if (log.isTraceEnabled()) log.trace("{} pass: {} via {} failed: {}", pass, target, candidate, e.getMessage());
    }

    // ---------------------------------------------------------------------
    // Session (per top-level call)
    // ---------------------------------------------------------------------

    private final class Session {
        final Rational target;
        final String targetKey;
        final ProofListener listener;
        final Map<String, Integer> failedAt = new HashMap<>();
        final Set<String> active = new HashSet<>();

        String lastNotified;
        long calls;
        long candidates;
        long failedCandidates;
        long depthFailures;

        Session(Rational target, ProofListener listener) {
            this.target = target;
            this.targetKey = target.toString();
            this.listener = listener;
        }

        void notifyProgress() {
            Expr best = dictionary.get(targetKey).orElse(null);
            if (best != null) notify(best);
        }

        void notifyFinal(Expr result) {
            notify(result);
        }

        private void notify(Expr best) {
            String rendered = best.render();
            if (rendered.equals(lastNotified)) return;
            lastNotified = rendered;
            listener.onProgress(target, best);
        }
    }
}
