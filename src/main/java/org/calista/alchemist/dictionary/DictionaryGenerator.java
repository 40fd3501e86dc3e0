package org.calista.alchemist.dictionary;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.alchemist.expr.Expr;
import org.calista.alchemist.number.Rational;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * DictionaryGenerator — seeds an {@link ExpressionDictionary} from a base digit string.
 *
 * <p>
 * {@link #generate(String)} splits a digit string at every point, generates both halves
 * recursively and merges them; the literal itself is always added. Results are memoized per
 * digit substring for the lifetime of this generator (one generator per base).
 * </p>
 *
 * <p>
 * {@link #bootstrap()} = generate(base) + literal x literal + {@code selfMergeRounds} rounds of
 * the whole dictionary merged with itself.
 * </p>
 */
public final class DictionaryGenerator {

    private static final Logger log = LogManager.getLogger(DictionaryGenerator.class);

    private final String base;
    private final SplitPolicy splitPolicy;
    private final int selfMergeRounds;
    private final DictionaryMerger merger;

    private final Map<String, ExpressionDictionary> memo = new HashMap<>();

    public DictionaryGenerator(String base) {
        this(base, SplitPolicy.LAST_SPLIT, 1);
    }

    /**
     * @param base raw base input; non-digit characters are stripped
     * @throws IllegalArgumentException when no digit remains
     */
    public DictionaryGenerator(String base, SplitPolicy splitPolicy, int selfMergeRounds) {
        this.base = digitsOf(base);
        if (this.base.isEmpty()) throw new IllegalArgumentException("Base has no digits: '" + base + "'");
        if (selfMergeRounds < 0) throw new IllegalArgumentException("selfMergeRounds < 0");
        this.splitPolicy = (splitPolicy == null ? SplitPolicy.LAST_SPLIT : splitPolicy);
        this.selfMergeRounds = selfMergeRounds;
        this.merger = new DictionaryMerger(this.base + this.base);
    }

    public static String digitsOf(String raw) {
        Objects.requireNonNull(raw, "raw");
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c >= '0' && c <= '9') sb.append(c);
        }
        return sb.toString();
    }

    public String base() {
        return base;
    }

    public SplitPolicy splitPolicy() {
        return splitPolicy;
    }

    /** Memoized; the returned dictionary is shared and must not be mutated by callers. */
    public ExpressionDictionary generate(String digits) {
        Objects.requireNonNull(digits, "digits");
        if (digits.isEmpty()) throw new IllegalArgumentException("Empty digit string");

        ExpressionDictionary cached = memo.get(digits);
        if (cached != null) return cached;

        ExpressionDictionary result = new ExpressionDictionary();
        for (int i = 1; i < digits.length(); i++) {
            ExpressionDictionary split = merger.merge(generate(digits.substring(0, i)), generate(digits.substring(i)));
            if (splitPolicy == SplitPolicy.ALL_SPLITS) result.absorb(split);
            else result = split;
        }
        result.add(Rational.parse(digits), Expr.number(digits));

        memo.put(digits, result);
        return result;
    }

    /** Fresh dictionary holding the initial knowledge for {@link #base()}. */
    public ExpressionDictionary bootstrap() {
        long t0 = System.nanoTime();

        ExpressionDictionary dict = new ExpressionDictionary();
        dict.absorb(generate(base));

        ExpressionDictionary literal = new ExpressionDictionary();
        literal.put(Rational.parse(base).toString(), Expr.number(base));
        dict.absorb(merger.merge(literal, literal));

        for (int round = 0; round < selfMergeRounds; round++) {
            dict.absorb(merger.merge(dict, dict));
        }

        log.info("Dictionary for base {} ready: {} entries ({} ms, split={}, selfMerge={})",
                base, dict.size(), (System.nanoTime() - t0) / 1_000_000L, splitPolicy, selfMergeRounds);
        return dict;
    }
}
