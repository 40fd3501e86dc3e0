package org.calista.alchemist.dictionary;

import java.util.Locale;

/** How the generator combines the merges of a digit string's split points. */
public enum SplitPolicy {

    /** Each split overwrites the previous one; only the last split's merge survives. */
    LAST_SPLIT,

    /** Union of the merges of every split point. */
    ALL_SPLITS;

    /** Accepts "last", "all", "last_split", "ALL-SPLITS"... ; anything else is LAST_SPLIT. */
    public static SplitPolicy parse(String s) {
        if (s == null) return LAST_SPLIT;
        String v = s.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (v.equals("ALL") || v.equals("ALL_SPLITS")) return ALL_SPLITS;
        return LAST_SPLIT;
    }
}
