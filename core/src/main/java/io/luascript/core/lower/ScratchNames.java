package io.luascript.core.lower;

import java.util.HashMap;
import java.util.Map;

/**
 * Allocates compiler-generated local names such as {@code __try_1} or {@code __destructure_3}.
 *
 * <p>Each family has its own counter starting at 1. Counters live on one lowerer instance, so the
 * names of a compilation depend only on its input.
 */
final class ScratchNames {

    static final String DESTRUCTURE = "destructure";
    static final String SWITCH = "switch";
    static final String SWITCH_END = "switch_end";
    static final String TRY = "try";
    static final String OPTIONAL = "opt";
    static final String NULLISH = "nc";
    static final String CONTINUE = "continue";
    static final String KEY = "key";
    static final String PLACE = "place";

    /** Snapshot local of a postfix update used as a value. */
    static final String UPDATE_SNAPSHOT = "_t";

    private final Map<String, Integer> counters = new HashMap<>();

    /** Next ordinal in {@code family}. */
    int next(String family) {
        return counters.merge(family, 1, Integer::sum);
    }

    /** {@code __<family>_<n>} with a fresh ordinal. */
    String fresh(String family) {
        return name(family, next(family));
    }

    static String name(String family, int ordinal) {
        return "__" + family + "_" + ordinal;
    }
}
