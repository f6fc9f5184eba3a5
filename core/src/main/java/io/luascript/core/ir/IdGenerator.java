package io.luascript.core.ir;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Deterministic identifier source: {@code <prefix>_<balanced-ternary(counter)>}.
 *
 * <p>The counter starts at 0 and advances by one per {@link #next(String)} call, regardless of the
 * prefix, so allocation order across nodes, graphs and blocks is total. Instances are owned by a
 * single {@link IrBuilder} and are not thread-safe; concurrent compilations use separate instances.
 */
public final class IdGenerator {

    private static final Pattern PREFIX = Pattern.compile("[a-zA-Z][a-zA-Z0-9]*");

    private long counter;

    public IdGenerator() {
        this(0);
    }

    public IdGenerator(long start) {
        this.counter = start;
    }

    /**
     * Allocates the next identifier.
     *
     * @param prefix alphanumeric prefix starting with a letter
     * @return a fresh identifier, e.g. {@code id_1T}
     */
    public String next(String prefix) {
        Objects.requireNonNull(prefix, "prefix must not be null");
        if (!PREFIX.matcher(prefix).matches()) {
            throw new IllegalArgumentException("Invalid identifier prefix: '" + prefix + "'");
        }
        return prefix + "_" + BalancedTernary.encode(counter++);
    }

    /** The counter value the next call to {@link #next(String)} will encode. */
    public long peek() {
        return counter;
    }

    /** Resets the counter to 0. */
    public void reset() {
        counter = 0;
    }
}
