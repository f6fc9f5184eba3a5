package io.luascript.core.ir;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Typed handle for an entry in the node table. Node fields reference other nodes through these
 * handles, never through object references.
 *
 * @param value the wire form, {@code <prefix>_<balanced-ternary digits>}
 */
public record NodeId(String value) implements Comparable<NodeId> {

    /** Wire format of every node, graph and block identifier. */
    public static final Pattern FORMAT = Pattern.compile("^[a-zA-Z][a-zA-Z0-9]*_[T01]+$");

    public NodeId {
        Objects.requireNonNull(value, "value must not be null");
        if (!FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("Malformed node id: '" + value + "'");
        }
    }

    public static NodeId of(String value) {
        return new NodeId(value);
    }

    /** Returns {@code true} if {@code value} is a well-formed identifier. */
    public static boolean isWellFormed(String value) {
        return value != null && FORMAT.matcher(value).matches();
    }

    /** The part before the underscore. */
    public String prefix() {
        return value.substring(0, value.lastIndexOf('_'));
    }

    /** The decoded counter value this identifier was allocated from. */
    public long ordinal() {
        return BalancedTernary.decode(value.substring(value.lastIndexOf('_') + 1));
    }

    /** Orders identifiers by allocation order. */
    @Override
    public int compareTo(NodeId other) {
        return Long.compare(ordinal(), other.ordinal());
    }

    @Override
    public String toString() {
        return value;
    }
}
