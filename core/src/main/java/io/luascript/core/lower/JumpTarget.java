package io.luascript.core.lower;

/**
 * An enclosing construct that {@code break} or {@code continue} can leave.
 *
 * <p>Labels are allocated lazily so a loop only gets a {@code ::label::} when some statement
 * actually jumps to it.
 */
final class JumpTarget {

    enum Kind {
        LOOP,
        SWITCH
    }

    private final Kind kind;
    private final ScratchNames names;
    private final String family;
    private String label;

    private JumpTarget(Kind kind, ScratchNames names, String family) {
        this.kind = kind;
        this.names = names;
        this.family = family;
    }

    static JumpTarget loop(ScratchNames names) {
        return new JumpTarget(Kind.LOOP, names, ScratchNames.CONTINUE);
    }

    static JumpTarget switchEnd(ScratchNames names) {
        return new JumpTarget(Kind.SWITCH, names, ScratchNames.SWITCH_END);
    }

    Kind kind() {
        return kind;
    }

    /** The jump label, allocating it on first use. */
    String useLabel() {
        if (label == null) {
            label = names.fresh(family);
        }
        return label;
    }

    boolean labelUsed() {
        return label != null;
    }

    String label() {
        return label;
    }
}
