package io.luascript.core.error;

/** Thrown when the emitter meets an IR shape it has no rendering rule for. */
public final class EmissionException extends CompilationException {

    private static final long serialVersionUID = 1L;

    private final String nodeKind;

    public EmissionException(String message, String sourcePath, String nodeKind) {
        super(message, sourcePath, Stage.EMIT);
        this.nodeKind = nodeKind;
    }

    public EmissionException(String message, String sourcePath, String nodeKind, Throwable cause) {
        super(message, cause, sourcePath, Stage.EMIT);
        this.nodeKind = nodeKind;
    }

    /** IR node kind that could not be rendered. */
    public String nodeKind() {
        return nodeKind;
    }
}
