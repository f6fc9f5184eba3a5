package io.luascript.core.error;

/**
 * Abstract base for every failure raised by the compilation pipeline. Never thrown directly; each
 * stage has its own concrete subclass so callers can tell which stage failed and why.
 */
public abstract class CompilationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Pipeline stage in which the error occurred, in execution order. */
    public enum Stage {
        PARSE,
        NORMALIZE,
        LOWER,
        VALIDATE,
        EMIT
    }

    private final String sourcePath;
    private final Stage stage;

    protected CompilationException(String message, String sourcePath, Stage stage) {
        super(message);
        this.sourcePath = sourcePath;
        this.stage = stage;
    }

    protected CompilationException(String message, Throwable cause, String sourcePath, Stage stage) {
        super(message, cause);
        this.sourcePath = sourcePath;
        this.stage = stage;
    }

    /** The compiled source path, or {@code null} if the source was anonymous. */
    public String sourcePath() {
        return sourcePath;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The stage in which the error occurred. */
    public Stage stage() {
        return stage;
    }
}
