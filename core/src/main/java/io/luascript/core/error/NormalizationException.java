package io.luascript.core.error;

/**
 * Thrown when a raw AST cannot be brought into canonical shape, for example when the raw tree
 * contains error placeholders that the declaration fallback cannot reconstruct.
 */
public final class NormalizationException extends CompilationException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    public NormalizationException(String message, String sourcePath, int line, int column) {
        super(message, sourcePath, Stage.NORMALIZE);
        this.line = line;
        this.column = column;
    }

    public NormalizationException(String message, String sourcePath, int line, int column, Throwable cause) {
        super(message, cause, sourcePath, Stage.NORMALIZE);
        this.line = line;
        this.column = column;
    }

    /** 1-based line of the offending node, or {@code -1} when unknown. */
    public int line() {
        return line;
    }

    /** 0-based column of the offending node, or {@code -1} when unknown. */
    public int column() {
        return column;
    }
}
