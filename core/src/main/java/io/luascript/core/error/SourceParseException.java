package io.luascript.core.error;

/** Thrown when source text cannot be tokenized or parsed into a raw AST. */
public final class SourceParseException extends CompilationException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    public SourceParseException(String message, String sourcePath, int line, int column) {
        super(message + " (line " + line + ", column " + column + ")", sourcePath, Stage.PARSE);
        this.line = line;
        this.column = column;
    }

    /** A parser fault with no token position; {@link #line()} and {@link #column()} are {@code -1}. */
    public SourceParseException(String message, String sourcePath, Throwable cause) {
        super(message, cause, sourcePath, Stage.PARSE);
        this.line = -1;
        this.column = -1;
    }

    /** 1-based line of the offending token. */
    public int line() {
        return line;
    }

    /** 0-based column of the offending token. */
    public int column() {
        return column;
    }
}
