package io.luascript.core.error;

/**
 * Thrown when a canonical AST node cannot be lowered to IR: an unrecognized node type, a malformed
 * destructuring pattern, or a construct the target language has no encoding for. Lowering failures
 * are fatal to the current compilation.
 */
public final class LoweringException extends CompilationException {

    private static final long serialVersionUID = 1L;

    private final String nodeType;
    private final int line;
    private final int column;

    public LoweringException(String message, String sourcePath, String nodeType, int line, int column) {
        super(format(message, nodeType, line, column), sourcePath, Stage.LOWER);
        this.nodeType = nodeType;
        this.line = line;
        this.column = column;
    }

    public LoweringException(
            String message, String sourcePath, String nodeType, int line, int column, Throwable cause) {
        super(format(message, nodeType, line, column), cause, sourcePath, Stage.LOWER);
        this.nodeType = nodeType;
        this.line = line;
        this.column = column;
    }

    /** The canonical AST {@code type} of the node that failed to lower. */
    public String nodeType() {
        return nodeType;
    }

    /** 1-based source line, or {@code -1} when the node carries no location. */
    public int line() {
        return line;
    }

    /** 0-based source column, or {@code -1} when the node carries no location. */
    public int column() {
        return column;
    }

    private static String format(String message, String nodeType, int line, int column) {
        StringBuilder sb = new StringBuilder(message).append(" [type=").append(nodeType);
        if (line >= 0) {
            sb.append(", line=").append(line).append(", column=").append(column);
        }
        return sb.append(']').toString();
    }
}
