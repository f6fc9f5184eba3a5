package io.luascript.core.emit;

/**
 * Rendering options.
 *
 * @param indent spaces per nesting level, 0 to 8
 */
public record EmitterOptions(int indent) {

    public static final int DEFAULT_INDENT = 2;

    public EmitterOptions {
        if (indent < 0 || indent > 8) {
            throw new IllegalArgumentException("indent must be between 0 and 8, got " + indent);
        }
    }

    public static EmitterOptions defaults() {
        return new EmitterOptions(DEFAULT_INDENT);
    }
}
