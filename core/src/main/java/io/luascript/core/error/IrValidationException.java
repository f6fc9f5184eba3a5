package io.luascript.core.error;

import java.util.List;

/**
 * Thrown by the pipeline when the validator reports structural or schema violations. The IR that
 * produced these errors is never handed to the emitter.
 */
public final class IrValidationException extends CompilationException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public IrValidationException(String sourcePath, List<String> errors) {
        super("IR validation failed with " + errors.size() + " error(s): " + errors, sourcePath, Stage.VALIDATE);
        this.errors = List.copyOf(errors);
    }

    public IrValidationException(String sourcePath, List<String> errors, Throwable cause) {
        super("IR validation failed with " + errors.size() + " error(s): " + errors, cause, sourcePath, Stage.VALIDATE);
        this.errors = List.copyOf(errors);
    }

    /** The validator's error messages, in discovery order. */
    public List<String> errors() {
        return errors;
    }
}
