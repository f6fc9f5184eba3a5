package io.luascript.core.ir;

/** Checks a built IR document without throwing on malformed content. */
@FunctionalInterface
public interface DocumentValidator {

    ValidationResult validate(IrDocument document);
}
