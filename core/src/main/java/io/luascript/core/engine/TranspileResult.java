package io.luascript.core.engine;

import io.luascript.core.ir.IrDocument;
import java.util.Objects;

/**
 * Output of a full transpilation.
 *
 * @param ir  the validated IR document
 * @param lua the emitted Lua source
 */
public record TranspileResult(IrDocument ir, String lua) {

    public TranspileResult {
        Objects.requireNonNull(ir, "ir must not be null");
        Objects.requireNonNull(lua, "lua must not be null");
    }
}
