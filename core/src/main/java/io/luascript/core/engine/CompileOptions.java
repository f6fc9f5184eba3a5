package io.luascript.core.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-compilation options.
 *
 * @param sourcePath path recorded in the IR and in error messages; {@code <anonymous>} when unknown
 * @param metadata   extra module metadata entries, copied into {@code module.metadata}
 * @param validate   run the IR validator before returning the document
 */
public record CompileOptions(String sourcePath, Map<String, String> metadata, boolean validate) {

    public static final String ANONYMOUS = "<anonymous>";

    public CompileOptions {
        sourcePath = sourcePath == null || sourcePath.isBlank() ? ANONYMOUS : sourcePath;
        Objects.requireNonNull(metadata, "metadata must not be null");
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** Validating options for {@code sourcePath} with no extra metadata. */
    public static CompileOptions forPath(String sourcePath) {
        return new CompileOptions(sourcePath, Map.of(), true);
    }

    public static CompileOptions defaults() {
        return forPath(ANONYMOUS);
    }

    public CompileOptions withValidate(boolean newValidate) {
        return new CompileOptions(sourcePath, metadata, newValidate);
    }

    public CompileOptions withMetadata(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new CompileOptions(sourcePath, copy, validate);
    }
}
