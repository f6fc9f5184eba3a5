package io.luascript.standalone.config;

/**
 * Root configuration for the command-line compiler.
 *
 * <p>Every field has a default, so an empty YAML file is a valid configuration. Use
 * {@link #builder()} to construct instances.
 *
 * @param validate        validate the IR before it is returned or written
 * @param emitIr          also write {@code <name>.ir.json} next to the Lua output
 * @param outputDir       directory for generated files; {@code null} writes next to each source
 * @param indent          spaces per Lua indentation level (0..8)
 * @param hintsEndpoint   documentation-hint service URL; {@code null} disables hints
 * @param hintsTimeoutMs  connect and request timeout of the hint lookup
 * @param loggingFormat   {@code json} or {@code text}
 * @param loggingLevel    root log level
 */
public record CompilerConfig(
        boolean validate,
        boolean emitIr,
        String outputDir,
        int indent,
        String hintsEndpoint,
        int hintsTimeoutMs,
        String loggingFormat,
        String loggingLevel) {

    public CompilerConfig {
        if (indent < 0 || indent > 8) {
            throw new ConfigLoadException("compiler.indent must be between 0 and 8, got " + indent);
        }
        if (hintsTimeoutMs <= 0) {
            throw new ConfigLoadException("hints.timeout-ms must be positive, got " + hintsTimeoutMs);
        }
        if (!"json".equalsIgnoreCase(loggingFormat) && !"text".equalsIgnoreCase(loggingFormat)) {
            throw new ConfigLoadException("logging.format must be 'json' or 'text', got '" + loggingFormat + "'");
        }
    }

    /** Configuration with every default applied. */
    public static CompilerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CompilerConfig}. */
    public static final class Builder {
        private boolean validate = true;
        private boolean emitIr = false;
        private String outputDir;
        private int indent = 2;
        private String hintsEndpoint;
        private int hintsTimeoutMs = 2000;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder validate(boolean validate) {
            this.validate = validate;
            return this;
        }

        public Builder emitIr(boolean emitIr) {
            this.emitIr = emitIr;
            return this;
        }

        public Builder outputDir(String outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder indent(int indent) {
            this.indent = indent;
            return this;
        }

        public Builder hintsEndpoint(String hintsEndpoint) {
            this.hintsEndpoint = hintsEndpoint;
            return this;
        }

        public Builder hintsTimeoutMs(int hintsTimeoutMs) {
            this.hintsTimeoutMs = hintsTimeoutMs;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public CompilerConfig build() {
            return new CompilerConfig(
                    validate, emitIr, outputDir, indent, hintsEndpoint, hintsTimeoutMs, loggingFormat, loggingLevel);
        }
    }
}
