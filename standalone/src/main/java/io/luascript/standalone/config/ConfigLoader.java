package io.luascript.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link CompilerConfig} from a YAML file with an environment variable overlay.
 *
 * <p>Two invocation patterns are supported:
 * <ul>
 * <li>Default: {@code luascript.yaml} in the current directory, if it exists. Without it the
 * defaults apply.</li>
 * <li>{@code --config /path/to/config.yaml}: the file must exist.</li>
 * </ul>
 *
 * <p>Environment variables take precedence over YAML values. A variable counts as set only if it is
 * defined and its trimmed value is non-empty; blank values leave the YAML value in place.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Configuration file looked up in the working directory when {@code --config} is absent. */
    public static final String DEFAULT_CONFIG_FILE = "luascript.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static CompilerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from {@code envLookup}.
     * {@code envLookup} returns {@code null} for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static CompilerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = MissingNode.getInstance();
        } else if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }
        return mapToConfig(root, envLookup);
    }

    /** Defaults plus the environment overlay, for runs without a configuration file. */
    public static CompilerConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(MissingNode.getInstance(), envLookup);
    }

    /**
     * Resolves the configuration for a command line: the {@code --config} file if given, else
     * {@link #DEFAULT_CONFIG_FILE} if present, else defaults.
     */
    public static CompilerConfig resolve(String[] args, Function<String, String> envLookup) {
        Path explicit = explicitConfigPath(args);
        if (explicit != null) {
            return load(explicit, envLookup);
        }
        Path fallback = Path.of(DEFAULT_CONFIG_FILE);
        return Files.exists(fallback) ? load(fallback, envLookup) : fromEnvironment(envLookup);
    }

    /** The path following {@code --config}, or {@code null}. */
    public static Path explicitConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return null;
    }

    private static CompilerConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        CompilerConfig.Builder builder = CompilerConfig.builder();

        // --- YAML mapping ---

        JsonNode compiler = root.path("compiler");
        if (compiler.has("validate")) builder.validate(compiler.get("validate").asBoolean());
        if (compiler.has("emit-ir")) builder.emitIr(compiler.get("emit-ir").asBoolean());
        if (compiler.has("output-dir")) builder.outputDir(compiler.get("output-dir").asText());
        if (compiler.has("indent")) builder.indent(requireInt(compiler, "indent", "compiler.indent"));

        JsonNode hints = root.path("hints");
        if (hints.has("endpoint")) builder.hintsEndpoint(hints.get("endpoint").asText());
        if (hints.has("timeout-ms")) builder.hintsTimeoutMs(requireInt(hints, "timeout-ms", "hints.timeout-ms"));

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---

        envBool(envLookup, "LUASCRIPT_VALIDATE", builder::validate);
        envBool(envLookup, "LUASCRIPT_EMIT_IR", builder::emitIr);
        envString(envLookup, "LUASCRIPT_OUTPUT_DIR", builder::outputDir);
        envInt(envLookup, "LUASCRIPT_INDENT", builder::indent);
        envString(envLookup, "LUASCRIPT_DOC_INDEX_ENDPOINT", builder::hintsEndpoint);
        envInt(envLookup, "LUASCRIPT_HINTS_TIMEOUT_MS", builder::hintsTimeoutMs);
        envString(envLookup, "LUASCRIPT_LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LUASCRIPT_LOG_LEVEL", builder::loggingLevel);

        return builder.build();
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static int requireInt(JsonNode section, String field, String key) {
        JsonNode value = section.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new ConfigLoadException(key + " must be an integer, got '" + value.asText() + "'");
        }
        return value.intValue();
    }
}
