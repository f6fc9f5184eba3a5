package io.luascript.standalone.cli;

import io.luascript.core.emit.EmitterOptions;
import io.luascript.core.engine.CompileOptions;
import io.luascript.core.engine.CompilerPipeline;
import io.luascript.core.engine.TranspileResult;
import io.luascript.core.error.CompilationException;
import io.luascript.standalone.config.CompilerConfig;
import io.luascript.standalone.hints.DocHint;
import io.luascript.standalone.hints.DocHintClient;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code luascript [--config file.yaml] [--emit-ir] [--out dir] <file.js>...}
 *
 * <p>Compiles each file independently and writes {@code <name>.lua}, plus {@code <name>.ir.json}
 * when IR output is requested. A failing file does not stop the others; the exit code is 1 if any
 * file failed.
 */
public final class CompileCommand {

    private static final Logger LOG = LoggerFactory.getLogger(CompileCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    static final String LUA_SUFFIX = ".lua";
    static final String IR_SUFFIX = ".ir.json";

    /** Parsed command line. {@code outputDir} is {@code null} when {@code --out} is absent. */
    public record Arguments(Path configPath, boolean emitIr, Path outputDir, List<Path> sources) {

        public Arguments {
            sources = List.copyOf(sources);
        }
    }

    private final CompilerConfig config;
    private final CompilerPipeline pipeline;
    private final DocHintClient hints;

    public CompileCommand(CompilerConfig config) {
        this(
                config,
                new CompilerPipeline(new EmitterOptions(config.indent())),
                new DocHintClient(config.hintsEndpoint(), Duration.ofMillis(config.hintsTimeoutMs())));
    }

    CompileCommand(CompilerConfig config, CompilerPipeline pipeline, DocHintClient hints) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.hints = Objects.requireNonNull(hints, "hints must not be null");
    }

    /**
     * Parses the command line.
     *
     * @throws IllegalArgumentException on an unknown option, a missing option value or no sources
     */
    public static Arguments parse(String[] args) {
        Path configPath = null;
        boolean emitIr = false;
        Path outputDir = null;
        List<Path> sources = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config" -> configPath = Path.of(value(args, ++i, arg));
                case "--emit-ir" -> emitIr = true;
                case "--out" -> outputDir = Path.of(value(args, ++i, arg));
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    sources.add(Path.of(arg));
                }
            }
        }
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("No source files given");
        }
        return new Arguments(configPath, emitIr, outputDir, sources);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires an argument");
        }
        return args[index];
    }

    /** Compiles every source named in {@code arguments}; returns the process exit code. */
    public int run(Arguments arguments) {
        boolean emitIr = arguments.emitIr() || config.emitIr();
        Path outputDir = arguments.outputDir() != null
                ? arguments.outputDir()
                : config.outputDir() != null ? Path.of(config.outputDir()) : null;
        int failures = 0;
        for (Path source : arguments.sources()) {
            if (!compileOne(source, outputDir, emitIr)) {
                failures++;
            }
        }
        LOG.info("Compiled {} of {} file(s)", arguments.sources().size() - failures, arguments.sources().size());
        return failures == 0 ? EXIT_OK : EXIT_FAILURE;
    }

    private boolean compileOne(Path source, Path outputDir, boolean emitIr) {
        String text;
        try {
            text = Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.error("Cannot read source: path={}, reason={}", source, e.toString());
            return false;
        }
        CompileOptions options = CompileOptions.forPath(source.toString()).withValidate(config.validate());
        TranspileResult result;
        try {
            result = pipeline.transpile(text, options);
        } catch (CompilationException e) {
            LOG.error("Compilation failed: source={}, stage={}, detail={}", source, e.stage(), e.detail());
            logHints(e.detail());
            return false;
        }
        Path dir = outputDir != null ? outputDir : parentOf(source);
        String base = baseName(source);
        try {
            Files.createDirectories(dir);
            Path luaFile = dir.resolve(base + LUA_SUFFIX);
            Files.writeString(luaFile, result.lua(), StandardCharsets.UTF_8);
            LOG.info("Wrote {}", luaFile);
            if (emitIr) {
                Path irFile = dir.resolve(base + IR_SUFFIX);
                Files.writeString(irFile, result.ir().toJsonString(), StandardCharsets.UTF_8);
                LOG.info("Wrote {}", irFile);
            }
        } catch (IOException e) {
            LOG.error("Cannot write output: source={}, dir={}, reason={}", source, dir, e.toString());
            return false;
        }
        return true;
    }

    private void logHints(String detail) {
        if (!hints.enabled()) {
            return;
        }
        Optional<List<DocHint>> found = hints.lookup(detail);
        found.ifPresent(list -> {
            for (DocHint hint : list) {
                LOG.info("Hint: {} {} {}", hint.title(), hint.url(), hint.snippet());
            }
        });
    }

    private static Path parentOf(Path source) {
        Path parent = source.toAbsolutePath().getParent();
        return parent != null ? parent : Path.of(".");
    }

    /** File name without its {@code .js}, {@code .mjs} or {@code .cjs} extension. */
    static String baseName(Path source) {
        String name = source.getFileName().toString();
        for (String ext : List.of(".mjs", ".cjs", ".js")) {
            if (name.endsWith(ext) && name.length() > ext.length()) {
                return name.substring(0, name.length() - ext.length());
            }
        }
        return name;
    }
}
