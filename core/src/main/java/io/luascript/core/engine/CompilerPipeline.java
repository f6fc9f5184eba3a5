package io.luascript.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.luascript.core.emit.EmitterOptions;
import io.luascript.core.emit.LuaEmitter;
import io.luascript.core.error.CompilationException;
import io.luascript.core.error.CompilationException.Stage;
import io.luascript.core.error.EmissionException;
import io.luascript.core.error.IrValidationException;
import io.luascript.core.error.LoweringException;
import io.luascript.core.error.NormalizationException;
import io.luascript.core.error.SourceParseException;
import io.luascript.core.ir.IrBuilder;
import io.luascript.core.ir.IrDocument;
import io.luascript.core.ir.ValidationResult;
import io.luascript.core.lower.IrLowerer;
import io.luascript.core.normalize.AstNormalizer;
import io.luascript.core.parse.SourceParser;
import io.luascript.core.spi.CompilationListener;
import io.luascript.core.validate.IrValidator;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs Parse, Normalize, Lower, Validate and Emit over one source text.
 *
 * <p>Each call builds its own parser, normalizer, builder and lowerer, so one pipeline can serve
 * concurrent compilations. The validator and emitter are stateless and shared. A failure in any
 * stage surfaces as the {@link CompilationException} subclass for that stage; IR that fails
 * validation is never emitted.
 */
public final class CompilerPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(CompilerPipeline.class);

    /** MDC key holding the source path for the duration of a compilation. */
    public static final String MDC_SOURCE_PATH = "sourcePath";

    /** Value of {@code module.metadata.authoredBy}. */
    public static final String AUTHORED_BY = "luascript";

    /** Value of {@code module.metadata.toolchain}. */
    public static final String TOOLCHAIN = "luascript-core/ir-" + IrDocument.CURRENT_SCHEMA_VERSION;

    private final IrValidator validator;
    private final LuaEmitter emitter;
    private final CompilationListener listener;
    private final Clock clock;

    public CompilerPipeline() {
        this(new IrValidator(), new LuaEmitter(), null, Clock.systemUTC());
    }

    public CompilerPipeline(EmitterOptions emitterOptions) {
        this(new IrValidator(), new LuaEmitter(emitterOptions), null, Clock.systemUTC());
    }

    /**
     * Creates a pipeline with explicit collaborators.
     *
     * @param listener optional stage listener, may be {@code null}
     * @param clock    source of {@code module.metadata.createdAt}
     */
    public CompilerPipeline(IrValidator validator, LuaEmitter emitter, CompilationListener listener, Clock clock) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.emitter = Objects.requireNonNull(emitter, "emitter must not be null");
        this.listener = listener; // nullable
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Compiles {@code source} into an IR document.
     *
     * @throws CompilationException from the first stage that fails; {@link IrValidationException}
     *                              when validation is enabled and the IR is rejected
     */
    public IrDocument compile(String source, CompileOptions options) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(options, "options must not be null");
        String path = options.sourcePath();
        MDC.put(MDC_SOURCE_PATH, path);
        try {
            return compileInContext(source, options, System.nanoTime());
        } finally {
            MDC.remove(MDC_SOURCE_PATH);
        }
    }

    /**
     * Compiles {@code source} and emits Lua. The IR is always validated before emission, whatever
     * {@link CompileOptions#validate()} says.
     */
    public TranspileResult transpile(String source, CompileOptions options) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(options, "options must not be null");
        String path = options.sourcePath();
        MDC.put(MDC_SOURCE_PATH, path);
        long start = System.nanoTime();
        try {
            IrDocument ir = compileInContext(source, options, start);
            if (!options.validate()) {
                ValidationResult result = validator.validate(ir);
                if (!result.ok()) {
                    IrValidationException failure = new IrValidationException(path, result.errors());
                    notifyFailed(path, Stage.VALIDATE, start, failure);
                    throw failure;
                }
            }
            long emitStart = System.nanoTime();
            String lua;
            try {
                lua = emitter.emit(ir);
            } catch (CompilationException e) {
                notifyFailed(path, Stage.EMIT, start, e);
                throw e;
            } catch (RuntimeException e) {
                CompilationException failure = internalFailure(Stage.EMIT, path, e);
                notifyFailed(path, Stage.EMIT, start, failure);
                throw failure;
            }
            notifyStage(path, Stage.EMIT, emitStart);
            LOG.info("Transpilation complete: source={}, luaChars={}, durationMs={}", path, lua.length(), millis(start));
            return new TranspileResult(ir, lua);
        } finally {
            MDC.remove(MDC_SOURCE_PATH);
        }
    }

    private IrDocument compileInContext(String source, CompileOptions options, long start) {
        String path = options.sourcePath();
        notifyStarted(path, source.length());
        Stage stage = Stage.PARSE;
        try {
            long t = System.nanoTime();
            ObjectNode raw = new SourceParser(path).parseTolerant(source);
            long parseMs = millis(t);
            notifyStage(path, stage, t);
            LOG.debug("Parse complete: durationMs={}", parseMs);

            stage = Stage.NORMALIZE;
            t = System.nanoTime();
            ObjectNode canonical = new AstNormalizer(path).normalizeProgram(raw, source);
            long normalizeMs = millis(t);
            notifyStage(path, stage, t);
            LOG.debug("Normalize complete: durationMs={}", normalizeMs);

            stage = Stage.LOWER;
            t = System.nanoTime();
            IrBuilder builder = new IrBuilder().source(path, sha256(source));
            options.metadata().forEach(builder::metadata);
            builder.metadata("authoredBy", AUTHORED_BY);
            builder.metadata("toolchain", TOOLCHAIN);
            builder.metadata("createdAt", clock.instant().toString());
            new IrLowerer(builder, path).lowerProgram(canonical);
            long lowerMs = millis(t);
            notifyStage(path, stage, t);
            LOG.debug("Lower complete: nodes={}, durationMs={}", builder.nodeCount(), lowerMs);

            ObjectNode perf = JsonNodeFactory.instance.objectNode();
            perf.put("parseMs", parseMs);
            perf.put("normalizeMs", normalizeMs);
            perf.put("lowerMs", lowerMs);
            perf.put("totalMs", millis(start));
            perf.put("nodeCount", builder.nodeCount());
            builder.metadata("metaPerf", perf);

            IrDocument document;
            if (options.validate()) {
                stage = Stage.VALIDATE;
                t = System.nanoTime();
                IrBuilder.BuildResult built = builder.build(validator);
                if (!built.validation().ok()) {
                    LOG.warn("IR validation failed: errors={}", built.validation().errors().size());
                    throw new IrValidationException(path, built.validation().errors());
                }
                notifyStage(path, stage, t);
                document = built.document();
            } else {
                document = builder.build();
            }

            LOG.info("Compilation complete: source={}, nodes={}, durationMs={}", path, document.nodeCount(), millis(start));
            notifyCompleted(path, document.nodeCount(), start);
            return document;
        } catch (CompilationException e) {
            notifyFailed(path, e.stage(), start, e);
            throw e;
        } catch (RuntimeException e) {
            CompilationException failure = internalFailure(stage, path, e);
            notifyFailed(path, stage, start, failure);
            throw failure;
        }
    }

    /**
     * Wraps an unexpected exception from {@code stage} in that stage's {@link CompilationException},
     * keeping it as the cause.
     */
    static CompilationException internalFailure(Stage stage, String path, RuntimeException cause) {
        LOG.error("Internal error during {}: {}", stage, cause.toString(), cause);
        String message = "Internal error during " + stage.name().toLowerCase(Locale.ROOT) + ": " + cause;
        return switch (stage) {
            case PARSE -> new SourceParseException(message, path, cause);
            case NORMALIZE -> new NormalizationException(message, path, -1, -1, cause);
            case LOWER -> new LoweringException(message, path, "<internal>", -1, -1, cause);
            case VALIDATE -> new IrValidationException(path, List.of(message), cause);
            case EMIT -> new EmissionException(message, path, "<internal>", cause);
        };
    }

    /** Lowercase hex SHA-256 of the UTF-8 source text. */
    static String sha256(String source) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(source.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static long millis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    // --- Listener notifications ---
    // Listener exceptions are caught and logged; they never affect the compilation.

    private void notifyStarted(String path, int length) {
        if (listener == null) {
            return;
        }
        try {
            listener.onCompilationStarted(new CompilationListener.CompilationStartedEvent(path, length));
        } catch (Exception e) {
            LOG.warn("CompilationListener.onCompilationStarted failed", e);
        }
    }

    private void notifyStage(String path, Stage stage, long startNanos) {
        if (listener == null) {
            return;
        }
        try {
            listener.onStageCompleted(new CompilationListener.StageCompletedEvent(path, stage, millis(startNanos)));
        } catch (Exception e) {
            LOG.warn("CompilationListener.onStageCompleted failed", e);
        }
    }

    private void notifyCompleted(String path, int nodeCount, long startNanos) {
        if (listener == null) {
            return;
        }
        try {
            listener.onCompilationCompleted(
                    new CompilationListener.CompilationCompletedEvent(path, nodeCount, millis(startNanos)));
        } catch (Exception e) {
            LOG.warn("CompilationListener.onCompilationCompleted failed", e);
        }
    }

    private void notifyFailed(String path, Stage stage, long startNanos, RuntimeException failure) {
        if (listener == null) {
            return;
        }
        try {
            listener.onCompilationFailed(new CompilationListener.CompilationFailedEvent(
                    path, stage, millis(startNanos), failure.getMessage()));
        } catch (Exception e) {
            LOG.warn("CompilationListener.onCompilationFailed failed", e);
        }
    }

    /** Reads the {@code metaPerf} entry of a compiled document, or a missing node. */
    public static JsonNode performance(IrDocument document) {
        return document.metadata().path("metaPerf");
    }
}
