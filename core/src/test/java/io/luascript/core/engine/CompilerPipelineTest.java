package io.luascript.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import io.luascript.core.emit.LuaEmitter;
import io.luascript.core.error.CompilationException.Stage;
import io.luascript.core.error.EmissionException;
import io.luascript.core.error.IrValidationException;
import io.luascript.core.error.LoweringException;
import io.luascript.core.error.NormalizationException;
import io.luascript.core.error.SourceParseException;
import io.luascript.core.ir.IrDocument;
import io.luascript.core.ir.ValidationResult;
import io.luascript.core.spi.CompilationListener;
import io.luascript.core.spi.CompilationListener.CompilationCompletedEvent;
import io.luascript.core.spi.CompilationListener.CompilationFailedEvent;
import io.luascript.core.spi.CompilationListener.CompilationStartedEvent;
import io.luascript.core.spi.CompilationListener.StageCompletedEvent;
import io.luascript.core.validate.IrValidator;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

@DisplayName("CompilerPipeline")
class CompilerPipelineTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String SOURCE = "function add(a, b) { return a + b; }";

    private CompilationListener listener;
    private CompilerPipeline pipeline;
    private ListAppender<ILoggingEvent> appender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        listener = mock(CompilationListener.class);
        pipeline = new CompilerPipeline(
                new IrValidator(), new LuaEmitter(), listener, Clock.fixed(NOW, ZoneOffset.UTC));

        logger = (Logger) LoggerFactory.getLogger(CompilerPipeline.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    @Nested
    @DisplayName("compile")
    class Compile {

        @Test
        @DisplayName("records provenance in module metadata")
        void metadata() {
            IrDocument document = pipeline.compile(
                    SOURCE, CompileOptions.forPath("src/add.js").withMetadata("buildId", "42"));

            JsonNode metadata = document.metadata();
            assertThat(metadata.path("authoredBy").asText()).isEqualTo(CompilerPipeline.AUTHORED_BY);
            assertThat(metadata.path("toolchain").asText()).isEqualTo(CompilerPipeline.TOOLCHAIN);
            assertThat(metadata.path("createdAt").asText()).isEqualTo("2024-05-01T12:00:00Z");
            assertThat(metadata.path("buildId").asText()).isEqualTo("42");
            assertThat(document.sourcePath()).isEqualTo("src/add.js");
            assertThat(document.sourceHash()).isEqualTo(CompilerPipeline.sha256(SOURCE)).hasSize(64);
        }

        @Test
        @DisplayName("records per-stage timings")
        void performance() {
            IrDocument document = pipeline.compile(SOURCE, CompileOptions.defaults());

            JsonNode perf = CompilerPipeline.performance(document);
            assertThat(perf.path("parseMs").isNumber()).isTrue();
            assertThat(perf.path("normalizeMs").isNumber()).isTrue();
            assertThat(perf.path("lowerMs").isNumber()).isTrue();
            assertThat(perf.path("totalMs").asLong()).isGreaterThanOrEqualTo(0);
            assertThat(perf.path("nodeCount").asInt()).isEqualTo(document.nodeCount());
        }

        @Test
        @DisplayName("ignores volatile metadata when comparing runs")
        void deterministic() {
            CompilerPipeline later = new CompilerPipeline(
                    new IrValidator(), new LuaEmitter(), null, Clock.fixed(NOW.plusSeconds(60), ZoneOffset.UTC));

            IrDocument first = pipeline.compile(SOURCE, CompileOptions.defaults());
            IrDocument second = later.compile(SOURCE, CompileOptions.defaults());

            assertThat(first).isNotEqualTo(second);
            assertThat(first.withoutVolatileMetadata()).isEqualTo(second.withoutVolatileMetadata());
        }

        @Test
        @DisplayName("notifies the listener of every stage in order")
        void stageEvents() {
            pipeline.compile(SOURCE, CompileOptions.forPath("add.js"));

            InOrder order = inOrder(listener);
            order.verify(listener).onCompilationStarted(new CompilationStartedEvent("add.js", SOURCE.length()));
            ArgumentCaptor<StageCompletedEvent> stages = ArgumentCaptor.forClass(StageCompletedEvent.class);
            order.verify(listener, times(4)).onStageCompleted(stages.capture());
            order.verify(listener).onCompilationCompleted(any(CompilationCompletedEvent.class));
            assertThat(stages.getAllValues())
                    .extracting(StageCompletedEvent::stage)
                    .containsExactly(Stage.PARSE, Stage.NORMALIZE, Stage.LOWER, Stage.VALIDATE);
            verify(listener, never()).onCompilationFailed(any());
        }

        @Test
        @DisplayName("skips the validate stage when validation is off")
        void noValidation() {
            pipeline.compile(SOURCE, CompileOptions.forPath("add.js").withValidate(false));

            ArgumentCaptor<StageCompletedEvent> stages = ArgumentCaptor.forClass(StageCompletedEvent.class);
            verify(listener, times(3)).onStageCompleted(stages.capture());
            assertThat(stages.getAllValues()).extracting(StageCompletedEvent::stage).doesNotContain(Stage.VALIDATE);
        }

        @Test
        @DisplayName("logs completion at INFO")
        void completionLog() {
            pipeline.compile(SOURCE, CompileOptions.forPath("add.js"));

            assertThat(appender.list)
                    .anySatisfy(event -> {
                        assertThat(event.getLevel()).isEqualTo(Level.INFO);
                        assertThat(event.getFormattedMessage()).startsWith("Compilation complete: source=add.js");
                    });
        }

        @Test
        @DisplayName("sets the source path MDC while running and clears it afterwards")
        void mdc() {
            AtomicReference<String> seen = new AtomicReference<>();
            doAnswer(invocation -> {
                seen.set(MDC.get(CompilerPipeline.MDC_SOURCE_PATH));
                return null;
            }).when(listener).onCompilationStarted(any());

            pipeline.compile(SOURCE, CompileOptions.forPath("mdc.js"));

            assertThat(seen.get()).isEqualTo("mdc.js");
            assertThat(MDC.get(CompilerPipeline.MDC_SOURCE_PATH)).isNull();
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("a lexical error fails in the parse stage")
        void parseFailure() {
            assertThatThrownBy(() -> pipeline.compile("let s = 'abc", CompileOptions.forPath("bad.js")))
                    .isInstanceOf(SourceParseException.class);

            ArgumentCaptor<CompilationFailedEvent> failed = ArgumentCaptor.forClass(CompilationFailedEvent.class);
            verify(listener).onCompilationFailed(failed.capture());
            assertThat(failed.getValue().stage()).isEqualTo(Stage.PARSE);
            assertThat(failed.getValue().sourcePath()).isEqualTo("bad.js");
            assertThat(failed.getValue().errorDetail()).contains("Unterminated string literal");
            verify(listener, never()).onCompilationCompleted(any());
        }

        @Test
        @DisplayName("an unsupported construct fails in the lower stage")
        void lowerFailure() {
            assertThatThrownBy(() -> pipeline.compile("break;", CompileOptions.forPath("bad.js")))
                    .isInstanceOf(LoweringException.class);

            ArgumentCaptor<CompilationFailedEvent> failed = ArgumentCaptor.forClass(CompilationFailedEvent.class);
            verify(listener).onCompilationFailed(failed.capture());
            assertThat(failed.getValue().stage()).isEqualTo(Stage.LOWER);
        }

        @Test
        @DisplayName("the MDC is cleared after a failure")
        void mdcClearedOnFailure() {
            assertThatThrownBy(() -> pipeline.compile("break;", CompileOptions.forPath("bad.js")))
                    .isInstanceOf(LoweringException.class);

            assertThat(MDC.get(CompilerPipeline.MDC_SOURCE_PATH)).isNull();
        }

        @Test
        @DisplayName("a throwing listener is logged and ignored")
        void throwingListener() {
            doThrow(new IllegalStateException("listener boom")).when(listener).onCompilationStarted(any());
            doThrow(new IllegalStateException("listener boom")).when(listener).onStageCompleted(any());

            IrDocument document = pipeline.compile(SOURCE, CompileOptions.defaults());

            assertThat(document.nodeCount()).isPositive();
            assertThat(appender.list)
                    .filteredOn(event -> event.getLevel() == Level.WARN)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .contains("CompilationListener.onCompilationStarted failed",
                            "CompilationListener.onStageCompleted failed");
        }
    }

    @Nested
    @DisplayName("transpile")
    class Transpile {

        @Test
        @DisplayName("emits Lua and reports the emit stage")
        void emits() {
            TranspileResult result = pipeline.transpile(SOURCE, CompileOptions.forPath("add.js"));

            assertThat(result.lua()).isEqualTo("local function add(a, b)\n  return a + b\nend\n");
            assertThat(result.ir().sourcePath()).isEqualTo("add.js");
            ArgumentCaptor<StageCompletedEvent> stages = ArgumentCaptor.forClass(StageCompletedEvent.class);
            verify(listener, times(5)).onStageCompleted(stages.capture());
            assertThat(stages.getAllValues()).extracting(StageCompletedEvent::stage).endsWith(Stage.EMIT);
        }

        @Test
        @DisplayName("validates even when compile-time validation is off")
        void validatesBeforeEmitting() {
            IrValidator validator = mock(IrValidator.class);
            when(validator.validate(any(IrDocument.class))).thenReturn(ValidationResult.of(List.of("forced failure")));
            CompilerPipeline strict = new CompilerPipeline(validator, new LuaEmitter(), listener, Clock.systemUTC());

            assertThatThrownBy(() -> strict.transpile(SOURCE, CompileOptions.forPath("x.js").withValidate(false)))
                    .isInstanceOf(IrValidationException.class)
                    .hasMessageContaining("forced failure");

            ArgumentCaptor<CompilationFailedEvent> failed = ArgumentCaptor.forClass(CompilationFailedEvent.class);
            verify(listener).onCompilationFailed(failed.capture());
            assertThat(failed.getValue().stage()).isEqualTo(Stage.VALIDATE);
        }
    }

    @Nested
    @DisplayName("internal faults")
    class InternalFaults {

        @Test
        @DisplayName("an unexpected exception in a stage is reported as that stage's failure")
        void wrappedWithStage() {
            IrValidator validator = mock(IrValidator.class);
            IllegalStateException boom = new IllegalStateException("validator boom");
            when(validator.validate(any(IrDocument.class))).thenThrow(boom);
            CompilerPipeline faulty = new CompilerPipeline(validator, new LuaEmitter(), listener, Clock.systemUTC());

            assertThatThrownBy(() -> faulty.compile(SOURCE, CompileOptions.forPath("x.js")))
                    .isInstanceOfSatisfying(IrValidationException.class, e -> {
                        assertThat(e.stage()).isEqualTo(Stage.VALIDATE);
                        assertThat(e.sourcePath()).isEqualTo("x.js");
                        assertThat(e.detail()).contains("validator boom");
                        assertThat(e.getCause()).isSameAs(boom);
                    });

            ArgumentCaptor<CompilationFailedEvent> failed = ArgumentCaptor.forClass(CompilationFailedEvent.class);
            verify(listener).onCompilationFailed(failed.capture());
            assertThat(failed.getValue().stage()).isEqualTo(Stage.VALIDATE);
            assertThat(appender.list).anySatisfy(event -> assertThat(event.getLevel()).isEqualTo(Level.ERROR));
        }

        @Test
        @DisplayName("an unexpected exception in the emitter becomes an EmissionException")
        void emitterFault() {
            LuaEmitter emitter = mock(LuaEmitter.class);
            when(emitter.emit(any(IrDocument.class))).thenThrow(new NullPointerException("no node"));
            CompilerPipeline faulty = new CompilerPipeline(new IrValidator(), emitter, listener, Clock.systemUTC());

            assertThatThrownBy(() -> faulty.transpile(SOURCE, CompileOptions.forPath("x.js")))
                    .isInstanceOfSatisfying(EmissionException.class, e -> {
                        assertThat(e.stage()).isEqualTo(Stage.EMIT);
                        assertThat(e.getCause()).isInstanceOf(NullPointerException.class);
                    });
        }

        @Test
        @DisplayName("each stage maps to its own exception type")
        void stageMapping() {
            RuntimeException cause = new IllegalArgumentException("x");

            assertThat(CompilerPipeline.internalFailure(Stage.PARSE, "a.js", cause))
                    .isInstanceOf(SourceParseException.class);
            assertThat(CompilerPipeline.internalFailure(Stage.NORMALIZE, "a.js", cause))
                    .isInstanceOf(NormalizationException.class);
            assertThat(CompilerPipeline.internalFailure(Stage.LOWER, "a.js", cause))
                    .isInstanceOf(LoweringException.class)
                    .hasCause(cause);
        }
    }

    @Nested
    @DisplayName("validated output")
    class ValidatedOutput {

        private String lua(String source) {
            return pipeline.transpile(source, CompileOptions.forPath("t.js")).lua();
        }

        @Test
        @DisplayName("declarations pass validation and keep their binding")
        void declarations() {
            TranspileResult result = pipeline.transpile("let y = i++;\nlet z = y, w;", CompileOptions.forPath("t.js"));

            assertThat(result.lua())
                    .startsWith("local y = (function()\n  local _t = i\n  i = i + 1\n  return _t\nend)()\n");
            assertThat(new IrValidator().validate(result.ir()).ok()).isTrue();
        }

        @Test
        @DisplayName("static methods are called without a receiver")
        void staticCall() {
            String lua = lua("""
                    class C { static make(x) { return x; } greet() { return 1; } }
                    class D extends C {}
                    let r = C.make(5);
                    let s = D.make(6);
                    let g = new C().greet();
                    """);

            assertThat(lua)
                    .contains("C.make = function(x)")
                    .contains("local r = C.make(5)")
                    .contains("local s = D.make(6)")
                    .contains(":greet()");
        }

        @Test
        @DisplayName("plain function properties are called with a dot; this-using ones get a receiver")
        void functionProperties() {
            String lua = lua("""
                    const M = {};
                    M.add = function (a, b) { return a + b; };
                    M.twice = (a) => a * 2;
                    M.count = function () { return this.n; };
                    let s = M.add(1, 2);
                    let t = M.twice(s);
                    let u = M.count();
                    """);

            assertThat(lua)
                    .contains("M.add = function(a, b)")
                    .contains("M.count = function(self)")
                    .contains("local s = M.add(1, 2)")
                    .contains("local t = M.twice(s)")
                    .contains("local u = M:count()");
        }

        @Test
        @DisplayName("a compound assignment evaluates its key once")
        void compoundAssignmentKeyOnce() {
            String lua = lua("a[f()] += 1;");

            assertThat(lua.split("f\\(\\)", -1)).hasSize(2);
            assertThat(lua).contains("local __place_1 = f()").contains("a[__place_1] = a[__place_1] + 1");
        }
    }

    @Test
    @DisplayName("sha256 is lowercase hex")
    void sha256() {
        assertThat(CompilerPipeline.sha256(""))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }
}
