package io.luascript.standalone.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import io.luascript.core.emit.EmitterOptions;
import io.luascript.core.engine.CompilerPipeline;
import io.luascript.standalone.config.CompilerConfig;
import io.luascript.standalone.hints.DocHintClient;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class CompileCommandTest {

    private static final String ADD_JS = """
            function add(a, b) {
              return a + b;
            }
            """;

    @TempDir
    Path tempDir;

    private ListAppender<ILoggingEvent> logAppender;
    private Logger commandLogger;

    @BeforeEach
    void attachAppender() {
        commandLogger = (Logger) LoggerFactory.getLogger(CompileCommand.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        commandLogger.addAppender(logAppender);
    }

    @AfterEach
    void detachAppender() {
        commandLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private Path source(String name, String text) throws IOException {
        Path src = tempDir.resolve("src");
        Files.createDirectories(src);
        Path file = src.resolve(name);
        Files.writeString(file, text);
        return file;
    }

    private static CompileCommand command(CompilerConfig config) {
        return new CompileCommand(
                config, new CompilerPipeline(new EmitterOptions(config.indent())), new DocHintClient(null, null));
    }

    @Nested
    @DisplayName("Argument parsing")
    class Parsing {

        @Test
        void allOptions() {
            CompileCommand.Arguments args = CompileCommand.parse(
                    new String[] {"--config", "c.yaml", "--emit-ir", "--out", "build", "a.js", "b.mjs"});

            assertThat(args.configPath()).isEqualTo(Path.of("c.yaml"));
            assertThat(args.emitIr()).isTrue();
            assertThat(args.outputDir()).isEqualTo(Path.of("build"));
            assertThat(args.sources()).containsExactly(Path.of("a.js"), Path.of("b.mjs"));
        }

        @Test
        void sourcesOnly() {
            CompileCommand.Arguments args = CompileCommand.parse(new String[] {"a.js"});

            assertThat(args.configPath()).isNull();
            assertThat(args.emitIr()).isFalse();
            assertThat(args.outputDir()).isNull();
        }

        @Test
        void unknownOption() {
            assertThatThrownBy(() -> CompileCommand.parse(new String[] {"--x", "a.js"}))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Unknown option: --x");
        }

        @Test
        void missingOptionValue() {
            assertThatThrownBy(() -> CompileCommand.parse(new String[] {"a.js", "--out"}))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("--out requires an argument");
        }

        @Test
        void noSources() {
            assertThatThrownBy(() -> CompileCommand.parse(new String[] {"--emit-ir"}))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("No source files given");
        }

        @Test
        void baseNameStripsScriptExtensions() {
            assertThat(CompileCommand.baseName(Path.of("dir/app.js"))).isEqualTo("app");
            assertThat(CompileCommand.baseName(Path.of("mod.mjs"))).isEqualTo("mod");
            assertThat(CompileCommand.baseName(Path.of("lib.cjs"))).isEqualTo("lib");
            assertThat(CompileCommand.baseName(Path.of("notes.txt"))).isEqualTo("notes.txt");
            assertThat(CompileCommand.baseName(Path.of(".js"))).isEqualTo(".js");
        }
    }

    @Nested
    @DisplayName("Compilation")
    class Compilation {

        @Test
        @DisplayName("writes <name>.lua into --out")
        void writesLua() throws IOException {
            Path file = source("add.js", ADD_JS);
            Path out = tempDir.resolve("out");

            int exit = command(CompilerConfig.defaults())
                    .run(new CompileCommand.Arguments(null, false, out, List.of(file)));

            assertThat(exit).isEqualTo(CompileCommand.EXIT_OK);
            assertThat(Files.readString(out.resolve("add.lua")))
                    .isEqualTo("local function add(a, b)\n  return a + b\nend\n");
            assertThat(out.resolve("add.ir.json")).doesNotExist();
        }

        @Test
        @DisplayName("--emit-ir also writes a schema-shaped IR document")
        void writesIr() throws IOException {
            Path file = source("add.js", ADD_JS);
            Path out = tempDir.resolve("out");

            command(CompilerConfig.defaults()).run(new CompileCommand.Arguments(null, true, out, List.of(file)));

            JsonNode ir = new ObjectMapper().readTree(out.resolve("add.ir.json").toFile());
            assertThat(ir.path("schemaVersion").asText()).isNotEmpty();
            assertThat(ir.path("module").path("source").path("path").asText()).isEqualTo(file.toString());
        }

        @Test
        @DisplayName("config emit-ir and indent apply when the command line is silent")
        void configDefaultsApply() throws IOException {
            Path file = source("add.js", ADD_JS);
            Path out = tempDir.resolve("out");
            CompilerConfig config = CompilerConfig.builder()
                    .emitIr(true)
                    .indent(4)
                    .outputDir(out.toString())
                    .build();

            command(config).run(new CompileCommand.Arguments(null, false, null, List.of(file)));

            assertThat(Files.readString(out.resolve("add.lua"))).contains("\n    return a + b\n");
            assertThat(out.resolve("add.ir.json")).exists();
        }

        @Test
        @DisplayName("without an output directory files land next to the source")
        void writesNextToSource() throws IOException {
            Path file = source("add.js", ADD_JS);

            command(CompilerConfig.defaults()).run(new CompileCommand.Arguments(null, false, null, List.of(file)));

            assertThat(file.resolveSibling("add.lua")).exists();
        }

        @Test
        @DisplayName("a failing file is logged and does not stop the others")
        void failureContinues() throws IOException {
            Path bad = source("bad.js", "break;\n");
            Path good = source("good.js", ADD_JS);
            Path out = tempDir.resolve("out");

            int exit = command(CompilerConfig.defaults())
                    .run(new CompileCommand.Arguments(null, false, out, List.of(bad, good)));

            assertThat(exit).isEqualTo(CompileCommand.EXIT_FAILURE);
            assertThat(out.resolve("good.lua")).exists();
            assertThat(out.resolve("bad.lua")).doesNotExist();
            assertThat(logAppender.list)
                    .anySatisfy(e -> {
                        assertThat(e.getLevel()).isEqualTo(Level.ERROR);
                        assertThat(e.getFormattedMessage()).startsWith("Compilation failed: source=");
                    });
        }

        @Test
        @DisplayName("an unreadable source exits 1")
        void missingSource() {
            int exit = command(CompilerConfig.defaults())
                    .run(new CompileCommand.Arguments(
                            null, false, tempDir.resolve("out"), List.of(tempDir.resolve("missing.js"))));

            assertThat(exit).isEqualTo(CompileCommand.EXIT_FAILURE);
            assertThat(logAppender.list)
                    .anySatisfy(e -> assertThat(e.getFormattedMessage()).startsWith("Cannot read source: "));
        }
    }

    @Nested
    @DisplayName("Documentation hints")
    class Hints {

        private HttpServer server;

        @BeforeEach
        void startServer() throws IOException {
            server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
            server.createContext("/search", exchange -> {
                byte[] body = """
                        {"hints":[{"title":"Loops","url":"https://docs.example/loops","snippet":"break"}]}
                        """.getBytes(StandardCharsets.UTF_8);
                exchange.sendResponseHeaders(200, body.length);
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(body);
                }
            });
            server.start();
        }

        @AfterEach
        void stopServer() {
            server.stop(0);
        }

        @Test
        @DisplayName("hints for a failed compilation are logged")
        void hintsLogged() throws IOException {
            Path bad = source("bad.js", "break;\n");
            String endpoint = "http://127.0.0.1:" + server.getAddress().getPort() + "/search";
            CompilerConfig config = CompilerConfig.defaults();
            CompileCommand command = new CompileCommand(
                    config, new CompilerPipeline(), new DocHintClient(endpoint, Duration.ofSeconds(2)));

            command.run(new CompileCommand.Arguments(null, false, tempDir.resolve("out"), List.of(bad)));

            assertThat(logAppender.list)
                    .anySatisfy(e -> assertThat(e.getFormattedMessage())
                            .isEqualTo("Hint: Loops https://docs.example/loops break"));
        }
    }
}
