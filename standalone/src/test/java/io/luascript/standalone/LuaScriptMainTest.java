package io.luascript.standalone;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Exit codes of {@link LuaScriptMain#run} for inputs rejected before compilation starts. */
class LuaScriptMainTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    private PrintStream originalErr;

    @BeforeEach
    void captureStderr() {
        originalErr = System.err;
        System.setErr(new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStderr() {
        System.setErr(originalErr);
    }

    @Test
    void noArgumentsPrintsUsage() {
        assertThat(LuaScriptMain.run(new String[0])).isEqualTo(LuaScriptMain.EXIT_USAGE);
        assertThat(stderr.toString(StandardCharsets.UTF_8))
                .contains("No source files given")
                .contains(LuaScriptMain.USAGE);
    }

    @Test
    void unknownOptionPrintsUsage() {
        assertThat(LuaScriptMain.run(new String[] {"--watch", "a.js"})).isEqualTo(LuaScriptMain.EXIT_USAGE);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("Unknown option: --watch");
    }

    @Test
    void missingConfigFileIsAUsageError() {
        String config = tempDir.resolve("missing.yaml").toString();

        assertThat(LuaScriptMain.run(new String[] {"--config", config, "a.js"})).isEqualTo(LuaScriptMain.EXIT_USAGE);
    }
}
