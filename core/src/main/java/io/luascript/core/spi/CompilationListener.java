package io.luascript.core.spi;

import io.luascript.core.error.CompilationException.Stage;

/**
 * Observability hooks for the compilation pipeline.
 *
 * <p>Events are immutable. Implementations must be thread-safe and non-blocking. Exceptions thrown
 * by a listener are caught by the pipeline and logged at WARN; they never affect the compilation.
 */
public interface CompilationListener {

    /** Called before parsing starts. */
    void onCompilationStarted(CompilationStartedEvent event);

    /** Called after each stage that completed successfully. */
    void onStageCompleted(StageCompletedEvent event);

    /** Called once the IR (and, for a transpilation, the Lua text) is ready. */
    void onCompilationCompleted(CompilationCompletedEvent event);

    /** Called when a stage fails; the failure is rethrown to the caller afterwards. */
    void onCompilationFailed(CompilationFailedEvent event);

    // --- Event records ---

    record CompilationStartedEvent(String sourcePath, int sourceLength) {}

    record StageCompletedEvent(String sourcePath, Stage stage, long durationMs) {}

    record CompilationCompletedEvent(String sourcePath, int nodeCount, long durationMs) {}

    record CompilationFailedEvent(String sourcePath, Stage stage, long durationMs, String errorDetail) {}
}
