package br.edu.ifba.ragflow.logging;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.UUID;

/**
 * Identifies the logical run a pipe invocation belongs to.
 *
 * <p>The context is passed explicitly to every pipe and log call. It is created by
 * {@link RunManager#withRun} at the top of a pipeline invocation, or supplied by the caller
 * when several pipelines take part in the same run.</p>
 *
 * @param runId unique id of the run
 * @param runType declared category of the run
 */
public record RunContext(
        @NotNull UUID runId,
        @NotNull RunType runType
) {
    public RunContext {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(runType, "runType must not be null");
    }
}
