package br.edu.ifba.ragflow.logging;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * A single key/value record written by a pipe during a run.
 */
public record RunLogEntry(
        @NotNull UUID runId,
        @NotNull String key,
        @NotNull String value,
        @NotNull Instant timestamp
) {}
