package br.edu.ifba.ragflow.logging;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * Summary record describing who started a run and of which type.
 */
public record RunInfoLog(
        @NotNull UUID runId,
        @NotNull RunType runType,
        @NotNull String actor,
        @NotNull Instant timestamp
) {}
