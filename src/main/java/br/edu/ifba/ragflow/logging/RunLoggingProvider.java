package br.edu.ifba.ragflow.logging;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Sink for run-scoped log records.
 *
 * <p>Pipes never call the provider directly: their log channel forwards entries from a
 * background drain task, so a slow or failing provider does not block pipeline work.
 * Failures returned by {@link #log} are reported by the channel and otherwise ignored.</p>
 *
 * Implementations: {@link InMemoryRunLoggingProvider}
 */
public interface RunLoggingProvider {

    /**
     * Records a key/value pair for a run.
     *
     * @param runId the run the entry belongs to
     * @param key log key (e.g. "search_query")
     * @param value serialized value
     */
    CompletableFuture<Void> log(@NotNull UUID runId, @NotNull String key, @NotNull String value);

    /**
     * Records who started a run and its type.
     */
    CompletableFuture<Void> infoLog(@NotNull UUID runId, @NotNull RunType runType, @NotNull String actor);

    /**
     * Gets the most recent entries of each requested run, oldest first.
     *
     * @param runIds runs to fetch
     * @param limitPerRun maximum entries returned per run
     */
    CompletableFuture<List<RunLogEntry>> getLogs(@NotNull List<UUID> runIds, int limitPerRun);

    /**
     * Gets run info records, most recent first.
     *
     * @param limit maximum number of records
     * @param runTypeFilter only return runs of this type, or all when null
     */
    CompletableFuture<List<RunInfoLog>> getInfoLogs(int limit, @Nullable RunType runTypeFilter);
}
