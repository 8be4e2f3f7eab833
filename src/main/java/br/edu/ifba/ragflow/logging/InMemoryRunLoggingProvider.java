package br.edu.ifba.ragflow.logging;

import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory run log storage.
 * Suitable for development, tests and single-node deployments.
 */
@ApplicationScoped
public class InMemoryRunLoggingProvider implements RunLoggingProvider {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryRunLoggingProvider.class);

    private final ConcurrentHashMap<UUID, CopyOnWriteArrayList<RunLogEntry>> entries = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<RunInfoLog> infoLogs = new CopyOnWriteArrayList<>();

    @Override
    public CompletableFuture<Void> log(@NotNull UUID runId, @NotNull String key, @NotNull String value) {
        entries.computeIfAbsent(runId, id -> new CopyOnWriteArrayList<>())
                .add(new RunLogEntry(runId, key, value, Instant.now()));
        logger.trace("Run {} logged {}", runId, key);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> infoLog(@NotNull UUID runId, @NotNull RunType runType, @NotNull String actor) {
        infoLogs.add(new RunInfoLog(runId, runType, actor, Instant.now()));
        logger.debug("Run {} of type {} started by {}", runId, runType, actor);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<List<RunLogEntry>> getLogs(@NotNull List<UUID> runIds, int limitPerRun) {
        List<RunLogEntry> result = new ArrayList<>();
        for (UUID runId : runIds) {
            List<RunLogEntry> runEntries = entries.get(runId);
            if (runEntries == null) {
                continue;
            }
            List<RunLogEntry> snapshot = List.copyOf(runEntries);
            int from = Math.max(0, snapshot.size() - limitPerRun);
            result.addAll(snapshot.subList(from, snapshot.size()));
        }
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public CompletableFuture<List<RunInfoLog>> getInfoLogs(int limit, @Nullable RunType runTypeFilter) {
        List<RunInfoLog> result = infoLogs.stream()
                .filter(info -> runTypeFilter == null || info.runType() == runTypeFilter)
                .sorted(Comparator.comparing(RunInfoLog::timestamp).reversed())
                .limit(limit)
                .toList();
        return CompletableFuture.completedFuture(result);
    }
}
