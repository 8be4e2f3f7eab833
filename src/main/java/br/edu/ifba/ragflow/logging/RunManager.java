package br.edu.ifba.ragflow.logging;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks active runs and hands out {@link RunContext}s.
 *
 * <p>A run is active between {@link #withRun} and the close of the returned {@link RunScope}.
 * Scopes may be nested when a caller passes its own context down to a sub-pipeline;
 * the registration is removed when the outermost scope closes.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * try (RunScope scope = runManager.withRun(RunType.RETRIEVAL, null)) {
 *     RunContext context = scope.context();
 *     runManager.logRunInfo(context, "user-42");
 *     ...
 * }
 * }</pre>
 */
@ApplicationScoped
public class RunManager {

    private static final Logger logger = LoggerFactory.getLogger(RunManager.class);

    private final RunLoggingProvider loggingProvider;
    private final Map<UUID, Registration> activeRuns = new ConcurrentHashMap<>();

    @Inject
    public RunManager(@NotNull RunLoggingProvider loggingProvider) {
        this.loggingProvider = Objects.requireNonNull(loggingProvider, "loggingProvider must not be null");
    }

    /**
     * Opens a run scope.
     *
     * @param runType type recorded for a newly minted run
     * @param context existing context to re-enter, or null to mint a new run id
     * @return scope that must be closed when the invocation ends
     */
    @NotNull
    public RunScope withRun(@NotNull RunType runType, @Nullable RunContext context) {
        RunContext effective = context != null ? context : new RunContext(UUID.randomUUID(), runType);
        activeRuns.compute(effective.runId(), (id, existing) -> {
            if (existing == null) {
                logger.debug("Opened run {} ({})", id, effective.runType());
                return new Registration(effective.runType(), 1);
            }
            return new Registration(existing.runType(), existing.depth() + 1);
        });
        return new RunScope(this, effective);
    }

    /**
     * Forwards run info to the log sink.
     *
     * @throws IllegalStateException if the context is null or its run is not active
     */
    public CompletableFuture<Void> logRunInfo(@Nullable RunContext context, @NotNull String actor) {
        if (context == null || !activeRuns.containsKey(context.runId())) {
            throw new IllegalStateException("No run id set");
        }
        return loggingProvider.infoLog(context.runId(), context.runType(), actor);
    }

    /**
     * Checks whether a run scope is currently open for the given run id.
     */
    public boolean isActive(@NotNull UUID runId) {
        return activeRuns.containsKey(runId);
    }

    /**
     * Returns the number of runs with an open scope.
     */
    public int activeRuns() {
        return activeRuns.size();
    }

    @NotNull
    public RunLoggingProvider getLoggingProvider() {
        return loggingProvider;
    }

    void release(@NotNull RunContext context) {
        activeRuns.computeIfPresent(context.runId(), (id, existing) -> {
            if (existing.depth() <= 1) {
                logger.debug("Closed run {}", id);
                return null;
            }
            return new Registration(existing.runType(), existing.depth() - 1);
        });
    }

    private record Registration(RunType runType, int depth) {}
}
