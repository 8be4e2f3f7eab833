package br.edu.ifba.ragflow.pipe;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Identity and logging limits of a pipe.
 *
 * @param name stage name, unique within a pipeline; used as the state key and in log attribution
 * @param maxLogQueueSize capacity of the per-invocation log queue; entries beyond it are dropped
 */
public record PipeConfig(
        @NotNull String name,
        int maxLogQueueSize
) {
    public static final int DEFAULT_MAX_LOG_QUEUE_SIZE = 100;

    public PipeConfig {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Pipe name must not be blank");
        }
        if (maxLogQueueSize < 1) {
            throw new IllegalArgumentException(
                    String.format("maxLogQueueSize must be positive, got %d", maxLogQueueSize));
        }
    }

    public static PipeConfig of(@NotNull String name) {
        return new PipeConfig(name, DEFAULT_MAX_LOG_QUEUE_SIZE);
    }
}
