package br.edu.ifba.ragflow.state;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared state of one pipeline run: a mapping from stage name to the fields that stage published.
 *
 * <p>Stages publish named outputs here so that later, non-adjacent stages can pick them up
 * through an {@code UpstreamRef}. A stage name exists in the store only after that stage
 * published at least once during the run.</p>
 *
 * <p>All access goes through one lock per instance. Contention is expected to be low:
 * the store is a synchronization point between branches, not a hot path.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * state.publish("vector_search", Map.of("results", results));
 * List<?> results = (List<?>) state.read("vector_search", "results", List.of());
 * }</pre>
 */
public final class AsyncState {

    private static final Logger logger = LoggerFactory.getLogger(AsyncState.class);

    private final Map<String, Map<String, Object>> data = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Merge-writes fields under the given stage. Existing fields with the same name are replaced.
     *
     * @param stageName publishing stage
     * @param fields fields to merge into the stage entry
     */
    public void publish(@NotNull String stageName, @NotNull Map<String, ?> fields) {
        Objects.requireNonNull(stageName, "stageName must not be null");
        Objects.requireNonNull(fields, "fields must not be null");
        lock.lock();
        try {
            data.computeIfAbsent(stageName, k -> new LinkedHashMap<>()).putAll(fields);
        } finally {
            lock.unlock();
        }
        logger.debug("Stage {} published fields {}", stageName, fields.keySet());
    }

    /**
     * Reads a field published by a stage.
     *
     * @param stageName stage that published the field
     * @param field field name
     * @param defaultValue value returned when the stage exists but never published the field
     * @return the published value, or {@code defaultValue}
     * @throws StageNotFoundException if the stage never published in this run
     */
    @Nullable
    public Object read(@NotNull String stageName, @NotNull String field, @Nullable Object defaultValue) {
        lock.lock();
        try {
            Map<String, Object> stage = data.get(stageName);
            if (stage == null) {
                throw new StageNotFoundException(stageName);
            }
            return stage.getOrDefault(field, defaultValue);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reads a field, returning {@code null} when the field is absent.
     *
     * @throws StageNotFoundException if the stage never published in this run
     */
    @Nullable
    public Object read(@NotNull String stageName, @NotNull String field) {
        return read(stageName, field, null);
    }

    /**
     * Removes a whole stage entry.
     *
     * @throws StageNotFoundException if the stage never published in this run
     */
    public void delete(@NotNull String stageName) {
        delete(stageName, null);
    }

    /**
     * Removes a single field of a stage, or the whole stage entry when {@code field} is null.
     *
     * @throws StageNotFoundException if the stage never published in this run
     * @throws FieldNotFoundException if the stage has no such field
     */
    public void delete(@NotNull String stageName, @Nullable String field) {
        lock.lock();
        try {
            Map<String, Object> stage = data.get(stageName);
            if (stage == null) {
                throw new StageNotFoundException(stageName);
            }
            if (field == null) {
                data.remove(stageName);
                return;
            }
            if (!stage.containsKey(field)) {
                throw new FieldNotFoundException(stageName, field);
            }
            stage.remove(field);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a snapshot of the stage names that have published so far.
     */
    @NotNull
    public Set<String> stages() {
        lock.lock();
        try {
            return new LinkedHashSet<>(data.keySet());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Checks whether a stage has published in this run.
     */
    public boolean contains(@NotNull String stageName) {
        lock.lock();
        try {
            return data.containsKey(stageName);
        } finally {
            lock.unlock();
        }
    }
}
