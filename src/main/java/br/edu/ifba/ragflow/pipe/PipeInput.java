package br.edu.ifba.ragflow.pipe;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Input envelope handed to a pipe invocation.
 *
 * <p>{@link #message()} is the lazy stream produced by the preceding stage (or the external
 * input for the first stage). {@link #fields()} holds values bound from upstream stages'
 * published outputs. The envelope is immutable once built.</p>
 *
 * @param <I> item type of the message stream
 */
public final class PipeInput<I> {

    private final Stream<I> message;
    private final Map<String, Object> fields;
    private final RunSettings settings;

    private PipeInput(Stream<I> message, Map<String, Object> fields, RunSettings settings) {
        this.message = message;
        this.fields = Collections.unmodifiableMap(fields);
        this.settings = settings;
    }

    /**
     * Creates an envelope carrying only a message stream.
     */
    @NotNull
    public static <I> PipeInput<I> of(@NotNull Stream<I> message) {
        return new PipeInput<>(Objects.requireNonNull(message), Map.of(), RunSettings.empty());
    }

    @NotNull
    public static <I> Builder<I> builder(@NotNull Stream<I> message) {
        return new Builder<>(message);
    }

    @NotNull
    public Stream<I> message() {
        return message;
    }

    @NotNull
    public Map<String, Object> fields() {
        return fields;
    }

    @NotNull
    public RunSettings settings() {
        return settings;
    }

    public boolean hasField(@NotNull String name) {
        return fields.containsKey(name);
    }

    /**
     * Gets a bound field.
     *
     * @param name field name
     * @param type expected type
     * @return the value, or null if the field was not bound
     * @throws ClassCastException if the bound value has another type
     */
    @Nullable
    public <T> T field(@NotNull String name, @NotNull Class<T> type) {
        Object value = fields.get(name);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new ClassCastException(
                    "Field '" + name + "' is of type " + value.getClass().getName() +
                    ", not " + type.getName());
        }
        return type.cast(value);
    }

    /**
     * Gets a bound field that the pipe cannot work without.
     *
     * @throws IllegalStateException if the field was not bound
     */
    @NotNull
    public <T> T requireField(@NotNull String name, @NotNull Class<T> type) {
        T value = field(name, type);
        if (value == null) {
            throw new IllegalStateException("Required input field '" + name + "' is not bound");
        }
        return value;
    }

    @Override
    public String toString() {
        return "PipeInput{fields=" + fields.keySet() + ", settings=" + settings + '}';
    }

    /**
     * Builder for PipeInput.
     */
    public static final class Builder<I> {
        private Stream<I> message;
        private final Map<String, Object> fields = new LinkedHashMap<>();
        private RunSettings settings = RunSettings.empty();

        private Builder(@NotNull Stream<I> message) {
            this.message = Objects.requireNonNull(message, "message must not be null");
        }

        /**
         * Replaces the message stream.
         */
        public Builder<I> message(@NotNull Stream<I> message) {
            this.message = Objects.requireNonNull(message, "message must not be null");
            return this;
        }

        /**
         * Binds a field unless it is already bound.
         *
         * @return true if the value was bound
         */
        public boolean bindIfAbsent(@NotNull String name, @Nullable Object value) {
            if (fields.containsKey(name)) {
                return false;
            }
            fields.put(name, value);
            return true;
        }

        public Builder<I> field(@NotNull String name, @Nullable Object value) {
            fields.put(name, value);
            return this;
        }

        public Builder<I> settings(@NotNull RunSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings must not be null");
            return this;
        }

        public PipeInput<I> build() {
            return new PipeInput<>(message, new LinkedHashMap<>(fields), settings);
        }
    }
}
