package br.edu.ifba.ragflow.pipe;

import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Typed settings for one pipeline run, keyed by their record class.
 *
 * <p>Each pipe asks for the settings type it understands and falls back to that type's
 * defaults when the caller did not provide one:</p>
 * <pre>{@code
 * RunSettings settings = RunSettings.of(VectorSearchSettings.defaults(), GenerationConfig.defaults());
 * VectorSearchSettings vector = settings.getOrDefault(VectorSearchSettings.class, VectorSearchSettings::defaults);
 * }</pre>
 */
public final class RunSettings {

    private static final RunSettings EMPTY = new RunSettings(Map.of());

    private final Map<Class<?>, Object> values;

    private RunSettings(Map<Class<?>, Object> values) {
        this.values = values;
    }

    @NotNull
    public static RunSettings empty() {
        return EMPTY;
    }

    /**
     * Creates settings from records; a later record of the same class replaces an earlier one.
     */
    @NotNull
    public static RunSettings of(@NotNull Object... settings) {
        Map<Class<?>, Object> values = new LinkedHashMap<>();
        for (Object setting : settings) {
            Objects.requireNonNull(setting, "settings must not contain null");
            values.put(setting.getClass(), setting);
        }
        return new RunSettings(Map.copyOf(values));
    }

    /**
     * Returns a copy with the given record added or replaced.
     */
    @NotNull
    public RunSettings with(@NotNull Object setting) {
        Objects.requireNonNull(setting, "setting must not be null");
        Map<Class<?>, Object> copy = new LinkedHashMap<>(values);
        copy.put(setting.getClass(), setting);
        return new RunSettings(Map.copyOf(copy));
    }

    @NotNull
    public <T> Optional<T> get(@NotNull Class<T> type) {
        return Optional.ofNullable(values.get(type)).map(type::cast);
    }

    @NotNull
    public <T> T getOrDefault(@NotNull Class<T> type, @NotNull Supplier<T> defaults) {
        return get(type).orElseGet(defaults);
    }

    @Override
    public String toString() {
        return "RunSettings" + values.values();
    }
}
