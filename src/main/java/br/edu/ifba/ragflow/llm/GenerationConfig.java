package br.edu.ifba.ragflow.llm;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Generation parameters for a completion call.
 *
 * @param model model identifier understood by the provider
 * @param temperature sampling temperature, between 0 and 2
 * @param topP nucleus sampling threshold, between 0 and 1
 * @param maxTokens maximum tokens to generate, or null for the provider default
 * @param stream whether the caller wants a streamed completion
 */
public record GenerationConfig(
        @NotNull String model,
        double temperature,
        double topP,
        @Nullable Integer maxTokens,
        boolean stream
) {
    public static final String DEFAULT_MODEL = "gpt-4o";

    public GenerationConfig {
        Objects.requireNonNull(model, "model must not be null");
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature must be between 0 and 2, got " + temperature);
        }
        if (topP < 0.0 || topP > 1.0) {
            throw new IllegalArgumentException("topP must be between 0 and 1, got " + topP);
        }
        if (maxTokens != null && maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive, got " + maxTokens);
        }
    }

    @NotNull
    public static GenerationConfig defaults() {
        return new GenerationConfig(DEFAULT_MODEL, 0.1, 1.0, null, false);
    }

    @NotNull
    public GenerationConfig withStream(boolean stream) {
        return new GenerationConfig(model, temperature, topP, maxTokens, stream);
    }
}
