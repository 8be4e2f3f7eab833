package br.edu.ifba.ragflow.llm;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Result of a non-streamed completion.
 */
public record LLMCompletion(
        @NotNull String content,
        @NotNull String model,
        @Nullable String finishReason,
        int promptTokens,
        int completionTokens
) {
    public LLMCompletion {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(model, "model must not be null");
    }

    public static LLMCompletion of(@NotNull String content, @NotNull String model) {
        return new LLMCompletion(content, model, "stop", 0, 0);
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }
}
