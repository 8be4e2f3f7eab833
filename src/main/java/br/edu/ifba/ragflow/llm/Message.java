package br.edu.ifba.ragflow.llm;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A chat message sent to an {@link LLMProvider}.
 */
public record Message(
        @NotNull Role role,
        @NotNull String content
) {
    public enum Role {
        SYSTEM, USER, ASSISTANT
    }

    public Message {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static Message system(@NotNull String content) {
        return new Message(Role.SYSTEM, content);
    }

    public static Message user(@NotNull String content) {
        return new Message(Role.USER, content);
    }
}
