package br.edu.ifba.ragflow.llm;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Boundary to a chat completion provider.
 * Implementations wrap the provider client; the pipes only depend on this interface.
 */
public interface LLMProvider {

    /**
     * Generates a completion.
     *
     * @param messages conversation, system message first
     * @param config generation parameters
     * @return future with the completion
     */
    CompletableFuture<LLMCompletion> complete(@NotNull List<Message> messages, @NotNull GenerationConfig config);

    /**
     * Generates a completion as a lazy stream of text chunks.
     * The stream must be closed when abandoned so the provider can release the connection.
     *
     * @throws UnsupportedOperationException if the provider cannot stream
     */
    default Stream<String> completeStream(@NotNull List<Message> messages, @NotNull GenerationConfig config) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not support streaming");
    }

    /**
     * Checks if streaming is supported by this implementation.
     */
    default boolean supportsStreaming() {
        return false;
    }
}
