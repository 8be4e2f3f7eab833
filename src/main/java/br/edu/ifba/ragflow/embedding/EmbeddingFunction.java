package br.edu.ifba.ragflow.embedding;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Functional interface for text-to-vector embedding.
 * Implementations wrap calls to an embedding provider.
 */
@FunctionalInterface
public interface EmbeddingFunction {

    /**
     * Generate embeddings for a batch of texts.
     *
     * @param texts List of texts to embed
     * @return CompletableFuture with list of embedding vectors (one per input text)
     */
    CompletableFuture<List<float[]>> embed(@NotNull List<String> texts);

    /**
     * Convenience method for embedding a single text.
     */
    default CompletableFuture<float[]> embedSingle(@NotNull String text) {
        return embed(List.of(text)).thenApply(embeddings -> embeddings.get(0));
    }
}
