package br.edu.ifba.ragflow.search;

import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A chunk stored in {@link InMemoryVectorSearchProvider}.
 */
public record ChunkEntry(
        @NotNull UUID fragmentId,
        @NotNull UUID documentId,
        @NotNull String text,
        @NotNull float[] vector,
        @NotNull Map<String, Object> metadata
) {
    public ChunkEntry {
        Objects.requireNonNull(fragmentId, "fragmentId must not be null");
        Objects.requireNonNull(documentId, "documentId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(vector, "vector must not be null");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    VectorSearchResult toResult(double score) {
        return new VectorSearchResult(fragmentId, documentId, score, text, metadata);
    }
}
