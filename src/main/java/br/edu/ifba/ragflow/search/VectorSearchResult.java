package br.edu.ifba.ragflow.search;

import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A chunk returned by a vector, full-text or hybrid search.
 *
 * @param fragmentId id of the matched chunk
 * @param documentId id of the document the chunk belongs to
 * @param score relevance score, higher is better
 * @param text chunk text
 * @param metadata chunk metadata
 */
public record VectorSearchResult(
        @NotNull UUID fragmentId,
        @NotNull UUID documentId,
        double score,
        @NotNull String text,
        @NotNull Map<String, Object> metadata
) {
    public VectorSearchResult {
        Objects.requireNonNull(fragmentId, "fragmentId must not be null");
        Objects.requireNonNull(documentId, "documentId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    @NotNull
    public VectorSearchResult withScore(double newScore) {
        return new VectorSearchResult(fragmentId, documentId, newScore, text, metadata);
    }
}
