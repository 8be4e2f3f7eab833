package br.edu.ifba.ragflow.search;

import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Objects;

/**
 * A knowledge graph search hit: an entity, relationship or community description,
 * or a global-search answer.
 */
public record KGSearchResult(
        @NotNull KGSearchType searchType,
        @NotNull String content,
        double score,
        @NotNull Map<String, Object> metadata
) {
    public KGSearchResult {
        Objects.requireNonNull(searchType, "searchType must not be null");
        Objects.requireNonNull(content, "content must not be null");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
