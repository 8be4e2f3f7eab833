package br.edu.ifba.ragflow.pipeline;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A query together with the search results retrieved for it.
 */
public record SearchResultPair(
        @NotNull String query,
        @NotNull AggregateSearchResult searchResults
) {
    public SearchResultPair {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(searchResults, "searchResults must not be null");
    }
}
