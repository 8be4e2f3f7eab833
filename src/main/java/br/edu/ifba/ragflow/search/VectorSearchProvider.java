package br.edu.ifba.ragflow.search;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Boundary to a chunk store that supports semantic, full-text and hybrid search.
 * Results are ordered by descending score and bounded by {@link VectorSearchSettings#searchLimit()}.
 */
public interface VectorSearchProvider {

    CompletableFuture<List<VectorSearchResult>> semanticSearch(
            @NotNull float[] queryVector,
            @NotNull VectorSearchSettings settings);

    CompletableFuture<List<VectorSearchResult>> fullTextSearch(
            @NotNull String queryText,
            @NotNull VectorSearchSettings settings);

    CompletableFuture<List<VectorSearchResult>> hybridSearch(
            @NotNull String queryText,
            @NotNull float[] queryVector,
            @NotNull VectorSearchSettings settings);
}
