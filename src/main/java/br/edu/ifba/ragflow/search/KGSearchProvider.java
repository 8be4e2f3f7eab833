package br.edu.ifba.ragflow.search;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Boundary to a knowledge graph search backend.
 */
@FunctionalInterface
public interface KGSearchProvider {

    /**
     * Searches the graph.
     *
     * @param query user query
     * @param settings search scope and limits
     * @return future with the hits, best first
     */
    CompletableFuture<List<KGSearchResult>> search(@NotNull String query, @NotNull KGSearchSettings settings);
}
