package br.edu.ifba.ragflow.pipeline;

import br.edu.ifba.ragflow.search.KGSearchResult;
import br.edu.ifba.ragflow.search.VectorSearchResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Combined output of the search branches.
 * A branch that did not run yields {@link Optional#empty()}, never an empty list.
 */
public final class AggregateSearchResult {

    @Nullable
    private final List<VectorSearchResult> vectorSearchResults;
    @Nullable
    private final List<KGSearchResult> kgSearchResults;

    public AggregateSearchResult(
            @Nullable List<VectorSearchResult> vectorSearchResults,
            @Nullable List<KGSearchResult> kgSearchResults) {
        this.vectorSearchResults = vectorSearchResults == null ? null : List.copyOf(vectorSearchResults);
        this.kgSearchResults = kgSearchResults == null ? null : List.copyOf(kgSearchResults);
    }

    @NotNull
    public Optional<List<VectorSearchResult>> vectorSearchResults() {
        return Optional.ofNullable(vectorSearchResults);
    }

    @NotNull
    public Optional<List<KGSearchResult>> kgSearchResults() {
        return Optional.ofNullable(kgSearchResults);
    }

    /**
     * Returns a serializable view; branches that did not run map to null.
     */
    @NotNull
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("vector_search_results", vectorSearchResults);
        map.put("kg_search_results", kgSearchResults);
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateSearchResult that)) return false;
        return Objects.equals(vectorSearchResults, that.vectorSearchResults)
                && Objects.equals(kgSearchResults, that.kgSearchResults);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vectorSearchResults, kgSearchResults);
    }

    @Override
    public String toString() {
        return "AggregateSearchResult{vectorSearchResults=" + vectorSearchResults +
                ", kgSearchResults=" + kgSearchResults + '}';
    }
}
