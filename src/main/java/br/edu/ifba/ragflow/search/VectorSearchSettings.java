package br.edu.ifba.ragflow.search;

import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Objects;

/**
 * Settings of the vector search branch.
 *
 * @param useVectorSearch whether the vector branch runs at all
 * @param useHybridSearch whether to fuse semantic and full-text results
 * @param filters metadata equality filters; every entry must match
 * @param searchLimit maximum number of results per query, 1 to 1000
 * @param hybridSearchSettings fusion weights, used when {@code useHybridSearch} is set
 */
public record VectorSearchSettings(
        boolean useVectorSearch,
        boolean useHybridSearch,
        @NotNull Map<String, Object> filters,
        int searchLimit,
        @NotNull HybridSearchSettings hybridSearchSettings
) {
    public static final int DEFAULT_SEARCH_LIMIT = 10;
    public static final int MAX_SEARCH_LIMIT = 1_000;

    public VectorSearchSettings {
        Objects.requireNonNull(filters, "filters must not be null");
        Objects.requireNonNull(hybridSearchSettings, "hybridSearchSettings must not be null");
        if (searchLimit < 1 || searchLimit > MAX_SEARCH_LIMIT) {
            throw new IllegalArgumentException(
                    "searchLimit must be between 1 and " + MAX_SEARCH_LIMIT + ", got " + searchLimit);
        }
        filters = Map.copyOf(filters);
    }

    @NotNull
    public static VectorSearchSettings defaults() {
        return builder().build();
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for VectorSearchSettings.
     */
    public static final class Builder {
        private boolean useVectorSearch = true;
        private boolean useHybridSearch = false;
        private Map<String, Object> filters = Map.of();
        private int searchLimit = DEFAULT_SEARCH_LIMIT;
        private HybridSearchSettings hybridSearchSettings = HybridSearchSettings.defaults();

        private Builder() {
        }

        public Builder useVectorSearch(boolean useVectorSearch) {
            this.useVectorSearch = useVectorSearch;
            return this;
        }

        public Builder useHybridSearch(boolean useHybridSearch) {
            this.useHybridSearch = useHybridSearch;
            return this;
        }

        public Builder filters(@NotNull Map<String, Object> filters) {
            this.filters = filters;
            return this;
        }

        public Builder searchLimit(int searchLimit) {
            this.searchLimit = searchLimit;
            return this;
        }

        public Builder hybridSearchSettings(@NotNull HybridSearchSettings hybridSearchSettings) {
            this.hybridSearchSettings = hybridSearchSettings;
            return this;
        }

        public VectorSearchSettings build() {
            return new VectorSearchSettings(useVectorSearch, useHybridSearch, filters, searchLimit, hybridSearchSettings);
        }
    }
}
