package br.edu.ifba.ragflow.search;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Objects;

/**
 * Settings of the knowledge graph search branch.
 *
 * @param useKgSearch whether the KG branch runs at all
 * @param kgSearchType local or global search
 * @param kgSearchLevel community level to search, or null for every level
 * @param maxCommunityDescriptionLength maximum characters of community descriptions passed on
 * @param maxLlmQueriesForGlobalSearch upper bound of LLM calls a global search may issue
 * @param localSearchLimits per-category result limits of a local search
 */
public record KGSearchSettings(
        boolean useKgSearch,
        @NotNull KGSearchType kgSearchType,
        @Nullable String kgSearchLevel,
        int maxCommunityDescriptionLength,
        int maxLlmQueriesForGlobalSearch,
        @NotNull Map<String, Integer> localSearchLimits
) {
    public static final Map<String, Integer> DEFAULT_LOCAL_SEARCH_LIMITS = Map.of(
            "__Entity__", 20,
            "__Relationship__", 20,
            "__Community__", 20);

    public KGSearchSettings {
        Objects.requireNonNull(kgSearchType, "kgSearchType must not be null");
        Objects.requireNonNull(localSearchLimits, "localSearchLimits must not be null");
        if (maxCommunityDescriptionLength < 1) {
            throw new IllegalArgumentException("maxCommunityDescriptionLength must be positive");
        }
        if (maxLlmQueriesForGlobalSearch < 1) {
            throw new IllegalArgumentException("maxLlmQueriesForGlobalSearch must be positive");
        }
        localSearchLimits = Map.copyOf(localSearchLimits);
    }

    @NotNull
    public static KGSearchSettings defaults() {
        return new KGSearchSettings(false, KGSearchType.GLOBAL, null, 65_536, 250, DEFAULT_LOCAL_SEARCH_LIMITS);
    }

    /**
     * Returns a copy with KG search switched on or off.
     */
    @NotNull
    public KGSearchSettings withUseKgSearch(boolean enabled) {
        return new KGSearchSettings(enabled, kgSearchType, kgSearchLevel,
                maxCommunityDescriptionLength, maxLlmQueriesForGlobalSearch, localSearchLimits);
    }
}
