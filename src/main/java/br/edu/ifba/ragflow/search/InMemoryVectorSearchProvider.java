package br.edu.ifba.ragflow.search;

import br.edu.ifba.ragflow.utils.EmbeddingUtil;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * In-memory chunk store.
 * Uses brute-force cosine similarity for semantic search, term overlap for full-text search
 * and reciprocal rank fusion for hybrid search.
 * Suitable for development and tests.
 */
public class InMemoryVectorSearchProvider implements VectorSearchProvider {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryVectorSearchProvider.class);

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final ConcurrentHashMap<UUID, ChunkEntry> storage = new ConcurrentHashMap<>();

    public void upsert(@NotNull ChunkEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        storage.put(entry.fragmentId(), entry);
        logger.debug("Upserted chunk: {}", entry.fragmentId());
    }

    public void upsertBatch(@NotNull List<ChunkEntry> entries) {
        for (ChunkEntry entry : entries) {
            storage.put(entry.fragmentId(), entry);
        }
        logger.debug("Upserted {} chunks", entries.size());
    }

    public boolean delete(@NotNull UUID fragmentId) {
        return storage.remove(fragmentId) != null;
    }

    public int size() {
        return storage.size();
    }

    @Override
    public CompletableFuture<List<VectorSearchResult>> semanticSearch(
            @NotNull float[] queryVector,
            @NotNull VectorSearchSettings settings) {
        return CompletableFuture.completedFuture(rankSemantic(queryVector, settings, settings.searchLimit()));
    }

    @Override
    public CompletableFuture<List<VectorSearchResult>> fullTextSearch(
            @NotNull String queryText,
            @NotNull VectorSearchSettings settings) {
        return CompletableFuture.completedFuture(rankFullText(queryText, settings, settings.searchLimit()));
    }

    @Override
    public CompletableFuture<List<VectorSearchResult>> hybridSearch(
            @NotNull String queryText,
            @NotNull float[] queryVector,
            @NotNull VectorSearchSettings settings) {
        HybridSearchSettings hybrid = settings.hybridSearchSettings();
        int candidates = Math.max(settings.searchLimit(), hybrid.fullTextLimit());
        List<VectorSearchResult> semantic = rankSemantic(queryVector, settings, candidates);
        List<VectorSearchResult> fullText = rankFullText(queryText, settings, candidates);

        Map<UUID, Double> fused = new HashMap<>();
        Map<UUID, VectorSearchResult> byId = new LinkedHashMap<>();
        accumulate(semantic, hybrid.semanticWeight(), hybrid.rrfK(), fused, byId);
        accumulate(fullText, hybrid.fullTextWeight(), hybrid.rrfK(), fused, byId);

        List<VectorSearchResult> results = byId.values().stream()
                .map(result -> result.withScore(fused.get(result.fragmentId())))
                .sorted(Comparator.comparingDouble(VectorSearchResult::score).reversed())
                .limit(settings.searchLimit())
                .toList();
        logger.debug("Hybrid search fused {} semantic and {} full-text candidates into {} results",
                semantic.size(), fullText.size(), results.size());
        return CompletableFuture.completedFuture(results);
    }

    private static void accumulate(
            List<VectorSearchResult> ranked,
            double weight,
            int rrfK,
            Map<UUID, Double> fused,
            Map<UUID, VectorSearchResult> byId) {
        for (int rank = 0; rank < ranked.size(); rank++) {
            VectorSearchResult result = ranked.get(rank);
            double contribution = weight / (rrfK + rank + 1);
            fused.merge(result.fragmentId(), contribution, Double::sum);
            byId.putIfAbsent(result.fragmentId(), result);
        }
    }

    private List<VectorSearchResult> rankSemantic(float[] queryVector, VectorSearchSettings settings, int limit) {
        List<VectorSearchResult> scored = new ArrayList<>();
        for (ChunkEntry entry : storage.values()) {
            if (!matches(entry, settings.filters())) {
                continue;
            }
            double similarity = EmbeddingUtil.cosineSimilarity(queryVector, entry.vector());
            scored.add(entry.toResult(similarity));
        }
        return scored.stream()
                .sorted(Comparator.comparingDouble(VectorSearchResult::score).reversed())
                .limit(limit)
                .toList();
    }

    private List<VectorSearchResult> rankFullText(String queryText, VectorSearchSettings settings, int limit) {
        Set<String> queryTerms = terms(queryText);
        if (queryTerms.isEmpty()) {
            return List.of();
        }
        List<VectorSearchResult> scored = new ArrayList<>();
        for (ChunkEntry entry : storage.values()) {
            if (!matches(entry, settings.filters())) {
                continue;
            }
            Set<String> chunkTerms = terms(entry.text());
            long hits = queryTerms.stream().filter(chunkTerms::contains).count();
            if (hits > 0) {
                scored.add(entry.toResult((double) hits / queryTerms.size()));
            }
        }
        return scored.stream()
                .sorted(Comparator.comparingDouble(VectorSearchResult::score).reversed())
                .limit(limit)
                .toList();
    }

    private static boolean matches(ChunkEntry entry, Map<String, Object> filters) {
        for (Map.Entry<String, Object> filter : filters.entrySet()) {
            if (!Objects.equals(entry.metadata().get(filter.getKey()), filter.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static Set<String> terms(String text) {
        return Arrays.stream(NON_WORD.split(text.toLowerCase(Locale.ROOT)))
                .filter(term -> !term.isBlank())
                .collect(Collectors.toSet());
    }
}
