package br.edu.ifba.ragflow.search;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryVectorSearchProviderTest {

    private static final UUID DOCUMENT = UUID.randomUUID();

    private InMemoryVectorSearchProvider provider;
    private ChunkEntry paris;
    private ChunkEntry berlin;
    private ChunkEntry rome;

    @BeforeEach
    void setUp() {
        provider = new InMemoryVectorSearchProvider();
        paris = chunk("Paris is the capital of France", new float[]{1f, 0f}, Map.of("lang", "en"));
        berlin = chunk("Berlin is the capital of Germany", new float[]{0f, 1f}, Map.of("lang", "en"));
        rome = chunk("Roma e la capitale d'Italia", new float[]{0.7f, 0.7f}, Map.of("lang", "it"));
        provider.upsertBatch(List.of(paris, berlin, rome));
    }

    private static ChunkEntry chunk(String text, float[] vector, Map<String, Object> metadata) {
        return new ChunkEntry(UUID.randomUUID(), DOCUMENT, text, vector, metadata);
    }

    private static List<UUID> ids(List<VectorSearchResult> results) {
        return results.stream().map(VectorSearchResult::fragmentId).toList();
    }

    @Nested
    @DisplayName("semantic search")
    class Semantic {

        @Test
        @DisplayName("should rank chunks by cosine similarity")
        void shouldRankBySimilarity() {
            List<VectorSearchResult> results = provider
                    .semanticSearch(new float[]{1f, 0f}, VectorSearchSettings.defaults()).join();

            assertEquals(List.of(paris.fragmentId(), rome.fragmentId(), berlin.fragmentId()), ids(results));
            assertEquals(1.0, results.get(0).score(), 1e-6);
        }

        @Test
        @DisplayName("should honor the search limit")
        void shouldHonorLimit() {
            VectorSearchSettings settings = VectorSearchSettings.builder().searchLimit(1).build();

            List<VectorSearchResult> results = provider.semanticSearch(new float[]{0f, 1f}, settings).join();

            assertEquals(List.of(berlin.fragmentId()), ids(results));
        }

        @Test
        @DisplayName("should only return chunks matching every filter")
        void shouldApplyFilters() {
            VectorSearchSettings settings = VectorSearchSettings.builder().filters(Map.of("lang", "it")).build();

            List<VectorSearchResult> results = provider.semanticSearch(new float[]{1f, 0f}, settings).join();

            assertEquals(List.of(rome.fragmentId()), ids(results));
        }
    }

    @Nested
    @DisplayName("full-text search")
    class FullText {

        @Test
        @DisplayName("should score chunks by the share of matched query terms")
        void shouldScoreTermOverlap() {
            List<VectorSearchResult> results = provider
                    .fullTextSearch("capital of France", VectorSearchSettings.defaults()).join();

            assertEquals(paris.fragmentId(), results.get(0).fragmentId());
            assertEquals(1.0, results.get(0).score(), 1e-9);
            assertEquals(berlin.fragmentId(), results.get(1).fragmentId());
            assertEquals(2.0 / 3.0, results.get(1).score(), 1e-9);
            assertEquals(2, results.size());
        }

        @Test
        @DisplayName("should return nothing for a query without terms")
        void shouldIgnoreBlankQuery() {
            assertTrue(provider.fullTextSearch(" ?! ", VectorSearchSettings.defaults()).join().isEmpty());
        }
    }

    @Test
    @DisplayName("should fuse semantic and full-text ranks with reciprocal rank fusion")
    void shouldFuseHybridRanks() {
        VectorSearchSettings settings = VectorSearchSettings.builder().useHybridSearch(true).build();

        List<VectorSearchResult> results = provider.hybridSearch("capital of Germany", new float[]{1f, 0f}, settings).join();

        // paris: semantic rank 0, full-text rank 1; berlin: semantic rank 2, full-text rank 0
        double parisScore = 5.0 / (50 + 1) + 1.0 / (50 + 2);
        double berlinScore = 5.0 / (50 + 3) + 1.0 / (50 + 1);
        assertEquals(List.of(paris.fragmentId(), berlin.fragmentId(), rome.fragmentId()), ids(results));
        assertEquals(parisScore, results.get(0).score(), 1e-9);
        assertEquals(berlinScore, results.get(1).score(), 1e-9);
        assertEquals(3, results.size());
    }

    @Test
    @DisplayName("should replace and delete chunks by fragment id")
    void shouldUpsertAndDelete() {
        ChunkEntry updated = new ChunkEntry(paris.fragmentId(), DOCUMENT, "Paris, France", new float[]{1f, 0f}, Map.of());
        provider.upsert(updated);

        assertEquals(3, provider.size());
        assertTrue(provider.delete(paris.fragmentId()));
        assertFalse(provider.delete(paris.fragmentId()));
        assertEquals(2, provider.size());
    }
}
