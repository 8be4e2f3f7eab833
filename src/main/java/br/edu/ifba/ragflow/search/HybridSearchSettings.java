package br.edu.ifba.ragflow.search;

/**
 * Weights of a hybrid search, fused with reciprocal rank fusion.
 *
 * @param fullTextWeight weight applied to the full-text rank
 * @param semanticWeight weight applied to the semantic rank
 * @param fullTextLimit maximum candidates taken from each search before fusion
 * @param rrfK smoothing constant of the fusion formula
 */
public record HybridSearchSettings(
        double fullTextWeight,
        double semanticWeight,
        int fullTextLimit,
        int rrfK
) {
    public HybridSearchSettings {
        if (fullTextWeight < 0 || semanticWeight < 0) {
            throw new IllegalArgumentException("Weights must not be negative");
        }
        if (fullTextLimit < 1) {
            throw new IllegalArgumentException("fullTextLimit must be at least 1, got " + fullTextLimit);
        }
        if (rrfK < 0) {
            throw new IllegalArgumentException("rrfK must not be negative, got " + rrfK);
        }
    }

    public static HybridSearchSettings defaults() {
        return new HybridSearchSettings(1.0, 5.0, 200, 50);
    }
}
