package br.edu.ifba.ragflow.search;

/**
 * Scope of a knowledge graph search.
 */
public enum KGSearchType {
    /** Entity and relationship neighbourhood of the query. */
    LOCAL,
    /** Community summaries across the whole graph. */
    GLOBAL
}
