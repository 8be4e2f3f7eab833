package br.edu.ifba.ragflow.logging;

/**
 * Category of a logical run, recorded with the run id when a run scope opens.
 */
public enum RunType {
    /**
     * Search and RAG requests.
     */
    RETRIEVAL,

    /**
     * Administrative operations on stored data.
     */
    MANAGEMENT,

    /**
     * Document parsing, chunking and embedding.
     */
    INGESTION,

    AUTH,

    /**
     * Knowledge-graph extraction and enrichment.
     */
    KG,

    UNSPECIFIED
}
