package br.edu.ifba.ragflow.rag;

import br.edu.ifba.ragflow.llm.LLMCompletion;
import br.edu.ifba.ragflow.pipeline.AggregateSearchResult;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Generated answer for one query together with the results it was grounded on.
 */
public record RagResponse(
        @NotNull String query,
        @NotNull LLMCompletion completion,
        @NotNull AggregateSearchResult searchResults
) {
    public RagResponse {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(completion, "completion must not be null");
        Objects.requireNonNull(searchResults, "searchResults must not be null");
    }

    @NotNull
    public String answer() {
        return completion.content();
    }
}
