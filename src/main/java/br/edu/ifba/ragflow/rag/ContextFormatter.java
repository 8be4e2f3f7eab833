package br.edu.ifba.ragflow.rag;

import br.edu.ifba.ragflow.pipeline.AggregateSearchResult;
import br.edu.ifba.ragflow.search.KGSearchResult;
import br.edu.ifba.ragflow.search.VectorSearchResult;
import br.edu.ifba.ragflow.utils.TokenUtil;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Formats search results into the numbered context handed to the LLM.
 *
 * <p>Output format:</p>
 * <pre>
 * Vector Search Results:
 * Source [1]:
 * first chunk text
 * KG Search Results:
 * Source [2]:
 * community summary
 * </pre>
 *
 * <p>Sources are added in order while they fit the token budget; a first source that
 * alone exceeds the budget is truncated.</p>
 */
public class ContextFormatter {

    private static final Logger logger = LoggerFactory.getLogger(ContextFormatter.class);

    static final String VECTOR_HEADER = "Vector Search Results:";
    static final String KG_HEADER = "KG Search Results:";

    private final int maxTokens;

    public ContextFormatter(int maxTokens) {
        if (maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be positive, got " + maxTokens);
        }
        this.maxTokens = maxTokens;
    }

    @NotNull
    public String format(@NotNull AggregateSearchResult results) {
        List<Section> sections = new ArrayList<>();
        results.vectorSearchResults().ifPresent(vector -> {
            if (!vector.isEmpty()) {
                sections.add(new Section(VECTOR_HEADER, vector.stream().map(VectorSearchResult::text).toList()));
            }
        });
        results.kgSearchResults().ifPresent(kg -> {
            if (!kg.isEmpty()) {
                sections.add(new Section(KG_HEADER, kg.stream().map(KGSearchResult::content).toList()));
            }
        });

        StringBuilder context = new StringBuilder();
        int usedTokens = 0;
        int sourceCounter = 1;
        for (Section section : sections) {
            String header = section.header() + "\n";
            boolean headerWritten = false;
            for (String text : section.texts()) {
                String source = "Source [" + sourceCounter + "]:\n" + text + "\n";
                String block = headerWritten ? source : header + source;
                headerWritten = true;
                if (TokenUtil.wouldExceedBudget(usedTokens, block, maxTokens)) {
                    if (sourceCounter == 1) {
                        String truncated = TokenUtil.truncateToTokenLimit(block, maxTokens);
                        context.append(truncated);
                        sourceCounter++;
                    }
                    logger.debug("Context budget of {} tokens reached after {} sources", maxTokens, sourceCounter - 1);
                    return context.toString().strip();
                }
                context.append(block);
                usedTokens += TokenUtil.estimateTokens(block);
                sourceCounter++;
            }
        }
        return context.toString().strip();
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    private record Section(String header, List<String> texts) {}
}
