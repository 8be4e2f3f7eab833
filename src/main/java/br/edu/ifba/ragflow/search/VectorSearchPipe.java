package br.edu.ifba.ragflow.search;

import br.edu.ifba.ragflow.embedding.EmbeddingFunction;
import br.edu.ifba.ragflow.logging.RunContext;
import br.edu.ifba.ragflow.logging.RunLoggingProvider;
import br.edu.ifba.ragflow.pipe.AsyncPipe;
import br.edu.ifba.ragflow.pipe.PipeConfig;
import br.edu.ifba.ragflow.pipe.PipeInput;
import br.edu.ifba.ragflow.pipe.PipeLogChannel;
import br.edu.ifba.ragflow.state.AsyncState;
import br.edu.ifba.ragflow.utils.FutureUtil;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.stream.Stream;

/**
 * Searches the chunk store for every incoming query.
 *
 * <p>Each query is embedded with the {@link EmbeddingFunction} and sent to the
 * {@link VectorSearchProvider}, as a semantic search or, when
 * {@link VectorSearchSettings#useHybridSearch()} is set, as a hybrid search.
 * The results collected so far are published to the state under {@value #RESULTS_FIELD}.</p>
 */
public class VectorSearchPipe extends AsyncPipe<Object, VectorSearchResult> {

    private static final Logger logger = LoggerFactory.getLogger(VectorSearchPipe.class);

    public static final String DEFAULT_NAME = "vector_search";
    public static final String RESULTS_FIELD = "results";

    private final EmbeddingFunction embeddingFunction;
    private final VectorSearchProvider searchProvider;

    public VectorSearchPipe(
            @NotNull PipeConfig config,
            @NotNull EmbeddingFunction embeddingFunction,
            @NotNull VectorSearchProvider searchProvider,
            @NotNull RunLoggingProvider loggingProvider,
            @NotNull ExecutorService executor) {
        super(config, loggingProvider, executor);
        this.embeddingFunction = Objects.requireNonNull(embeddingFunction, "embeddingFunction must not be null");
        this.searchProvider = Objects.requireNonNull(searchProvider, "searchProvider must not be null");
    }

    @Override
    protected Stream<VectorSearchResult> logic(
            @NotNull PipeInput<Object> input,
            @NotNull AsyncState state,
            @NotNull RunContext runContext,
            @NotNull PipeLogChannel log) {
        VectorSearchSettings settings = input.settings()
                .getOrDefault(VectorSearchSettings.class, VectorSearchSettings::defaults);
        List<VectorSearchResult> collected = new ArrayList<>();

        return input.message().flatMap(message -> {
            String query = String.valueOf(message);
            List<VectorSearchResult> results = search(query, settings);
            log.log("search_query", query);
            log.log("search_results", results);
            collected.addAll(results);
            state.publish(getName(), Map.of(RESULTS_FIELD, List.copyOf(collected)));
            logger.debug("Vector search returned {} results for run {}", results.size(), runContext.runId());
            return results.stream();
        });
    }

    private List<VectorSearchResult> search(String query, VectorSearchSettings settings) {
        float[] queryVector = FutureUtil.await(embeddingFunction.embedSingle(query));
        if (settings.useHybridSearch()) {
            return FutureUtil.await(searchProvider.hybridSearch(query, queryVector, settings));
        }
        return FutureUtil.await(searchProvider.semanticSearch(queryVector, settings));
    }
}
