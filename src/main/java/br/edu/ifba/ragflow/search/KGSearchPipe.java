package br.edu.ifba.ragflow.search;

import br.edu.ifba.ragflow.logging.RunContext;
import br.edu.ifba.ragflow.logging.RunLoggingProvider;
import br.edu.ifba.ragflow.pipe.AsyncPipe;
import br.edu.ifba.ragflow.pipe.PipeConfig;
import br.edu.ifba.ragflow.pipe.PipeInput;
import br.edu.ifba.ragflow.pipe.PipeLogChannel;
import br.edu.ifba.ragflow.state.AsyncState;
import br.edu.ifba.ragflow.utils.FutureUtil;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.stream.Stream;

/**
 * Runs a knowledge graph search for every incoming query.
 */
public class KGSearchPipe extends AsyncPipe<Object, KGSearchResult> {

    public static final String DEFAULT_NAME = "kg_search";
    public static final String RESULTS_FIELD = "results";

    private final KGSearchProvider searchProvider;

    public KGSearchPipe(
            @NotNull PipeConfig config,
            @NotNull KGSearchProvider searchProvider,
            @NotNull RunLoggingProvider loggingProvider,
            @NotNull ExecutorService executor) {
        super(config, loggingProvider, executor);
        this.searchProvider = Objects.requireNonNull(searchProvider, "searchProvider must not be null");
    }

    @Override
    protected Stream<KGSearchResult> logic(
            @NotNull PipeInput<Object> input,
            @NotNull AsyncState state,
            @NotNull RunContext runContext,
            @NotNull PipeLogChannel log) {
        KGSearchSettings settings = input.settings()
                .getOrDefault(KGSearchSettings.class, KGSearchSettings::defaults);
        List<KGSearchResult> collected = new ArrayList<>();

        return input.message().flatMap(message -> {
            String query = String.valueOf(message);
            List<KGSearchResult> results = FutureUtil.await(searchProvider.search(query, settings));
            log.log("search_query", query);
            log.log("search_results", results);
            collected.addAll(results);
            state.publish(getName(), Map.of(RESULTS_FIELD, List.copyOf(collected)));
            return results.stream();
        });
    }
}
