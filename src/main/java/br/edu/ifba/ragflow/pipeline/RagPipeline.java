package br.edu.ifba.ragflow.pipeline;

import br.edu.ifba.ragflow.logging.RunContext;
import br.edu.ifba.ragflow.logging.RunManager;
import br.edu.ifba.ragflow.logging.RunScope;
import br.edu.ifba.ragflow.logging.RunType;
import br.edu.ifba.ragflow.pipe.AsyncPipe;
import br.edu.ifba.ragflow.pipe.RunSettings;
import br.edu.ifba.ragflow.state.AsyncState;
import br.edu.ifba.ragflow.utils.FutureUtil;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Retrieval-augmented generation: search every query, then generate from the results.
 *
 * <p>On first pull the pipeline starts one {@link SearchPipeline} run per query, all of them
 * concurrently. The generation pipeline then receives a {@link SearchResultPair} per query in
 * input order; each pair waits only for its own search. Closing the output early cancels the
 * searches that have not finished: a search that is still running is interrupted, which in
 * turn cancels its branches.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * RagPipeline rag = new RagPipeline(runManager, executor, searchPipeline)
 *     .addRagPipe(ragPipe);
 *
 * List<Object> responses = rag.run(Stream.of("q1", "q2"), null, null, RunSettings.empty());
 * }</pre>
 */
public class RagPipeline {

    private static final Logger logger = LoggerFactory.getLogger(RagPipeline.class);

    private final RunManager runManager;
    private final ExecutorService executor;
    private final SearchPipeline searchPipeline;
    private final AsyncPipeline generationPipeline;

    public RagPipeline(
            @NotNull RunManager runManager,
            @NotNull ExecutorService executor,
            @NotNull SearchPipeline searchPipeline) {
        this.runManager = Objects.requireNonNull(runManager, "runManager must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.searchPipeline = Objects.requireNonNull(searchPipeline, "searchPipeline must not be null");
        this.generationPipeline = new AsyncPipeline(runManager, RunType.RETRIEVAL);
    }

    public RagPipeline addRagPipe(@NotNull AsyncPipe<?, ?> pipe) {
        return addRagPipe(pipe, List.of());
    }

    /**
     * Appends a generation pipe. The first one receives {@link SearchResultPair}s.
     */
    public RagPipeline addRagPipe(@NotNull AsyncPipe<?, ?> pipe, @NotNull List<UpstreamRef> upstreamRefs) {
        generationPipeline.addPipe(pipe, upstreamRefs);
        return this;
    }

    /**
     * Runs the pipeline and collects the generation output.
     *
     * @param queries user queries
     * @param state state of the generation pipeline, or null for a fresh one
     * @param runContext run to join, or null to start a new one
     * @param settings search and generation settings
     * @return generation output in query order
     */
    @NotNull
    public List<Object> run(
            @NotNull Stream<?> queries,
            @Nullable AsyncState state,
            @Nullable RunContext runContext,
            @NotNull RunSettings settings) {
        try (RunScope scope = runManager.withRun(RunType.RETRIEVAL, runContext)) {
            RunContext context = scope.context();
            return generationPipeline.run(pairs(queries, context, settings), state, context, settings);
        }
    }

    /**
     * Runs the pipeline lazily. Close the stream to cancel outstanding searches.
     */
    @NotNull
    public Stream<Object> stream(
            @NotNull Stream<?> queries,
            @Nullable AsyncState state,
            @Nullable RunContext runContext,
            @NotNull RunSettings settings) {
        try (RunScope scope = runManager.withRun(RunType.RETRIEVAL, runContext)) {
            RunContext context = scope.context();
            return generationPipeline.stream(pairs(queries, context, settings), state, context, settings);
        }
    }

    @NotNull
    public SearchPipeline getSearchPipeline() {
        return searchPipeline;
    }

    @NotNull
    public AsyncPipeline getGenerationPipeline() {
        return generationPipeline;
    }

    private Stream<SearchResultPair> pairs(Stream<?> queries, RunContext context, RunSettings settings) {
        PairIterator iterator = new PairIterator(queries, context, settings);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false)
                .onClose(iterator::cancel);
    }

    /**
     * Starts every search on first pull and hands out the results in query order.
     */
    private final class PairIterator implements Iterator<SearchResultPair> {

        private final Stream<?> queries;
        private final RunContext context;
        private final RunSettings settings;

        @Nullable
        private List<String> queryList;
        @Nullable
        private List<Future<AggregateSearchResult>> futures;
        private boolean cancelled;
        private int index;

        PairIterator(Stream<?> queries, RunContext context, RunSettings settings) {
            this.queries = queries;
            this.context = context;
            this.settings = settings;
        }

        @Override
        public boolean hasNext() {
            start();
            return index < futures.size();
        }

        @Override
        public SearchResultPair next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int current = index++;
            try {
                AggregateSearchResult result = FutureUtil.await(futures.get(current));
                return new SearchResultPair(queryList.get(current), result);
            } catch (RuntimeException | Error e) {
                cancel();
                throw e;
            }
        }

        private synchronized void start() {
            if (futures != null) {
                return;
            }
            try (Stream<?> source = queries) {
                queryList = source.map(String::valueOf).toList();
            }
            futures = new ArrayList<>(queryList.size());
            if (cancelled) {
                return;
            }
            for (String query : queryList) {
                futures.add(executor.submit(
                        () -> searchPipeline.run(Stream.of(query), new AsyncState(), context, settings)));
            }
            logger.debug("Started {} searches for run {}", futures.size(), context.runId());
        }

        synchronized void cancel() {
            cancelled = true;
            if (futures == null) {
                return;
            }
            int cancelled = 0;
            for (Future<AggregateSearchResult> future : futures) {
                if (future.cancel(true)) {
                    cancelled++;
                }
            }
            if (cancelled > 0) {
                logger.debug("Cancelled {} outstanding searches for run {}", cancelled, context.runId());
            }
        }
    }
}
