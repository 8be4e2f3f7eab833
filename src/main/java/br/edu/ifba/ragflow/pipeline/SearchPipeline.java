package br.edu.ifba.ragflow.pipeline;

import br.edu.ifba.ragflow.logging.RunContext;
import br.edu.ifba.ragflow.logging.RunManager;
import br.edu.ifba.ragflow.logging.RunScope;
import br.edu.ifba.ragflow.logging.RunType;
import br.edu.ifba.ragflow.pipe.AsyncPipe;
import br.edu.ifba.ragflow.pipe.RunSettings;
import br.edu.ifba.ragflow.search.KGSearchResult;
import br.edu.ifba.ragflow.search.KGSearchSettings;
import br.edu.ifba.ragflow.search.VectorSearchResult;
import br.edu.ifba.ragflow.search.VectorSearchSettings;
import br.edu.ifba.ragflow.state.AsyncState;
import br.edu.ifba.ragflow.utils.FutureUtil;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Stream;

/**
 * Fans every query out to a vector search branch and a knowledge graph search branch.
 *
 * <p>Each enabled branch is an {@link AsyncPipeline} fed from its own bounded
 * {@link BranchQueue}. A producer task copies the input into every enabled queue and closes
 * them when the input ends or fails. Branches run concurrently with the producer and with each
 * other on the shared executor; the queue capacity provides back-pressure.</p>
 *
 * <p>The caller waits for the producer and then for every branch. A failing branch does not
 * cancel the other one; the first failure is rethrown once all tasks have finished. An
 * interrupted caller cancels the producer and the branches, abandons every queue so that no
 * branch stays parked on it, and rethrows without waiting for them.</p>
 */
public class SearchPipeline {

    private static final Logger logger = LoggerFactory.getLogger(SearchPipeline.class);

    public static final int DEFAULT_BRANCH_QUEUE_SIZE = 100;

    private final RunManager runManager;
    private final ExecutorService executor;
    private final int branchQueueSize;
    private final AsyncPipeline vectorSearchPipeline;
    private final AsyncPipeline kgSearchPipeline;

    public SearchPipeline(@NotNull RunManager runManager, @NotNull ExecutorService executor) {
        this(runManager, executor, DEFAULT_BRANCH_QUEUE_SIZE);
    }

    public SearchPipeline(@NotNull RunManager runManager, @NotNull ExecutorService executor, int branchQueueSize) {
        if (branchQueueSize < 1) {
            throw new IllegalArgumentException("branchQueueSize must be at least 1, got " + branchQueueSize);
        }
        this.runManager = Objects.requireNonNull(runManager, "runManager must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.branchQueueSize = branchQueueSize;
        this.vectorSearchPipeline = new AsyncPipeline(runManager, RunType.RETRIEVAL);
        this.kgSearchPipeline = new AsyncPipeline(runManager, RunType.RETRIEVAL);
    }

    public SearchPipeline addVectorSearchPipe(@NotNull AsyncPipe<?, ? extends VectorSearchResult> pipe) {
        return addVectorSearchPipe(pipe, List.of());
    }

    /**
     * Appends a pipe to the vector branch. The last pipe must yield {@link VectorSearchResult}s.
     */
    public SearchPipeline addVectorSearchPipe(
            @NotNull AsyncPipe<?, ? extends VectorSearchResult> pipe,
            @NotNull List<UpstreamRef> upstreamRefs) {
        vectorSearchPipeline.addPipe(pipe, upstreamRefs);
        return this;
    }

    public SearchPipeline addKGSearchPipe(@NotNull AsyncPipe<?, ? extends KGSearchResult> pipe) {
        return addKGSearchPipe(pipe, List.of());
    }

    /**
     * Appends a pipe to the KG branch. The last pipe must yield {@link KGSearchResult}s.
     */
    public SearchPipeline addKGSearchPipe(
            @NotNull AsyncPipe<?, ? extends KGSearchResult> pipe,
            @NotNull List<UpstreamRef> upstreamRefs) {
        kgSearchPipeline.addPipe(pipe, upstreamRefs);
        return this;
    }

    /**
     * Runs the search with the branches enabled by the settings.
     *
     * <p>The vector branch runs when {@link VectorSearchSettings#useVectorSearch()} is set
     * (default on), the KG branch when {@link KGSearchSettings#useKgSearch()} is set
     * (default off).</p>
     */
    @NotNull
    public AggregateSearchResult run(
            @NotNull Stream<?> input,
            @Nullable AsyncState state,
            @Nullable RunContext runContext,
            @NotNull RunSettings settings) {
        boolean vectorEnabled = settings
                .getOrDefault(VectorSearchSettings.class, VectorSearchSettings::defaults)
                .useVectorSearch();
        boolean kgEnabled = settings
                .getOrDefault(KGSearchSettings.class, KGSearchSettings::defaults)
                .useKgSearch();
        return run(input, vectorEnabled, kgEnabled, state, runContext, settings);
    }

    /**
     * Runs the search with explicitly enabled branches.
     *
     * @param input queries
     * @param vectorEnabled whether the vector branch runs
     * @param kgEnabled whether the KG branch runs
     * @param state state shared by both branches, or null for a fresh one
     * @param runContext run to join, or null to start a new one
     * @param settings typed settings handed to every pipe
     * @return results of the branches that ran
     */
    @NotNull
    public AggregateSearchResult run(
            @NotNull Stream<?> input,
            boolean vectorEnabled,
            boolean kgEnabled,
            @Nullable AsyncState state,
            @Nullable RunContext runContext,
            @NotNull RunSettings settings) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        boolean runVector = vectorEnabled && isConfigured(vectorSearchPipeline, "vector");
        boolean runKg = kgEnabled && isConfigured(kgSearchPipeline, "kg");

        try (RunScope scope = runManager.withRun(RunType.RETRIEVAL, runContext);
             Stream<?> source = input) {
            RunContext context = scope.context();
            AsyncState sharedState = state != null ? state : new AsyncState();
            long startTime = System.currentTimeMillis();

            List<BranchQueue> queues = new ArrayList<>();
            List<Future<?>> tasks = new ArrayList<>();
            Future<List<Object>> vectorFuture = null;
            Future<List<Object>> kgFuture = null;
            if (runVector) {
                BranchQueue queue = new BranchQueue("vector", branchQueueSize);
                queues.add(queue);
                vectorFuture = startBranch(vectorSearchPipeline, queue, sharedState, context, settings);
                tasks.add(vectorFuture);
            }
            if (runKg) {
                BranchQueue queue = new BranchQueue("kg", branchQueueSize);
                queues.add(queue);
                kgFuture = startBranch(kgSearchPipeline, queue, sharedState, context, settings);
                tasks.add(kgFuture);
            }

            Future<?> producer = executor.submit(() -> produce(source, queues));
            tasks.add(producer);

            List<Throwable> failures = new ArrayList<>();
            awaitTask(producer, failures, queues, tasks);
            List<Object> vectorResults = vectorFuture == null ? null : awaitTask(vectorFuture, failures, queues, tasks);
            List<Object> kgResults = kgFuture == null ? null : awaitTask(kgFuture, failures, queues, tasks);

            if (!failures.isEmpty()) {
                Throwable first = failures.get(0);
                logFailure(context, first, failures.size());
                throw propagate(first);
            }

            AggregateSearchResult result = new AggregateSearchResult(
                    vectorResults == null ? null : castAll(vectorResults, VectorSearchResult.class),
                    kgResults == null ? null : castAll(kgResults, KGSearchResult.class));
            logger.info("Search run {} completed in {}ms (vector={}, kg={})",
                    context.runId(), System.currentTimeMillis() - startTime, runVector, runKg);
            return result;
        }
    }

    @NotNull
    public AggregateSearchResult run(@NotNull String query, @Nullable RunContext runContext, @NotNull RunSettings settings) {
        return run(Stream.of(query), null, runContext, settings);
    }

    @NotNull
    public AsyncPipeline getVectorSearchPipeline() {
        return vectorSearchPipeline;
    }

    @NotNull
    public AsyncPipeline getKGSearchPipeline() {
        return kgSearchPipeline;
    }

    private Future<List<Object>> startBranch(
            AsyncPipeline pipeline,
            BranchQueue queue,
            AsyncState state,
            RunContext context,
            RunSettings settings) {
        return executor.submit(() -> {
            try {
                return pipeline.run(queue.consume(), state, context, settings);
            } finally {
                queue.abandon();
            }
        });
    }

    private static void produce(Stream<?> source, List<BranchQueue> queues) {
        List<BranchQueue> active = new ArrayList<>(queues);
        try {
            Iterator<?> iterator = source.iterator();
            while (!active.isEmpty() && iterator.hasNext()) {
                Object item = iterator.next();
                Iterator<BranchQueue> targets = active.iterator();
                while (targets.hasNext()) {
                    if (!targets.next().put(item)) {
                        targets.remove();
                    }
                }
            }
            if (active.isEmpty() && !queues.isEmpty()) {
                logger.debug("Every search branch stopped reading, producer stops early");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancellation = new CancellationException("Search producer interrupted");
            cancellation.initCause(e);
            throw cancellation;
        } finally {
            for (BranchQueue queue : queues) {
                queue.close();
            }
        }
    }

    @Nullable
    private static <T> T awaitTask(
            Future<T> future,
            List<Throwable> failures,
            List<BranchQueue> queues,
            List<Future<?>> tasks) {
        try {
            return FutureUtil.await(future);
        } catch (RuntimeException | Error e) {
            failures.add(e);
            if (Thread.currentThread().isInterrupted()) {
                cancelAll(queues, tasks);
            }
            return null;
        }
    }

    private static void cancelAll(List<BranchQueue> queues, List<Future<?>> tasks) {
        queues.forEach(BranchQueue::abandon);
        int cancelled = 0;
        for (Future<?> task : tasks) {
            if (task.cancel(true)) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            logger.debug("Search caller interrupted, cancelled {} tasks", cancelled);
        }
    }

    private static boolean isConfigured(AsyncPipeline pipeline, String branch) {
        if (pipeline.size() == 0) {
            logger.debug("Search branch {} is enabled but has no pipes, skipping it", branch);
            return false;
        }
        return true;
    }

    private static <T> List<T> castAll(List<Object> items, Class<T> type) {
        List<T> cast = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!type.isInstance(item)) {
                throw new ClassCastException("Search branch yielded " +
                        (item == null ? "null" : item.getClass().getName()) + ", expected " + type.getName());
            }
            cast.add(type.cast(item));
        }
        return cast;
    }

    private static RuntimeException propagate(Throwable failure) {
        if (failure instanceof RuntimeException runtime) {
            return runtime;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        return new IllegalStateException(failure);
    }

    private static void logFailure(RunContext context, Throwable failure, int failureCount) {
        MDC.put(AsyncPipe.MDC_RUN_ID, context.runId().toString());
        try {
            logger.error("Search run {} failed ({} failed tasks): {}",
                    context.runId(), failureCount, failure.getMessage(), failure);
        } finally {
            MDC.remove(AsyncPipe.MDC_RUN_ID);
        }
    }
}
