package br.edu.ifba.ragflow.pipeline;

import br.edu.ifba.ragflow.logging.RunContext;
import br.edu.ifba.ragflow.logging.RunManager;
import br.edu.ifba.ragflow.logging.RunScope;
import br.edu.ifba.ragflow.logging.RunType;
import br.edu.ifba.ragflow.pipe.AsyncPipe;
import br.edu.ifba.ragflow.pipe.PipeInput;
import br.edu.ifba.ragflow.pipe.RunSettings;
import br.edu.ifba.ragflow.state.AsyncState;
import br.edu.ifba.ragflow.state.StageNotFoundException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Linear composition of pipes with a named side channel.
 *
 * <p>Each pipe consumes the lazy output of its predecessor. A pipe may additionally declare
 * {@link UpstreamRef}s to fields that earlier stages published to the run's
 * {@link AsyncState}; referenced stages are run to completion before the consuming stage
 * starts, and their output is buffered so the main chain does not execute them again. Stages
 * nobody references pass their items straight through.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * AsyncPipeline pipeline = new AsyncPipeline(runManager)
 *     .addPipe(scorePipe)
 *     .addPipe(passThroughPipe)
 *     .addPipe(sumPipe, List.of(new UpstreamRef("score", "score", "score")));
 *
 * List<Object> results = pipeline.run(Stream.of(5), null, null, RunSettings.empty());
 * }</pre>
 *
 * <p>A pipeline instance is immutable once configured and may be run concurrently; every
 * run gets its own stage registry.</p>
 */
public class AsyncPipeline {

    private static final Logger logger = LoggerFactory.getLogger(AsyncPipeline.class);

    private static final Object MISSING = new Object();

    private final RunManager runManager;
    private final RunType runType;
    private final List<Stage> stages = new ArrayList<>();
    private final Map<String, Integer> positions = new ConcurrentHashMap<>();

    public AsyncPipeline(@NotNull RunManager runManager) {
        this(runManager, RunType.UNSPECIFIED);
    }

    public AsyncPipeline(@NotNull RunManager runManager, @NotNull RunType runType) {
        this.runManager = Objects.requireNonNull(runManager, "runManager must not be null");
        this.runType = Objects.requireNonNull(runType, "runType must not be null");
    }

    /**
     * Appends a pipe without side-channel inputs.
     */
    public AsyncPipeline addPipe(@NotNull AsyncPipe<?, ?> pipe) {
        return addPipe(pipe, List.of());
    }

    /**
     * Appends a pipe.
     *
     * @param pipe pipe to append; its name must be unique within this pipeline
     * @param upstreamRefs fields to bind from stages added earlier
     * @throws PipelineConfigurationException on a duplicate name or a reference to a stage
     *                                        that was not added before
     */
    @SuppressWarnings("unchecked")
    public synchronized AsyncPipeline addPipe(@NotNull AsyncPipe<?, ?> pipe, @NotNull List<UpstreamRef> upstreamRefs) {
        Objects.requireNonNull(pipe, "pipe must not be null");
        Objects.requireNonNull(upstreamRefs, "upstreamRefs must not be null");
        String name = pipe.getName();
        if (positions.containsKey(name)) {
            throw new PipelineConfigurationException("Pipe name '" + name + "' is already used in this pipeline");
        }
        for (UpstreamRef ref : upstreamRefs) {
            if (!positions.containsKey(ref.fromStage())) {
                throw new PipelineConfigurationException(
                        "Pipe '" + name + "' references stage '" + ref.fromStage() +
                        "', which was not added before it");
            }
        }
        positions.put(name, stages.size());
        stages.add(new Stage((AsyncPipe<Object, Object>) pipe, List.copyOf(upstreamRefs)));
        logger.debug("Added pipe {} at position {} with {} upstream refs", name, stages.size() - 1, upstreamRefs.size());
        return this;
    }

    /**
     * Runs the pipeline and collects its output.
     *
     * @param input items fed to the first pipe
     * @param state state store, or null for a fresh one
     * @param runContext run to join, or null to start a new one
     * @param settings typed settings handed to every pipe
     * @return the output of the last pipe, with nested streams flattened in order
     */
    @NotNull
    public List<Object> run(
            @NotNull Stream<?> input,
            @Nullable AsyncState state,
            @Nullable RunContext runContext,
            @NotNull RunSettings settings) {
        long startTime = System.currentTimeMillis();
        try (RunScope scope = runManager.withRun(runType, runContext)) {
            RunContext context = scope.context();
            try (Stream<Object> output = open(input, state, context, settings)) {
                List<Object> results = new ArrayList<>();
                Iterator<Object> iterator = output.iterator();
                while (iterator.hasNext()) {
                    flatten(iterator.next(), results);
                }
                logger.info("Pipeline run {} completed in {}ms with {} results",
                        context.runId(), System.currentTimeMillis() - startTime, results.size());
                return results;
            } catch (RuntimeException | Error e) {
                logFailure(context, e);
                throw e;
            }
        }
    }

    /**
     * Runs the pipeline for a single input item.
     */
    @NotNull
    public List<Object> run(@NotNull Object input, @Nullable RunContext runContext, @NotNull RunSettings settings) {
        return run(Stream.of(input), null, runContext, settings);
    }

    /**
     * Runs the pipeline lazily.
     *
     * <p>The run scope covers the assembly of the stage chain; items are produced as the
     * returned stream is pulled. Close the stream when abandoning it early so that every
     * started stage is torn down.</p>
     */
    @NotNull
    public Stream<Object> stream(
            @NotNull Stream<?> input,
            @Nullable AsyncState state,
            @Nullable RunContext runContext,
            @NotNull RunSettings settings) {
        try (RunScope scope = runManager.withRun(runType, runContext)) {
            RunContext context = scope.context();
            Stream<Object> output = open(input, state, context, settings);
            Iterator<Object> delegate = output.iterator();
            Iterator<Object> guarded = new Iterator<>() {
                @Override
                public boolean hasNext() {
                    try {
                        return delegate.hasNext();
                    } catch (RuntimeException | Error e) {
                        logFailure(context, e);
                        throw e;
                    }
                }

                @Override
                public Object next() {
                    if (!hasNext()) {
                        throw new NoSuchElementException();
                    }
                    return delegate.next();
                }
            };
            return StreamSupport.stream(Spliterators.spliteratorUnknownSize(guarded, Spliterator.ORDERED), false)
                    .onClose(output::close);
        }
    }

    @NotNull
    public Stream<Object> stream(@NotNull Object input, @Nullable RunContext runContext, @NotNull RunSettings settings) {
        return stream(Stream.of(input), null, runContext, settings);
    }

    /**
     * Returns the names of the configured pipes in pipeline order.
     */
    @NotNull
    public synchronized List<String> getPipeNames() {
        return stages.stream().map(stage -> stage.pipe().getName()).toList();
    }

    public synchronized int size() {
        return stages.size();
    }

    @NotNull
    public RunType getRunType() {
        return runType;
    }

    @NotNull
    protected RunManager getRunManager() {
        return runManager;
    }

    /**
     * Builds the lazy stage chain of one run.
     */
    private Stream<Object> open(
            Stream<?> input,
            @Nullable AsyncState state,
            RunContext context,
            RunSettings settings) {
        List<Stage> snapshot;
        synchronized (this) {
            if (stages.isEmpty()) {
                throw new PipelineConfigurationException("Pipeline has no pipes");
            }
            snapshot = List.copyOf(stages);
        }
        AsyncState runState = state != null ? state : new AsyncState();

        runManager.getLoggingProvider()
                .log(context.runId(), "pipeline_type", getClass().getSimpleName())
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        logger.warn("Failed to log pipeline type for run {}: {}", context.runId(), error.getMessage());
                    }
                });

        Set<String> referenced = snapshot.stream()
                .flatMap(stage -> stage.upstreamRefs().stream())
                .map(UpstreamRef::fromStage)
                .collect(Collectors.toSet());

        Map<String, StageOutput> registry = new LinkedHashMap<>();
        StageOutput previous = new StageOutput("input", () -> input, false);
        List<StageOutput> opened = new ArrayList<>();
        opened.add(previous);

        for (Stage stage : snapshot) {
            StageOutput predecessor = previous;
            String name = stage.pipe().getName();
            StageOutput output = new StageOutput(name,
                    () -> invoke(stage, predecessor, registry, runState, context, settings),
                    referenced.contains(name));
            registry.put(name, output);
            opened.add(output);
            previous = output;
        }

        return previous.stream().onClose(() -> closeAll(opened));
    }

    private Stream<Object> invoke(
            Stage stage,
            StageOutput predecessor,
            Map<String, StageOutput> registry,
            AsyncState state,
            RunContext context,
            RunSettings settings) {
        PipeInput.Builder<Object> builder = PipeInput.builder(predecessor.stream()).settings(settings);

        Map<String, List<UpstreamRef>> bySource = stage.upstreamRefs().stream()
                .collect(Collectors.groupingBy(UpstreamRef::fromStage, LinkedHashMap::new, Collectors.toList()));
        List<String> sources = new ArrayList<>(bySource.keySet());
        sources.sort(Comparator.comparing((String source) -> positions.get(source)).reversed());

        for (String source : sources) {
            StageOutput sourceOutput = registry.get(source);
            int produced = sourceOutput.materialize().size();
            logger.debug("Resolved upstream stage {} for {} ({} items, adjacent={})",
                    source, stage.pipe().getName(), produced, sourceOutput == predecessor);
            for (UpstreamRef ref : bySource.get(source)) {
                Object value;
                try {
                    value = state.read(source, ref.outputField(), MISSING);
                } catch (StageNotFoundException e) {
                    throw new PipelineConfigurationException(
                            "Stage '" + source + "' published nothing for pipe '" + stage.pipe().getName() + "'", e);
                }
                if (value == MISSING) {
                    throw new PipelineConfigurationException(
                            "Field '" + ref.outputField() + "' of stage '" + source +
                            "' was not published for pipe '" + stage.pipe().getName() + "'");
                }
                builder.bindIfAbsent(ref.inputField(), value);
            }
        }

        return stage.pipe().run(builder.build(), state, context);
    }

    private static void flatten(@Nullable Object item, List<Object> results) {
        if (item instanceof Stream<?> nested) {
            try (Stream<?> closing = nested) {
                Iterator<?> iterator = closing.iterator();
                while (iterator.hasNext()) {
                    flatten(iterator.next(), results);
                }
            }
        } else {
            results.add(item);
        }
    }

    private static void closeAll(List<StageOutput> outputs) {
        RuntimeException failure = null;
        for (int i = outputs.size() - 1; i >= 0; i--) {
            try {
                outputs.get(i).close();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private static void logFailure(RunContext context, Throwable e) {
        MDC.put(AsyncPipe.MDC_RUN_ID, context.runId().toString());
        try {
            logger.error("Pipeline failed during run {}: {}", context.runId(), e.getMessage(), e);
        } finally {
            MDC.remove(AsyncPipe.MDC_RUN_ID);
        }
    }

    private record Stage(AsyncPipe<Object, Object> pipe, List<UpstreamRef> upstreamRefs) {}
}
