package br.edu.ifba.ragflow.pipeline;

import br.edu.ifba.ragflow.config.ExecutorProducer;
import br.edu.ifba.ragflow.logging.InMemoryRunLoggingProvider;
import br.edu.ifba.ragflow.logging.RunContext;
import br.edu.ifba.ragflow.logging.RunLogEntry;
import br.edu.ifba.ragflow.logging.RunManager;
import br.edu.ifba.ragflow.logging.RunType;
import br.edu.ifba.ragflow.pipe.LambdaPipe;
import br.edu.ifba.ragflow.pipe.RunSettings;
import br.edu.ifba.ragflow.state.AsyncState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class AsyncPipelineTest {

    private ExecutorService executor;
    private InMemoryRunLoggingProvider provider;
    private RunManager runManager;

    @BeforeEach
    void setUp() {
        executor = ExecutorProducer.newPipelineExecutor("test-pipeline");
        provider = new InMemoryRunLoggingProvider();
        runManager = new RunManager(provider);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private LambdaPipe<Object, Object> scorePipe(String name, int factor) {
        return new LambdaPipe<>(name, provider, executor, (input, state, ctx, log) ->
                input.message().map(item -> {
                    int value = (Integer) item;
                    state.publish(name, Map.of("score", value * factor));
                    return item;
                }));
    }

    private LambdaPipe<Object, Object> passThrough(String name) {
        return new LambdaPipe<>(name, provider, executor, (input, state, ctx, log) -> input.message());
    }

    private LambdaPipe<Object, Object> sumPipe(String name, String field) {
        return new LambdaPipe<>(name, provider, executor, (input, state, ctx, log) -> {
            int addend = input.requireField(field, Integer.class);
            return input.message().map(item -> (Object) ((Integer) item + addend));
        });
    }

    @Nested
    @DisplayName("upstream references")
    class UpstreamReferences {

        @Test
        @DisplayName("should bind a field published by an earlier stage")
        void shouldBindUpstreamField() {
            LambdaPipe<Object, Object> score = scorePipe("score", 2);
            AsyncPipeline pipeline = new AsyncPipeline(runManager)
                    .addPipe(score)
                    .addPipe(passThrough("pass"))
                    .addPipe(sumPipe("sum", "score"), List.of(new UpstreamRef("score", "score", "score")));

            List<Object> results = pipeline.run(Stream.of(5), null, null, RunSettings.empty());

            assertEquals(List.of(15), results);
            assertEquals(1, score.invocations());
        }

        @Test
        @DisplayName("should bind from the adjacent stage without running it twice")
        void shouldSpliceAdjacentStage() {
            LambdaPipe<Object, Object> score = scorePipe("score", 3);
            AsyncPipeline pipeline = new AsyncPipeline(runManager)
                    .addPipe(score)
                    .addPipe(sumPipe("sum", "bonus"), List.of(new UpstreamRef("score", "bonus", "score")));

            assertEquals(List.of(8), pipeline.run(Stream.of(2), null, null, RunSettings.empty()));
            assertEquals(1, score.invocations());
        }

        @Test
        @DisplayName("should prefer the later stage when two stages feed the same field")
        void shouldPreferLaterStage() {
            AsyncPipeline pipeline = new AsyncPipeline(runManager)
                    .addPipe(scorePipe("first", 10))
                    .addPipe(scorePipe("second", 100))
                    .addPipe(sumPipe("sum", "score"), List.of(
                            new UpstreamRef("first", "score", "score"),
                            new UpstreamRef("second", "score", "score")));

            assertEquals(List.of(101), pipeline.run(Stream.of(1), null, null, RunSettings.empty()));
        }

        @Test
        @DisplayName("should fail when the referenced field was never published")
        void shouldFailOnMissingField() {
            AsyncPipeline pipeline = new AsyncPipeline(runManager)
                    .addPipe(passThrough("silent"))
                    .addPipe(sumPipe("sum", "score"), List.of(UpstreamRef.of("silent", "score")));

            assertThrows(PipelineConfigurationException.class,
                    () -> pipeline.run(Stream.of(1), null, null, RunSettings.empty()));
        }

        @Test
        @DisplayName("should fail when a published stage lacks the referenced field")
        void shouldFailOnUnpublishedField() {
            AsyncPipeline pipeline = new AsyncPipeline(runManager)
                    .addPipe(scorePipe("score", 1))
                    .addPipe(sumPipe("sum", "other"), List.of(UpstreamRef.of("score", "other")));

            PipelineConfigurationException e = assertThrows(PipelineConfigurationException.class,
                    () -> pipeline.run(Stream.of(1), null, null, RunSettings.empty()));
            assertTrue(e.getMessage().contains("other"));
        }
    }

    @Nested
    @DisplayName("configuration")
    class Configuration {

        @Test
        @DisplayName("should reject duplicate pipe names")
        void shouldRejectDuplicateNames() {
            AsyncPipeline pipeline = new AsyncPipeline(runManager).addPipe(passThrough("same"));

            assertThrows(PipelineConfigurationException.class, () -> pipeline.addPipe(passThrough("same")));
            assertEquals(List.of("same"), pipeline.getPipeNames());
        }

        @Test
        @DisplayName("should reject references to stages that were not added before")
        void shouldRejectUnknownReference() {
            AsyncPipeline pipeline = new AsyncPipeline(runManager).addPipe(passThrough("first"));

            assertThrows(PipelineConfigurationException.class,
                    () -> pipeline.addPipe(passThrough("second"), List.of(UpstreamRef.of("later", "x"))));
            assertEquals(1, pipeline.size());
        }

        @Test
        @DisplayName("should refuse to run without pipes")
        void shouldRejectEmptyPipeline() {
            AsyncPipeline pipeline = new AsyncPipeline(runManager);

            assertThrows(PipelineConfigurationException.class,
                    () -> pipeline.run(Stream.of(1), null, null, RunSettings.empty()));
            assertEquals(0, runManager.activeRuns());
        }
    }

    @Test
    @DisplayName("should flatten nested streams in order")
    void shouldFlattenNestedStreams() {
        AsyncPipeline pipeline = new AsyncPipeline(runManager)
                .addPipe(new LambdaPipe<Object, Object>("nested", provider, executor, (input, state, ctx, log) ->
                        input.message().map(item -> (Object) Stream.of(item, Stream.of("x", "y")))));

        assertEquals(List.of(1, "x", "y", 2, "x", "y"),
                pipeline.run(Stream.of(1, 2), null, null, RunSettings.empty()));
    }

    @Test
    @DisplayName("should propagate the original failure and release the run")
    void shouldPropagateFailure() {
        IllegalStateException failure = new IllegalStateException("stage failed");
        AsyncPipeline pipeline = new AsyncPipeline(runManager)
                .addPipe(passThrough("first"))
                .addPipe(new LambdaPipe<Object, Object>("failing", provider, executor, (input, state, ctx, log) ->
                        input.message().map(item -> {
                            throw failure;
                        })));

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> pipeline.run(Stream.of(1), null, null, RunSettings.empty()));

        assertSame(failure, thrown);
        assertEquals(0, runManager.activeRuns());
    }

    @Test
    @DisplayName("should join the caller's run and record the pipeline type")
    void shouldJoinCallerRun() throws Exception {
        RunContext context = new RunContext(UUID.randomUUID(), RunType.INGESTION);
        AsyncState state = new AsyncState();
        AsyncPipeline pipeline = new AsyncPipeline(runManager).addPipe(scorePipe("score", 1));

        pipeline.run(Stream.of(4), state, context, RunSettings.empty());

        assertEquals(4, state.read("score", "score"));
        List<RunLogEntry> logs = provider.getLogs(List.of(context.runId()), 10).get();
        assertTrue(logs.stream().anyMatch(entry ->
                entry.key().equals("pipeline_type") && entry.value().equals("AsyncPipeline")));
    }

    @Nested
    @DisplayName("stream")
    class Streaming {

        @Test
        @DisplayName("should produce items only as they are pulled")
        void shouldBeLazy() {
            AtomicInteger produced = new AtomicInteger();
            AsyncPipeline pipeline = new AsyncPipeline(runManager)
                    .addPipe(new LambdaPipe<Object, Object>("counting", provider, executor, (input, state, ctx, log) ->
                            input.message().peek(item -> produced.incrementAndGet())));

            try (Stream<Object> output = pipeline.stream(Stream.iterate(0, i -> i + 1), null, null, RunSettings.empty())) {
                Iterator<Object> iterator = output.iterator();
                assertEquals(0, iterator.next());
                assertEquals(1, iterator.next());
            }

            assertEquals(2, produced.get());
        }

        @Test
        @DisplayName("should tear down every started pipe when closed early")
        void shouldTearDownOnClose() {
            LambdaPipe<Object, Object> first = passThrough("first");
            LambdaPipe<Object, Object> second = passThrough("second");
            AsyncPipeline pipeline = new AsyncPipeline(runManager).addPipe(first).addPipe(second);

            try (Stream<Object> output = pipeline.stream(Stream.iterate(0, i -> i + 1), null, null, RunSettings.empty())) {
                output.iterator().next();
            }

            assertTrue(first.channels().get(0).isClosed());
            assertTrue(second.channels().get(0).isClosed());
        }
    }
}
