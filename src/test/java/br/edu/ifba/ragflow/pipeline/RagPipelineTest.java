package br.edu.ifba.ragflow.pipeline;

import br.edu.ifba.ragflow.config.ExecutorProducer;
import br.edu.ifba.ragflow.logging.InMemoryRunLoggingProvider;
import br.edu.ifba.ragflow.logging.RunManager;
import br.edu.ifba.ragflow.pipe.LambdaPipe;
import br.edu.ifba.ragflow.pipe.RunSettings;
import br.edu.ifba.ragflow.search.VectorSearchResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class RagPipelineTest {

    private ExecutorService executor;
    private InMemoryRunLoggingProvider provider;
    private RunManager runManager;

    @BeforeEach
    void setUp() {
        executor = ExecutorProducer.newPipelineExecutor("test-rag");
        provider = new InMemoryRunLoggingProvider();
        runManager = new RunManager(provider);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static VectorSearchResult hit(Object query) {
        return new VectorSearchResult(UUID.randomUUID(), UUID.randomUUID(), 1.0, "chunk about " + query, Map.of());
    }

    private LambdaPipe<SearchResultPair, String> answerPipe() {
        return new LambdaPipe<>("answer", provider, executor, (input, state, ctx, log) ->
                input.message().map(pair -> pair.query() + ":" +
                        pair.searchResults().vectorSearchResults().orElseThrow().get(0).text()));
    }

    @Test
    @DisplayName("should answer queries in input order even when an earlier search is slower")
    void shouldPreserveQueryOrder() {
        SearchPipeline search = new SearchPipeline(runManager, executor)
                .addVectorSearchPipe(new LambdaPipe<Object, VectorSearchResult>("vector_search", provider, executor,
                        (input, state, ctx, log) -> input.message().map(query -> {
                            if ("q1".equals(query)) {
                                sleep(200);
                            }
                            return hit(query);
                        })));
        RagPipeline rag = new RagPipeline(runManager, executor, search).addRagPipe(answerPipe());

        List<Object> answers = rag.run(Stream.of("q1", "q2", "q3"), null, null, RunSettings.empty());

        assertEquals(List.of("q1:chunk about q1", "q2:chunk about q2", "q3:chunk about q3"), answers);
        assertEquals(0, runManager.activeRuns());
    }

    @Test
    @DisplayName("should run the searches of all queries concurrently")
    void shouldSearchConcurrently() {
        CountDownLatch lastStarted = new CountDownLatch(1);
        SearchPipeline search = new SearchPipeline(runManager, executor)
                .addVectorSearchPipe(new LambdaPipe<Object, VectorSearchResult>("vector_search", provider, executor,
                        (input, state, ctx, log) -> input.message().map(query -> {
                            if ("first".equals(query)) {
                                await(lastStarted);
                            } else {
                                lastStarted.countDown();
                            }
                            return hit(query);
                        })));
        RagPipeline rag = new RagPipeline(runManager, executor, search).addRagPipe(answerPipe());

        List<Object> answers = rag.run(Stream.of("first", "last"), null, null, RunSettings.empty());

        assertEquals(List.of("first:chunk about first", "last:chunk about last"), answers);
    }

    @Test
    @DisplayName("should propagate a search failure to the caller")
    void shouldPropagateSearchFailure() {
        IllegalStateException failure = new IllegalStateException("search failed");
        SearchPipeline search = new SearchPipeline(runManager, executor)
                .addVectorSearchPipe(new LambdaPipe<Object, VectorSearchResult>("vector_search", provider, executor,
                        (input, state, ctx, log) -> input.message().map(query -> {
                            if ("bad".equals(query)) {
                                throw failure;
                            }
                            return hit(query);
                        })));
        RagPipeline rag = new RagPipeline(runManager, executor, search).addRagPipe(answerPipe());

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> rag.run(Stream.of("good", "bad"), null, null, RunSettings.empty()));

        assertSame(failure, thrown);
    }

    @Test
    @DisplayName("should stream answers lazily")
    void shouldStreamAnswers() {
        SearchPipeline search = new SearchPipeline(runManager, executor)
                .addVectorSearchPipe(new LambdaPipe<Object, VectorSearchResult>("vector_search", provider, executor,
                        (input, state, ctx, log) -> input.message().map(RagPipelineTest::hit)));
        LambdaPipe<SearchResultPair, String> answer = answerPipe();
        RagPipeline rag = new RagPipeline(runManager, executor, search).addRagPipe(answer);

        try (Stream<Object> answers = rag.stream(Stream.of("q"), null, null, RunSettings.empty())) {
            assertEquals(0, answer.invocations());
            assertEquals(List.of("q:chunk about q"), answers.toList());
        }
    }

    @Test
    @DisplayName("should interrupt running searches when the stream is closed early")
    void shouldInterruptSearchesOnClose() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);
        CountDownLatch interrupted = new CountDownLatch(2);
        SearchPipeline search = new SearchPipeline(runManager, executor)
                .addVectorSearchPipe(new LambdaPipe<Object, VectorSearchResult>("vector_search", provider, executor,
                        (input, state, ctx, log) -> input.message().map(query -> {
                            bothStarted.countDown();
                            try {
                                Thread.sleep(10_000);
                            } catch (InterruptedException e) {
                                interrupted.countDown();
                                Thread.currentThread().interrupt();
                                throw new IllegalStateException("search interrupted", e);
                            }
                            return hit(query);
                        })));
        RagPipeline rag = new RagPipeline(runManager, executor, search).addRagPipe(answerPipe());

        Stream<Object> answers = rag.stream(Stream.of("q1", "q2"), null, null, RunSettings.empty());
        Future<Boolean> puller = executor.submit(() -> answers.iterator().hasNext());
        assertTrue(bothStarted.await(5, TimeUnit.SECONDS));

        answers.close();

        assertTrue(interrupted.await(5, TimeUnit.SECONDS), "searches kept running after close");
        assertThrows(ExecutionException.class, () -> puller.get(5, TimeUnit.SECONDS));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("searches did not run concurrently");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
