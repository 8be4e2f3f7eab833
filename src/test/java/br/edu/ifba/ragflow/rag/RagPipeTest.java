package br.edu.ifba.ragflow.rag;

import br.edu.ifba.ragflow.config.ExecutorProducer;
import br.edu.ifba.ragflow.llm.GenerationConfig;
import br.edu.ifba.ragflow.llm.LLMCompletion;
import br.edu.ifba.ragflow.llm.LLMProvider;
import br.edu.ifba.ragflow.llm.Message;
import br.edu.ifba.ragflow.logging.InMemoryRunLoggingProvider;
import br.edu.ifba.ragflow.logging.RunContext;
import br.edu.ifba.ragflow.logging.RunType;
import br.edu.ifba.ragflow.pipe.PipeConfig;
import br.edu.ifba.ragflow.pipe.PipeInput;
import br.edu.ifba.ragflow.pipe.RunSettings;
import br.edu.ifba.ragflow.pipeline.AggregateSearchResult;
import br.edu.ifba.ragflow.pipeline.SearchResultPair;
import br.edu.ifba.ragflow.state.AsyncState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RagPipeTest {

    private ExecutorService executor;
    private LLMProvider llmProvider;
    private RagPipe pipe;

    @BeforeEach
    void setUp() {
        executor = ExecutorProducer.newPipelineExecutor("test-rag-pipe");
        llmProvider = mock(LLMProvider.class);
        pipe = new RagPipe(PipeConfig.of(RagPipe.DEFAULT_NAME), llmProvider,
                new RagPrompts("system", "{query} | {context}", 1000), new InMemoryRunLoggingProvider(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static SearchResultPair pair(String query, String chunk) {
        return new SearchResultPair(query,
                new AggregateSearchResult(List.of(ContextFormatterTest.chunk(chunk)), null));
    }

    @Test
    @DisplayName("should generate one answer per search result pair")
    @SuppressWarnings("unchecked")
    void shouldGenerateAnswers() {
        when(llmProvider.complete(anyList(), any(GenerationConfig.class)))
                .thenReturn(CompletableFuture.completedFuture(LLMCompletion.of("Paris [1]", "gpt-4o")));
        AsyncState state = new AsyncState();
        GenerationConfig config = new GenerationConfig("small-model", 0.5, 1.0, 256, true);

        List<RagResponse> responses = pipe.run(
                PipeInput.builder(Stream.of(pair("capital of France?", "Paris is the capital of France.")))
                        .settings(RunSettings.of(config))
                        .build(),
                state, new RunContext(UUID.randomUUID(), RunType.RETRIEVAL)).toList();

        assertEquals(1, responses.size());
        assertEquals("Paris [1]", responses.get(0).answer());
        assertEquals("capital of France?", responses.get(0).query());

        ArgumentCaptor<List<Message>> messages = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<GenerationConfig> used = ArgumentCaptor.forClass(GenerationConfig.class);
        verify(llmProvider).complete(messages.capture(), used.capture());
        assertEquals("capital of France? | Vector Search Results:\nSource [1]:\nParis is the capital of France.",
                messages.getValue().get(1).content());
        assertEquals("small-model", used.getValue().model());
        assertFalse(used.getValue().stream());
        assertEquals(LLMCompletion.of("Paris [1]", "gpt-4o"), state.read(RagPipe.DEFAULT_NAME, "completion"));
    }

    @Test
    @DisplayName("should surface provider failures unwrapped")
    void shouldPropagateProviderFailure() {
        IllegalStateException failure = new IllegalStateException("rate limited");
        when(llmProvider.complete(anyList(), any(GenerationConfig.class)))
                .thenReturn(CompletableFuture.failedFuture(failure));

        Stream<RagResponse> output = pipe.run(PipeInput.of(Stream.of(pair("q", "c"))), new AsyncState(),
                new RunContext(UUID.randomUUID(), RunType.RETRIEVAL));

        assertSame(failure, assertThrows(IllegalStateException.class, output::toList));
    }
}
