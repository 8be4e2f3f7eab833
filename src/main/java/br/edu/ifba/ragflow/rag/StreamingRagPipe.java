package br.edu.ifba.ragflow.rag;

import br.edu.ifba.ragflow.llm.GenerationConfig;
import br.edu.ifba.ragflow.llm.LLMProvider;
import br.edu.ifba.ragflow.llm.Message;
import br.edu.ifba.ragflow.logging.RunContext;
import br.edu.ifba.ragflow.logging.RunLoggingProvider;
import br.edu.ifba.ragflow.pipe.AsyncPipe;
import br.edu.ifba.ragflow.pipe.PipeConfig;
import br.edu.ifba.ragflow.pipe.PipeInput;
import br.edu.ifba.ragflow.pipe.PipeLogChannel;
import br.edu.ifba.ragflow.pipeline.SearchResultPair;
import br.edu.ifba.ragflow.state.AsyncState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ExecutorService;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Streams the answer of every {@link SearchResultPair} as marker-delimited text chunks.
 *
 * <p>Per query the pipe yields:</p>
 * <pre>
 * &lt;search&gt;
 * {"vector_search_results": [...], "kg_search_results": [...]}
 * &lt;/search&gt;
 * &lt;completion&gt;
 * ...completion chunks...
 * &lt;/completion&gt;
 * </pre>
 *
 * <p>The completion is requested only when the consumer reaches it, and each chunk is
 * handed out as soon as the provider yields it.</p>
 */
public class StreamingRagPipe extends AsyncPipe<SearchResultPair, String> {

    public static final String DEFAULT_NAME = "streaming_rag";

    public static final String SEARCH_STREAM_MARKER = "search";
    public static final String COMPLETION_STREAM_MARKER = "completion";

    private static final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private final LLMProvider llmProvider;
    private final RagPrompts prompts;
    private final ContextFormatter contextFormatter;

    public StreamingRagPipe(
            @NotNull PipeConfig config,
            @NotNull LLMProvider llmProvider,
            @NotNull RagPrompts prompts,
            @NotNull RunLoggingProvider loggingProvider,
            @NotNull ExecutorService executor) {
        super(config, loggingProvider, executor);
        this.llmProvider = Objects.requireNonNull(llmProvider, "llmProvider must not be null");
        this.prompts = Objects.requireNonNull(prompts, "prompts must not be null");
        this.contextFormatter = new ContextFormatter(prompts.maxContextTokens());
    }

    @Override
    protected Stream<String> logic(
            @NotNull PipeInput<SearchResultPair> input,
            @NotNull AsyncState state,
            @NotNull RunContext runContext,
            @NotNull PipeLogChannel log) {
        GenerationConfig generationConfig = input.settings()
                .getOrDefault(GenerationConfig.class, GenerationConfig::defaults)
                .withStream(true);

        ChunkIterator chunks = new ChunkIterator(input.message().iterator(), generationConfig, log);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(chunks, Spliterator.ORDERED), false)
                .onClose(chunks::release);
    }

    private static String open(String marker) {
        return "<" + marker + ">";
    }

    private static String close(String marker) {
        return "</" + marker + ">";
    }

    private static String toJson(SearchResultPair pair) {
        try {
            return objectMapper.writeValueAsString(pair.searchResults().toMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize search results for query: " + pair.query(), e);
        }
    }

    /**
     * Emits the chunks of one pair at a time. The completion of a pair is requested once its
     * opening marker has been consumed and is closed when it ends.
     */
    private final class ChunkIterator implements Iterator<String> {

        private final Iterator<SearchResultPair> pairs;
        private final GenerationConfig generationConfig;
        private final PipeLogChannel log;

        private Iterator<String> current = Collections.emptyIterator();
        @Nullable
        private SearchResultPair pair;
        private int segment;
        @Nullable
        private Stream<String> completion;

        ChunkIterator(Iterator<SearchResultPair> pairs, GenerationConfig generationConfig, PipeLogChannel log) {
            this.pairs = pairs;
            this.generationConfig = generationConfig;
            this.log = log;
        }

        @Override
        public boolean hasNext() {
            while (!current.hasNext()) {
                if (!advance()) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }

        private boolean advance() {
            if (pair == null || segment == 3) {
                closeCompletion();
                if (!pairs.hasNext()) {
                    return false;
                }
                pair = pairs.next();
                segment = 0;
            }
            switch (segment++) {
                case 0 -> current = List.of(
                        open(SEARCH_STREAM_MARKER),
                        toJson(pair),
                        close(SEARCH_STREAM_MARKER),
                        open(COMPLETION_STREAM_MARKER)).iterator();
                case 1 -> {
                    String context = contextFormatter.format(pair.searchResults());
                    List<Message> messages = prompts.toMessages(pair.query(), context);
                    log.log("search_query", pair.query());
                    completion = llmProvider.completeStream(messages, generationConfig);
                    current = completion.iterator();
                }
                default -> {
                    closeCompletion();
                    current = List.of(close(COMPLETION_STREAM_MARKER)).iterator();
                }
            }
            return true;
        }

        private void closeCompletion() {
            if (completion != null) {
                Stream<String> closing = completion;
                completion = null;
                closing.close();
            }
        }

        void release() {
            closeCompletion();
        }
    }
}
