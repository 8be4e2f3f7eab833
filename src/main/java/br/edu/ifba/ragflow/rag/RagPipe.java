package br.edu.ifba.ragflow.rag;

import br.edu.ifba.ragflow.llm.GenerationConfig;
import br.edu.ifba.ragflow.llm.LLMCompletion;
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
import br.edu.ifba.ragflow.utils.FutureUtil;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.stream.Stream;

/**
 * Generates one answer per {@link SearchResultPair}.
 *
 * <p>The search results are formatted into a numbered context, wrapped into the configured
 * prompts and sent to the {@link LLMProvider}. The generation parameters come from the
 * run's {@link GenerationConfig} setting, or its defaults.</p>
 */
public class RagPipe extends AsyncPipe<SearchResultPair, RagResponse> {

    private static final Logger logger = LoggerFactory.getLogger(RagPipe.class);

    public static final String DEFAULT_NAME = "rag";

    private final LLMProvider llmProvider;
    private final RagPrompts prompts;
    private final ContextFormatter contextFormatter;

    public RagPipe(
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
    protected Stream<RagResponse> logic(
            @NotNull PipeInput<SearchResultPair> input,
            @NotNull AsyncState state,
            @NotNull RunContext runContext,
            @NotNull PipeLogChannel log) {
        GenerationConfig generationConfig = input.settings()
                .getOrDefault(GenerationConfig.class, GenerationConfig::defaults)
                .withStream(false);

        return input.message().map(pair -> {
            String context = contextFormatter.format(pair.searchResults());
            List<Message> messages = prompts.toMessages(pair.query(), context);
            long start = System.currentTimeMillis();
            LLMCompletion completion = FutureUtil.await(llmProvider.complete(messages, generationConfig));
            logger.debug("Generated answer for run {} in {}ms ({} tokens)",
                    runContext.runId(), System.currentTimeMillis() - start, completion.totalTokens());
            log.log("llm_response", completion.content());
            state.publish(getName(), Map.of("completion", completion));
            return new RagResponse(pair.query(), completion, pair.searchResults());
        });
    }
}
