package br.edu.ifba.ragflow.config;

import br.edu.ifba.ragflow.embedding.EmbeddingFunction;
import br.edu.ifba.ragflow.llm.LLMProvider;
import br.edu.ifba.ragflow.logging.RunLoggingProvider;
import br.edu.ifba.ragflow.logging.RunManager;
import br.edu.ifba.ragflow.logging.RunType;
import br.edu.ifba.ragflow.pipe.PipeConfig;
import br.edu.ifba.ragflow.pipeline.AsyncPipeline;
import br.edu.ifba.ragflow.pipeline.RagPipeline;
import br.edu.ifba.ragflow.pipeline.SearchPipeline;
import br.edu.ifba.ragflow.rag.RagPipe;
import br.edu.ifba.ragflow.rag.StreamingRagPipe;
import br.edu.ifba.ragflow.search.KGSearchPipe;
import br.edu.ifba.ragflow.search.KGSearchProvider;
import br.edu.ifba.ragflow.search.VectorSearchPipe;
import br.edu.ifba.ragflow.search.VectorSearchProvider;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;

/**
 * Assembles pipes and pipelines from providers and configuration.
 *
 * <p>Providers are passed in by the caller, so the factory does not require an
 * embedding, search or LLM bean to exist.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * SearchPipeline search = factory.searchPipeline(embeddingFunction, vectorProvider, kgProvider);
 * RagPipeline rag = factory.ragPipeline(search, llmProvider);
 * }</pre>
 */
@ApplicationScoped
public class PipelineFactory {

    private static final Logger logger = LoggerFactory.getLogger(PipelineFactory.class);

    private final RagFlowConfig config;
    private final RunManager runManager;
    private final RunLoggingProvider loggingProvider;
    private final ExecutorService executor;

    @Inject
    public PipelineFactory(
            RagFlowConfig config,
            RunManager runManager,
            RunLoggingProvider loggingProvider,
            @Named(ExecutorProducer.PIPELINE_EXECUTOR) ExecutorService executor) {
        config.validate();
        this.config = config;
        this.runManager = runManager;
        this.loggingProvider = loggingProvider;
        this.executor = executor;
    }

    /**
     * Creates a pipe config with the configured log queue size.
     */
    @NotNull
    public PipeConfig pipeConfig(@NotNull String name) {
        return new PipeConfig(name, config.pipe().maxLogQueueSize());
    }

    @NotNull
    public AsyncPipeline pipeline(@NotNull RunType runType) {
        return new AsyncPipeline(runManager, runType);
    }

    @NotNull
    public VectorSearchPipe vectorSearchPipe(
            @NotNull EmbeddingFunction embeddingFunction,
            @NotNull VectorSearchProvider searchProvider) {
        return new VectorSearchPipe(pipeConfig(VectorSearchPipe.DEFAULT_NAME),
                embeddingFunction, searchProvider, loggingProvider, executor);
    }

    @NotNull
    public KGSearchPipe kgSearchPipe(@NotNull KGSearchProvider searchProvider) {
        return new KGSearchPipe(pipeConfig(KGSearchPipe.DEFAULT_NAME), searchProvider, loggingProvider, executor);
    }

    /**
     * Creates a search pipeline with a vector branch and, when a KG provider is given, a KG branch.
     */
    @NotNull
    public SearchPipeline searchPipeline(
            @NotNull EmbeddingFunction embeddingFunction,
            @NotNull VectorSearchProvider vectorSearchProvider,
            @Nullable KGSearchProvider kgSearchProvider) {
        SearchPipeline pipeline = new SearchPipeline(runManager, executor, config.search().branchQueueSize());
        pipeline.addVectorSearchPipe(vectorSearchPipe(embeddingFunction, vectorSearchProvider));
        if (kgSearchProvider != null) {
            pipeline.addKGSearchPipe(kgSearchPipe(kgSearchProvider));
        }
        logger.debug("Assembled search pipeline (kg branch: {})", kgSearchProvider != null);
        return pipeline;
    }

    @NotNull
    public RagPipeline ragPipeline(@NotNull SearchPipeline searchPipeline, @NotNull LLMProvider llmProvider) {
        RagPipe ragPipe = new RagPipe(pipeConfig(RagPipe.DEFAULT_NAME),
                llmProvider, config.toRagPrompts(), loggingProvider, executor);
        return new RagPipeline(runManager, executor, searchPipeline).addRagPipe(ragPipe);
    }

    @NotNull
    public RagPipeline streamingRagPipeline(@NotNull SearchPipeline searchPipeline, @NotNull LLMProvider llmProvider) {
        StreamingRagPipe ragPipe = new StreamingRagPipe(pipeConfig(StreamingRagPipe.DEFAULT_NAME),
                llmProvider, config.toRagPrompts(), loggingProvider, executor);
        return new RagPipeline(runManager, executor, searchPipeline).addRagPipe(ragPipe);
    }
}
