package br.edu.ifba.ragflow.config;

import br.edu.ifba.ragflow.rag.RagPrompts;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

/**
 * Runtime configuration of the pipelines.
 *
 * <p>All properties are read from application.properties with the prefix "ragflow".</p>
 *
 * <h2>Example Configuration:</h2>
 * <pre>{@code
 * ragflow.pipe.max-log-queue-size=100
 * ragflow.search.branch-queue-size=100
 * ragflow.executor.name-prefix=ragflow-pipeline
 * ragflow.rag.system-prompt=You are a helpful assistant.
 * ragflow.rag.task-prompt=Answer {query} using {context}
 * ragflow.rag.max-context-tokens=4000
 * }</pre>
 */
@ConfigMapping(prefix = "ragflow")
public interface RagFlowConfig {

    /**
     * Pipe configuration group.
     *
     * @return pipe configuration
     */
    Pipe pipe();

    /**
     * Search fan-out configuration group.
     *
     * @return search configuration
     */
    Search search();

    /**
     * Shared executor configuration group.
     *
     * @return executor configuration
     */
    Executor executor();

    /**
     * Generation configuration group.
     *
     * @return generation configuration
     */
    Rag rag();

    /**
     * Validates configuration at startup.
     * Throws IllegalArgumentException if invalid.
     */
    default void validate() {
        if (pipe().maxLogQueueSize() < 1) {
            throw new IllegalArgumentException(
                String.format("Pipe max log queue size must be positive, got %d", pipe().maxLogQueueSize())
            );
        }
        if (search().branchQueueSize() < 1) {
            throw new IllegalArgumentException(
                String.format("Search branch queue size must be positive, got %d", search().branchQueueSize())
            );
        }
        if (rag().maxContextTokens() < 1) {
            throw new IllegalArgumentException(
                String.format("RAG max context tokens must be positive, got %d", rag().maxContextTokens())
            );
        }
        if (executor().namePrefix().isBlank()) {
            throw new IllegalArgumentException("Executor name prefix must not be blank");
        }
    }

    /**
     * Builds the generation prompts, falling back to the built-in prompts.
     */
    default RagPrompts toRagPrompts() {
        return new RagPrompts(
            rag().systemPrompt().orElse(RagPrompts.DEFAULT_SYSTEM_PROMPT),
            rag().taskPrompt().orElse(RagPrompts.DEFAULT_TASK_PROMPT),
            rag().maxContextTokens()
        );
    }

    interface Pipe {

        /**
         * Capacity of the per-invocation log queue; entries beyond it are dropped.
         *
         * @return max log queue size, default 100
         */
        @WithName("max-log-queue-size")
        @WithDefault("100")
        int maxLogQueueSize();
    }

    interface Search {

        /**
         * Capacity of each branch queue of the search fan-out.
         *
         * @return branch queue size, default 100
         */
        @WithName("branch-queue-size")
        @WithDefault("100")
        int branchQueueSize();
    }

    interface Executor {

        /**
         * @return thread name prefix, default "ragflow-pipeline"
         */
        @WithName("name-prefix")
        @WithDefault("ragflow-pipeline")
        String namePrefix();
    }

    interface Rag {

        @WithName("system-prompt")
        Optional<String> systemPrompt();

        /**
         * User message template; {query} and {context} are replaced per query.
         */
        @WithName("task-prompt")
        Optional<String> taskPrompt();

        /**
         * @return max context tokens, default 4000
         */
        @WithName("max-context-tokens")
        @WithDefault("4000")
        int maxContextTokens();
    }
}
