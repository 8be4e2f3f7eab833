package br.edu.ifba.ragflow.rag;

import br.edu.ifba.ragflow.llm.Message;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Prompts and context budget of the generation pipes.
 *
 * @param systemPrompt system message sent first
 * @param taskPrompt user message template with {@value #QUERY_PLACEHOLDER} and
 *                   {@value #CONTEXT_PLACEHOLDER} placeholders
 * @param maxContextTokens token budget of the formatted search context
 */
public record RagPrompts(
        @NotNull String systemPrompt,
        @NotNull String taskPrompt,
        int maxContextTokens
) {
    public static final String QUERY_PLACEHOLDER = "{query}";
    public static final String CONTEXT_PLACEHOLDER = "{context}";

    public static final String DEFAULT_SYSTEM_PROMPT = "You are a helpful assistant.";
    public static final String DEFAULT_TASK_PROMPT = """
            ## Task:
            Answer the query given immediately below given the context which follows later. \
            Use line item references like [1], [2], ... to refer to specifically numbered items \
            in the provided context. If the context does not contain the answer, say so.

            ### Query:
            {query}

            ### Context:
            {context}

            ## Response:
            """;
    public static final int DEFAULT_MAX_CONTEXT_TOKENS = 4000;

    public RagPrompts {
        Objects.requireNonNull(systemPrompt, "systemPrompt must not be null");
        Objects.requireNonNull(taskPrompt, "taskPrompt must not be null");
        if (maxContextTokens < 1) {
            throw new IllegalArgumentException("maxContextTokens must be positive, got " + maxContextTokens);
        }
    }

    @NotNull
    public static RagPrompts defaults() {
        return new RagPrompts(DEFAULT_SYSTEM_PROMPT, DEFAULT_TASK_PROMPT, DEFAULT_MAX_CONTEXT_TOKENS);
    }

    /**
     * Fills the task prompt.
     */
    @NotNull
    public String renderTask(@NotNull String query, @NotNull String context) {
        return taskPrompt
                .replace(QUERY_PLACEHOLDER, query)
                .replace(CONTEXT_PLACEHOLDER, context);
    }

    /**
     * Builds the system and user messages for one query.
     */
    @NotNull
    public List<Message> toMessages(@NotNull String query, @NotNull String context) {
        return List.of(Message.system(systemPrompt), Message.user(renderTask(query, context)));
    }
}
