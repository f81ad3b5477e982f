package com.phodal.tracebrain.query;

import com.phodal.tracebrain.error.DeadlineExceededException;
import com.phodal.tracebrain.error.ProviderException;
import com.phodal.tracebrain.error.TranslationFailedException;
import com.phodal.tracebrain.error.ValidationException;
import com.phodal.tracebrain.llm.CompletionOptions;
import com.phodal.tracebrain.llm.LanguageModelProvider;
import com.phodal.tracebrain.llm.ModelInvoker;
import com.phodal.tracebrain.store.Deadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a natural-language question into a {@link StructuredQuery} with the help of a language model.
 *
 * <p>The model only ever proposes a query; it is parsed against the closed grammar and never
 * executed as free text. Bad answers are retried by the {@link ModelInvoker}; when every attempt
 * fails the question is answered with {@link TranslationFailedException}.</p>
 */
public class QueryTranslator {
    private static final Logger log = LoggerFactory.getLogger(QueryTranslator.class);

    static final String SYSTEM_PROMPT = """
        You translate questions about recorded AI agent traces into one JSON object.
        Answer with the JSON object only, no prose.

        Keys:
          "action": one of "list_traces", "get_trace", "episode_traces", "stats", "tool_usage" (required)
          "filter": optional object with any of
              "status": "running" | "completed" | "needs_review" | "failed"
              "error_type": "none" | "tool_error" | "logic_loop" | "hallucination" | "invalid_format"
                            | "misinterpretation" | "context_overflow" | "timeout"
              "min_rating": integer 1..5 (latest human feedback rating)
              "min_confidence", "max_confidence": number 0..1 (AI evaluation confidence)
              "start_time", "end_time": ISO-8601 instants such as "2024-05-01T00:00:00Z"
              "prompt_contains": keyword searched case-insensitively in the agent's system prompt
          "trace_id": string, required for "get_trace"
          "episode_id": string, required for "episode_traces"
          "limit": integer 1..100

        Use no other keys.
        """;

    private final LanguageModelProvider provider;
    private final ModelInvoker invoker;
    private final StructuredQueryParser parser;
    private final CompletionOptions options;

    /**
     * @param provider model backend, {@code null} when none is configured
     */
    public QueryTranslator(LanguageModelProvider provider, ModelInvoker invoker) {
        this(provider, invoker, new StructuredQueryParser(), defaultOptions());
    }

    public QueryTranslator(LanguageModelProvider provider, ModelInvoker invoker,
                           StructuredQueryParser parser, CompletionOptions options) {
        this.provider = provider;
        this.invoker = invoker;
        this.parser = parser;
        this.options = options;
    }

    public static CompletionOptions defaultOptions() {
        return CompletionOptions.json(SYSTEM_PROMPT);
    }

    public boolean isEnabled() {
        return provider != null;
    }

    public StructuredQuery translate(String question) {
        return translate(question, Deadline.none());
    }

    /**
     * @throws DeadlineExceededException when no usable answer arrived before {@code deadline}
     */
    public StructuredQuery translate(String question, Deadline deadline) {
        if (question == null || question.isBlank()) {
            throw new ValidationException("query must not be blank");
        }
        if (provider == null) {
            throw new TranslationFailedException("No language model provider is configured");
        }
        try {
            StructuredQuery query = invoker.invoke("query translation", provider, question, options, parser::parse, deadline);
            log.debug("Translated '{}' to {}", question, query);
            return query;
        } catch (ProviderException e) {
            throw new TranslationFailedException("Could not translate question: " + e.getMessage(), e);
        }
    }
}
