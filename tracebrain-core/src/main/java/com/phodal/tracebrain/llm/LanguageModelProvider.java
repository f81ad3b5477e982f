package com.phodal.tracebrain.llm;

/**
 * A chat-completion backend used to translate questions and to judge traces.
 *
 * <p>Implementations block until the model answers. Transport and API failures should be
 * reported as {@link com.phodal.tracebrain.error.ProviderException}.</p>
 */
@FunctionalInterface
public interface LanguageModelProvider {

    String complete(String prompt, CompletionOptions options);

    default String name() {
        return getClass().getSimpleName();
    }
}
