package com.phodal.tracebrain.llm;

/**
 * Per-call settings passed to a {@link LanguageModelProvider}.
 *
 * @param model model override, {@code null} for the provider default
 * @param systemPrompt instructions sent ahead of the prompt
 * @param temperature sampling temperature, {@code null} for the provider default
 * @param maxTokens completion budget, {@code null} for the provider default
 * @param jsonResponse ask the provider for a bare JSON object when it supports it
 */
public record CompletionOptions(
    String model,
    String systemPrompt,
    Double temperature,
    Integer maxTokens,
    boolean jsonResponse
) {

    public static CompletionOptions json(String systemPrompt) {
        return new CompletionOptions(null, systemPrompt, 0.0, null, true);
    }

    public CompletionOptions withSampling(Double temperature, Integer maxTokens) {
        return new CompletionOptions(model, systemPrompt, temperature, maxTokens, jsonResponse);
    }

    public CompletionOptions withModel(String model) {
        return new CompletionOptions(model, systemPrompt, temperature, maxTokens, jsonResponse);
    }
}
