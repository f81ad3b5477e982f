package com.phodal.tracebrain.server.llm;

import com.phodal.tracebrain.error.ProviderException;
import com.phodal.tracebrain.llm.CompletionOptions;
import com.phodal.tracebrain.llm.LanguageModelProvider;

/**
 * Stands in when tracebrain.llm.provider is none. Every call fails without retry.
 */
public class UnconfiguredLanguageModelProvider implements LanguageModelProvider {

    @Override
    public String complete(String prompt, CompletionOptions options) {
        throw new ProviderException("No language model provider is configured (tracebrain.llm.provider=none)", false, null);
    }

    @Override
    public String name() {
        return "none";
    }
}
