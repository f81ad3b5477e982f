package com.phodal.tracebrain.server.llm;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.phodal.tracebrain.error.ProviderException;
import com.phodal.tracebrain.llm.CompletionOptions;
import com.phodal.tracebrain.llm.LanguageModelProvider;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Chat completions through the official OpenAI Java SDK. Also serves OpenAI-compatible
 * endpoints by pointing the base URL elsewhere.
 */
@Slf4j
public class OpenAiLanguageModelProvider implements LanguageModelProvider {

    private final OpenAIClient client;
    private final String baseUrl;
    private final String defaultModel;

    public OpenAiLanguageModelProvider(String baseUrl, String apiKey, String defaultModel, Duration timeout) {
        this.baseUrl = baseUrl;
        this.defaultModel = defaultModel;
        // ModelInvoker owns retries
        this.client = OpenAIOkHttpClient.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey != null && !apiKey.isBlank() ? apiKey : "none")
                .timeout(timeout)
                .maxRetries(0)
                .build();
    }

    @Override
    public String complete(String prompt, CompletionOptions options) {
        ChatCompletionCreateParams params = buildParams(prompt, options);
        try {
            ChatCompletion completion = client.chat().completions().create(params);
            if (completion.choices().isEmpty()) {
                throw new ProviderException("Model returned no choices");
            }
            return completion.choices().get(0).message().content()
                    .orElseThrow(() -> new ProviderException("Model returned an empty message"));
        } catch (OpenAIServiceException e) {
            int status = e.statusCode();
            log.warn("OpenAI API at {} answered HTTP {}: {}", baseUrl, status, e.getMessage());
            boolean retryable = status == 408 || status == 429 || status >= 500;
            throw new ProviderException("Model API returned HTTP " + status, retryable, e);
        } catch (OpenAIException e) {
            throw new ProviderException("Model API call failed: " + e.getMessage(), e);
        }
    }

    ChatCompletionCreateParams buildParams(String prompt, CompletionOptions options) {
        ChatCompletionCreateParams.Builder builder = ChatCompletionCreateParams.builder()
                .model(options.model() != null ? options.model() : defaultModel);
        if (options.systemPrompt() != null) {
            builder.addSystemMessage(options.systemPrompt());
        }
        builder.addUserMessage(prompt);
        if (options.temperature() != null) {
            builder.temperature(options.temperature());
        }
        if (options.maxTokens() != null) {
            builder.maxCompletionTokens(options.maxTokens().longValue());
        }
        return builder.build();
    }

    @Override
    public String name() {
        return "openai";
    }
}
