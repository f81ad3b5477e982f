package com.phodal.tracebrain.server.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.phodal.tracebrain.error.ProviderException;
import com.phodal.tracebrain.llm.CompletionOptions;
import com.phodal.tracebrain.llm.LanguageModelProvider;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat completions against a local Ollama server ({@code POST /api/chat}, non-streaming).
 */
@Slf4j
public class OllamaLanguageModelProvider implements LanguageModelProvider {

    private final WebClient ollamaWebClient;
    private final String defaultModel;

    public OllamaLanguageModelProvider(WebClient ollamaWebClient, String defaultModel) {
        this.ollamaWebClient = ollamaWebClient;
        this.defaultModel = defaultModel;
    }

    @Override
    public String complete(String prompt, CompletionOptions options) {
        OllamaChatResponse response;
        try {
            response = ollamaWebClient.post()
                    .uri("/api/chat")
                    .bodyValue(buildPayload(prompt, options))
                    .retrieve()
                    .bodyToMono(OllamaChatResponse.class)
                    .block();
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            log.warn("Ollama answered HTTP {}: {}", status, e.getResponseBodyAsString());
            throw new ProviderException("Ollama returned HTTP " + status, status == 429 || status >= 500, e);
        } catch (WebClientRequestException e) {
            throw new ProviderException("Ollama is unreachable: " + e.getMessage(), e);
        }

        if (response == null || response.getMessage() == null || response.getMessage().getContent() == null) {
            throw new ProviderException("Ollama returned no message");
        }
        return response.getMessage().getContent();
    }

    Map<String, Object> buildPayload(String prompt, CompletionOptions options) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", options.model() != null ? options.model() : defaultModel);
        payload.put("stream", false);
        if (options.jsonResponse()) {
            payload.put("format", "json");
        }

        List<Map<String, Object>> messages = new ArrayList<>();
        if (options.systemPrompt() != null) {
            messages.add(Map.of("role", "system", "content", options.systemPrompt()));
        }
        messages.add(Map.of("role", "user", "content", prompt));
        payload.put("messages", messages);

        Map<String, Object> modelOptions = new HashMap<>();
        if (options.temperature() != null) {
            modelOptions.put("temperature", options.temperature());
        }
        if (options.maxTokens() != null) {
            modelOptions.put("num_predict", options.maxTokens());
        }
        if (!modelOptions.isEmpty()) {
            payload.put("options", modelOptions);
        }
        return payload;
    }

    @Override
    public String name() {
        return "ollama";
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OllamaChatResponse {
        private Message message;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {
        private String role;
        private String content;
    }
}
