package com.phodal.tracebrain.server.config;

import com.phodal.tracebrain.store.Deadline;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the TraceBrain server.
 * Maps to tracebrain.* in application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "tracebrain")
public class TraceBrainProperties {

    /**
     * Deadline applied to every mutating request.
     */
    private Duration requestTimeout = Duration.ofSeconds(10);

    private Store store = new Store();

    private Llm llm = new Llm();

    /**
     * Deadline for a request starting now; unbounded when no timeout is configured.
     */
    public Deadline requestDeadline() {
        return requestTimeout == null ? Deadline.none() : Deadline.after(requestTimeout);
    }

    @Data
    public static class Store {
        /**
         * memory or jsonl.
         */
        private String backend = "memory";

        /**
         * JSONL file used by the jsonl backend.
         */
        private String path = ".tracebrain/traces.jsonl";
    }

    @Data
    public static class Llm {
        /**
         * none, openai, openai_compatible or ollama.
         */
        private String provider = "none";

        private String model = "gpt-4o-mini";

        /**
         * API root. Defaults per provider when empty.
         */
        private String baseUrl;

        private String apiKey;

        /**
         * Per-attempt timeout of a model call.
         */
        private Duration timeout = Duration.ofSeconds(30);

        private int maxRetries = 2;

        private Duration initialBackoff = Duration.ofMillis(500);

        private Duration maxBackoff = Duration.ofSeconds(5);

        private Double temperature = 0.0;

        private Integer maxTokens = 1024;
    }
}
