package com.phodal.tracebrain.server.config;

import com.phodal.tracebrain.analytics.AnalyticsEngine;
import com.phodal.tracebrain.evaluation.TraceEvaluator;
import com.phodal.tracebrain.forest.ReconstructionEngine;
import com.phodal.tracebrain.llm.LanguageModelProvider;
import com.phodal.tracebrain.llm.ModelInvoker;
import com.phodal.tracebrain.llm.RetryPolicy;
import com.phodal.tracebrain.query.QueryTranslator;
import com.phodal.tracebrain.query.StructuredQueryExecutor;
import com.phodal.tracebrain.query.StructuredQueryParser;
import com.phodal.tracebrain.server.llm.OllamaLanguageModelProvider;
import com.phodal.tracebrain.server.llm.OpenAiLanguageModelProvider;
import com.phodal.tracebrain.server.llm.UnconfiguredLanguageModelProvider;
import com.phodal.tracebrain.store.InMemoryTraceRepository;
import com.phodal.tracebrain.store.JsonlTraceRepository;
import com.phodal.tracebrain.store.TraceRepository;
import com.phodal.tracebrain.store.TraceStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;

/**
 * Wires the engine components from {@link TraceBrainProperties}.
 */
@Slf4j
@Configuration
public class CoreConfig {

    static final String OPENAI_BASE_URL = "https://api.openai.com/v1";
    static final String OLLAMA_BASE_URL = "http://localhost:11434";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TraceRepository traceRepository(TraceBrainProperties properties) {
        String backend = properties.getStore().getBackend().toLowerCase(Locale.ROOT);
        return switch (backend) {
            case "memory" -> {
                log.info("Using in-memory trace store");
                yield new InMemoryTraceRepository();
            }
            case "jsonl" -> {
                Path path = Path.of(properties.getStore().getPath());
                log.info("Using JSONL trace store at {}", path.toAbsolutePath());
                yield JsonlTraceRepository.forFile(path);
            }
            default -> throw new IllegalStateException("Unknown tracebrain.store.backend: " + backend);
        };
    }

    @Bean
    public ReconstructionEngine reconstructionEngine() {
        return new ReconstructionEngine();
    }

    @Bean
    public TraceStore traceStore(TraceRepository repository, ReconstructionEngine reconstructionEngine, Clock clock) {
        return new TraceStore(repository, reconstructionEngine, clock);
    }

    @Bean
    public AnalyticsEngine analyticsEngine(TraceStore traceStore, Clock clock) {
        return new AnalyticsEngine(traceStore, clock);
    }

    @Bean
    public StructuredQueryExecutor structuredQueryExecutor(TraceStore traceStore, AnalyticsEngine analyticsEngine) {
        return new StructuredQueryExecutor(traceStore, analyticsEngine);
    }

    @Bean
    public ModelInvoker modelInvoker(TraceBrainProperties properties) {
        TraceBrainProperties.Llm llm = properties.getLlm();
        return new ModelInvoker(new RetryPolicy(
            llm.getMaxRetries(), llm.getInitialBackoff(), llm.getMaxBackoff(), llm.getTimeout()));
    }

    @Bean
    public LanguageModelProvider languageModelProvider(TraceBrainProperties properties, WebClient.Builder webClientBuilder) {
        TraceBrainProperties.Llm llm = properties.getLlm();
        String provider = llm.getProvider() == null ? "none" : llm.getProvider().toLowerCase(Locale.ROOT);
        LanguageModelProvider selected = switch (provider) {
            case "none" -> new UnconfiguredLanguageModelProvider();
            case "openai" -> new OpenAiLanguageModelProvider(
                baseUrlOr(llm, OPENAI_BASE_URL), llm.getApiKey(), llm.getModel(), llm.getTimeout());
            case "openai_compatible" -> {
                if (llm.getBaseUrl() == null || llm.getBaseUrl().isBlank()) {
                    throw new IllegalStateException("tracebrain.llm.base-url is required for openai_compatible");
                }
                yield new OpenAiLanguageModelProvider(llm.getBaseUrl(), llm.getApiKey(), llm.getModel(), llm.getTimeout());
            }
            case "ollama" -> new OllamaLanguageModelProvider(
                webClientBuilder.baseUrl(baseUrlOr(llm, OLLAMA_BASE_URL)).build(), llm.getModel());
            default -> throw new IllegalStateException("Unknown tracebrain.llm.provider: " + provider);
        };
        log.info("Language model provider: {} (model={})", selected.name(), llm.getModel());
        return selected;
    }

    private static String baseUrlOr(TraceBrainProperties.Llm llm, String fallback) {
        return llm.getBaseUrl() == null || llm.getBaseUrl().isBlank() ? fallback : llm.getBaseUrl();
    }

    @Bean
    public QueryTranslator queryTranslator(LanguageModelProvider provider, ModelInvoker modelInvoker,
                                           TraceBrainProperties properties) {
        TraceBrainProperties.Llm llm = properties.getLlm();
        return new QueryTranslator(provider, modelInvoker, new StructuredQueryParser(),
            QueryTranslator.defaultOptions().withSampling(llm.getTemperature(), llm.getMaxTokens()));
    }

    @Bean
    public TraceEvaluator traceEvaluator(LanguageModelProvider provider, ModelInvoker modelInvoker,
                                         ReconstructionEngine reconstructionEngine) {
        return new TraceEvaluator(provider, modelInvoker, reconstructionEngine);
    }
}
