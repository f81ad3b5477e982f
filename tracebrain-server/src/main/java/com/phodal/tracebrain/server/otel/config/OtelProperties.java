package com.phodal.tracebrain.server.otel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Tracing of the TraceBrain API itself, under tracebrain.otel.* in application.yml.
 * Service identity is fixed; the resource also names the configured store backend and model provider.
 */
@Data
@Component
@ConfigurationProperties(prefix = "tracebrain.otel")
public class OtelProperties {

    public enum Exporter {
        /**
         * Spans go to the application log at debug level.
         */
        LOG,
        OTLP_GRPC,
        OTLP_HTTP
    }

    /**
     * When disabled, a no-op tracer is used.
     */
    private boolean enabled = false;

    /**
     * Deployment environment (dev, staging, prod).
     */
    private String environment = "dev";

    private Exporter exporter = Exporter.OTLP_GRPC;

    /**
     * gRPC: http://localhost:4317, HTTP: http://localhost:4318/v1/traces
     */
    private String endpoint = "http://localhost:4317";

    private Map<String, String> headers = new HashMap<>();

    private Duration exportTimeout = Duration.ofSeconds(10);

    private Duration scheduleDelay = Duration.ofSeconds(5);
}
