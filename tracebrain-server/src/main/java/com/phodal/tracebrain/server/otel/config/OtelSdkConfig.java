package com.phodal.tracebrain.server.otel.config;

import com.phodal.tracebrain.server.config.TraceBrainProperties;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporterBuilder;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporterBuilder;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collection;

/**
 * OpenTelemetry SDK for the API request spans produced by
 * {@link com.phodal.tracebrain.server.otel.filter.RequestTracingFilter}.
 */
@Slf4j
@Configuration
public class OtelSdkConfig {

    static final String INSTRUMENTATION_NAME = "com.phodal.tracebrain.server";

    static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
    static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT = AttributeKey.stringKey("deployment.environment");
    static final AttributeKey<String> STORE_BACKEND = AttributeKey.stringKey("tracebrain.store.backend");
    static final AttributeKey<String> LLM_PROVIDER = AttributeKey.stringKey("tracebrain.llm.provider");
    static final AttributeKey<String> LLM_MODEL = AttributeKey.stringKey("tracebrain.llm.model");

    private SdkTracerProvider tracerProvider;

    @Bean
    public OpenTelemetry openTelemetry(OtelProperties otel, TraceBrainProperties properties) {
        if (!otel.isEnabled()) {
            log.info("API request tracing is disabled");
            return OpenTelemetry.noop();
        }

        Resource resource = resource(otel, properties);
        log.info("API request tracing enabled: exporter={}, store={}, provider={}",
                otel.getExporter(), resource.getAttribute(STORE_BACKEND), resource.getAttribute(LLM_PROVIDER));

        tracerProvider = SdkTracerProvider.builder()
                .setResource(resource)
                .addSpanProcessor(BatchSpanProcessor.builder(exporter(otel))
                        .setScheduleDelay(otel.getScheduleDelay())
                        .build())
                .build();

        return OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                .build();
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_NAME, version());
    }

    /**
     * Identifies this TraceBrain instance: which store it writes to and which model answers its queries.
     */
    static Resource resource(OtelProperties otel, TraceBrainProperties properties) {
        TraceBrainProperties.Llm llm = properties.getLlm();
        var attributes = Attributes.builder()
                .put(SERVICE_NAME, "tracebrain")
                .put(SERVICE_VERSION, version())
                .put(DEPLOYMENT_ENVIRONMENT, otel.getEnvironment())
                .put(STORE_BACKEND, properties.getStore().getBackend())
                .put(LLM_PROVIDER, llm.getProvider());
        if (!"none".equals(llm.getProvider())) {
            attributes.put(LLM_MODEL, llm.getModel());
        }
        return Resource.getDefault().merge(Resource.create(attributes.build()));
    }

    static SpanExporter exporter(OtelProperties otel) {
        return switch (otel.getExporter()) {
            case OTLP_HTTP -> httpExporter(otel);
            case OTLP_GRPC -> grpcExporter(otel);
            case LOG -> new RequestLogExporter();
        };
    }

    private static SpanExporter httpExporter(OtelProperties otel) {
        log.info("Exporting API spans over OTLP/HTTP to {}", otel.getEndpoint());
        OtlpHttpSpanExporterBuilder builder = OtlpHttpSpanExporter.builder()
                .setEndpoint(otel.getEndpoint())
                .setTimeout(otel.getExportTimeout());
        otel.getHeaders().forEach(builder::addHeader);
        return builder.build();
    }

    private static SpanExporter grpcExporter(OtelProperties otel) {
        log.info("Exporting API spans over OTLP/gRPC to {}", otel.getEndpoint());
        OtlpGrpcSpanExporterBuilder builder = OtlpGrpcSpanExporter.builder()
                .setEndpoint(otel.getEndpoint())
                .setTimeout(otel.getExportTimeout());
        otel.getHeaders().forEach(builder::addHeader);
        return builder.build();
    }

    private static String version() {
        String version = OtelSdkConfig.class.getPackage().getImplementationVersion();
        return version != null ? version : "dev";
    }

    @PreDestroy
    public void shutdown() {
        if (tracerProvider != null) {
            log.info("Flushing API request spans");
            tracerProvider.shutdown();
        }
    }

    /**
     * Writes one debug line per finished API request span.
     */
    static class RequestLogExporter implements SpanExporter {

        private static final AttributeKey<String> ROUTE = AttributeKey.stringKey("http.route");
        private static final AttributeKey<Long> STATUS = AttributeKey.longKey("http.response.status_code");
        private static final AttributeKey<String> TRACE_ID = AttributeKey.stringKey("tracebrain.trace_id");

        @Override
        public CompletableResultCode export(Collection<SpanData> spans) {
            for (SpanData span : spans) {
                Attributes attributes = span.getAttributes();
                log.debug("{} {} -> {} in {}ms (trace={}, otel trace={})",
                        span.getName(), attributes.get(ROUTE), attributes.get(STATUS),
                        (span.getEndEpochNanos() - span.getStartEpochNanos()) / 1_000_000,
                        attributes.get(TRACE_ID), span.getTraceId());
            }
            return CompletableResultCode.ofSuccess();
        }

        @Override
        public CompletableResultCode flush() {
            return CompletableResultCode.ofSuccess();
        }

        @Override
        public CompletableResultCode shutdown() {
            return CompletableResultCode.ofSuccess();
        }
    }
}
