package com.phodal.tracebrain.server.otel.filter;

import com.phodal.tracebrain.server.config.TraceBrainProperties;
import com.phodal.tracebrain.server.otel.config.OtelProperties;
import com.phodal.tracebrain.server.otel.config.OtelSdkConfig;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.Tracer;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.*;

/**
 * W3C trace context propagation through {@link RequestTracingFilter}.
 */
class RequestTracingFilterTest {

    private OtelSdkConfig config;
    private RequestTracingFilter filter;

    @BeforeEach
    void setUp() {
        OtelProperties otel = new OtelProperties();
        otel.setEnabled(true);
        otel.setExporter(OtelProperties.Exporter.LOG);

        config = new OtelSdkConfig();
        OpenTelemetry openTelemetry = config.openTelemetry(otel, new TraceBrainProperties());
        Tracer tracer = config.tracer(openTelemetry);
        filter = new RequestTracingFilter(openTelemetry, tracer);
    }

    @AfterEach
    void tearDown() {
        config.shutdown();
    }

    @Test
    void shouldCreateSpanForApiRequest() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/traces");

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertInstanceOf(Span.class, request.getAttribute(RequestTracingFilter.SPAN_ATTRIBUTE));
    }

    @Test
    void shouldContinueCallerTrace() throws Exception {
        String traceId = "0af7651916cd43dd8448eb211c80319c";
        String parentSpanId = "b7ad6b7169203331";

        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/traces/T1");
        request.addHeader("traceparent", "00-" + traceId + "-" + parentSpanId + "-01");

        Span[] captured = new Span[1];
        MockFilterChain chain = new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest request, ServletResponse response) {
                captured[0] = Span.current();
            }
        };

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        SpanContext context = captured[0].getSpanContext();
        assertEquals(traceId, context.getTraceId());
        assertNotEquals(parentSpanId, context.getSpanId());
    }

    @Test
    void shouldIgnoreInvalidTraceparent() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/traces");
        request.addHeader("traceparent", "invalid-traceparent-value");

        assertDoesNotThrow(() -> filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain()));
        assertNotNull(request.getAttribute(RequestTracingFilter.SPAN_ATTRIBUTE));
    }

    @Test
    void shouldSkipNonApiPaths() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/health");

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertNull(request.getAttribute(RequestTracingFilter.SPAN_ATTRIBUTE));
    }

    @Test
    void shouldFoldIdsIntoRouteTemplates() {
        assertEquals("/api/v1/traces/{trace_id}", RequestTracingFilter.routeTemplate("/api/v1/traces/T1"));
        assertEquals("/api/v1/traces/{trace_id}/feedback",
                RequestTracingFilter.routeTemplate("/api/v1/traces/T1/feedback"));
        assertEquals("/api/v1/traces/{trace_id}/spans/{span_id}/content",
                RequestTracingFilter.routeTemplate("/api/v1/traces/T1/spans/s2/content"));
        assertEquals("/api/v1/episodes/{episode_id}/traces",
                RequestTracingFilter.routeTemplate("/api/v1/episodes/E1/traces"));
        assertEquals("/api/v1/ai_evaluate/{trace_id}", RequestTracingFilter.routeTemplate("/api/v1/ai_evaluate/T9"));
        assertEquals("/api/v1/stats", RequestTracingFilter.routeTemplate("/api/v1/stats"));
    }

    @Test
    void shouldExtractTraceIdFromPath() {
        assertEquals("T1", RequestTracingFilter.tracedTraceId("/api/v1/traces/T1/signal"));
        assertEquals("T9", RequestTracingFilter.tracedTraceId("/api/v1/ai_evaluate/T9"));
        assertNull(RequestTracingFilter.tracedTraceId("/api/v1/traces"));
    }
}
