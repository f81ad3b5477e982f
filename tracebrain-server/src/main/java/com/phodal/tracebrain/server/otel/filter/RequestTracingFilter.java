package com.phodal.tracebrain.server.otel.filter;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapGetter;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Opens a SERVER span around every /api/v1 request, continuing the caller's W3C trace context.
 * Concrete ids in the path are folded into route templates so span names stay low-cardinality.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class RequestTracingFilter implements Filter {

    public static final String API_PREFIX = "/api/v1/";
    public static final String SPAN_ATTRIBUTE = "otel.span";

    private static final Pattern TRACE_PATH = Pattern.compile("^/api/v1/traces/([^/]+)(/.*)?$");
    private static final Pattern EVALUATE_PATH = Pattern.compile("^/api/v1/ai_evaluate/([^/]+)$");

    private static final List<RouteTemplate> ROUTES = List.of(
            new RouteTemplate(Pattern.compile("^/api/v1/traces/[^/]+/spans/[^/]+/content$"),
                    "/api/v1/traces/{trace_id}/spans/{span_id}/content"),
            new RouteTemplate(Pattern.compile("^/api/v1/traces/[^/]+/(feedback|signal)$"),
                    "/api/v1/traces/{trace_id}/$1"),
            new RouteTemplate(Pattern.compile("^/api/v1/traces/[^/]+$"), "/api/v1/traces/{trace_id}"),
            new RouteTemplate(Pattern.compile("^/api/v1/episodes/[^/]+/traces$"), "/api/v1/episodes/{episode_id}/traces"),
            new RouteTemplate(EVALUATE_PATH, "/api/v1/ai_evaluate/{trace_id}")
    );

    private static final TextMapGetter<HttpServletRequest> HTTP_GETTER = new TextMapGetter<>() {
        @Override
        public Iterable<String> keys(HttpServletRequest carrier) {
            return Collections.list(carrier.getHeaderNames());
        }

        @Override
        public String get(HttpServletRequest carrier, String key) {
            return carrier != null ? carrier.getHeader(key) : null;
        }
    };

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        if (!(request instanceof HttpServletRequest httpRequest) ||
            !(response instanceof HttpServletResponse httpResponse)) {
            chain.doFilter(request, response);
            return;
        }

        String path = httpRequest.getRequestURI();
        if (!shouldTrace(path)) {
            chain.doFilter(request, response);
            return;
        }

        Context extractedContext = openTelemetry.getPropagators()
                .getTextMapPropagator()
                .extract(Context.current(), httpRequest, HTTP_GETTER);

        String route = routeTemplate(path);
        var spanBuilder = tracer.spanBuilder(httpRequest.getMethod() + " " + route)
                .setParent(extractedContext)
                .setSpanKind(SpanKind.SERVER)
                .setAttribute("http.request.method", httpRequest.getMethod())
                .setAttribute("http.route", route)
                .setAttribute("url.path", path);
        String traceId = tracedTraceId(path);
        if (traceId != null) {
            spanBuilder.setAttribute("tracebrain.trace_id", traceId);
        }
        Span span = spanBuilder.startSpan();

        if (Span.fromContext(extractedContext).getSpanContext().isValid()) {
            log.debug("Continued trace from parent: traceId={}, parentSpanId={}",
                    span.getSpanContext().getTraceId(),
                    Span.fromContext(extractedContext).getSpanContext().getSpanId());
        }

        try (Scope ignored = span.makeCurrent()) {
            httpRequest.setAttribute(SPAN_ATTRIBUTE, span);

            chain.doFilter(request, response);

            int statusCode = httpResponse.getStatus();
            span.setAttribute("http.response.status_code", statusCode);
            if (statusCode >= 500) {
                span.setStatus(StatusCode.ERROR, "HTTP " + statusCode);
            } else {
                span.setStatus(StatusCode.OK);
            }
        } catch (IOException | ServletException | RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    static boolean shouldTrace(String path) {
        return path != null && path.startsWith(API_PREFIX);
    }

    static String routeTemplate(String path) {
        for (RouteTemplate route : ROUTES) {
            Matcher matcher = route.pattern().matcher(path);
            if (matcher.matches()) {
                return matcher.replaceAll(route.template());
            }
        }
        return path;
    }

    static String tracedTraceId(String path) {
        Matcher trace = TRACE_PATH.matcher(path);
        if (trace.matches()) {
            return trace.group(1);
        }
        Matcher evaluate = EVALUATE_PATH.matcher(path);
        return evaluate.matches() ? evaluate.group(1) : null;
    }

    private record RouteTemplate(Pattern pattern, String template) {
    }
}
