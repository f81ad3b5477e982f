package com.phodal.tracebrain.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.phodal.tracebrain.error.ValidationException;
import com.phodal.tracebrain.store.TraceFilter;

/**
 * A validated query in the closed grammar the translator produces.
 *
 * @param action what to run
 * @param filter trace constraints, never {@code null}
 * @param traceId required for {@link QueryAction#GET_TRACE}
 * @param episodeId required for {@link QueryAction#EPISODE_TRACES}
 * @param limit result cap within 1..{@value #MAX_LIMIT}, {@code null} for the default
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StructuredQuery(
    QueryAction action,
    TraceFilter filter,
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("episode_id") String episodeId,
    Integer limit
) {

    public static final int MAX_LIMIT = 100;
    public static final int DEFAULT_LIMIT = 20;

    public StructuredQuery {
        if (action == null) {
            throw new ValidationException("'action' is required");
        }
        filter = filter != null ? filter : TraceFilter.none();
        if (limit != null && (limit < 1 || limit > MAX_LIMIT)) {
            throw new ValidationException("'limit' must be within 1.." + MAX_LIMIT + ", got " + limit);
        }
        if (action == QueryAction.GET_TRACE && isBlank(traceId)) {
            throw new ValidationException("'get_trace' requires 'trace_id'");
        }
        if (action == QueryAction.EPISODE_TRACES && isBlank(episodeId)) {
            throw new ValidationException("'episode_traces' requires 'episode_id'");
        }
    }

    public static StructuredQuery of(QueryAction action) {
        return new StructuredQuery(action, null, null, null, null);
    }

    public int effectiveLimit() {
        return limit != null ? limit : DEFAULT_LIMIT;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
