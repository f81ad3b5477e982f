package com.phodal.tracebrain.query;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of running a {@link StructuredQuery}.
 *
 * @param query the query that was executed
 * @param result traces, a single trace, an episode, stats or tool usage depending on the action
 * @param total number of matches before the limit was applied, for list actions only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResult(StructuredQuery query, Object result, Long total) {
}
