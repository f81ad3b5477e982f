package com.phodal.tracebrain.schema;

/**
 * Well-known attribute keys of the TraceBrain trace schema.
 * Use these constants instead of raw strings.
 *
 * <p>Keys outside this list are stored and returned unchanged.</p>
 */
public final class AttributeKeys {

    public static final String NAMESPACE = "tracebrain.";

    // Span identity
    public static final String SPAN_TYPE = "tracebrain.span.type";

    // LLM inference; NEW_CONTENT holds only the text this span added
    public static final String LLM_NEW_CONTENT = "tracebrain.llm.new_content";
    public static final String LLM_COMPLETION = "tracebrain.llm.completion";
    public static final String LLM_THOUGHT = "tracebrain.llm.thought";
    public static final String LLM_TOOL_CODE = "tracebrain.llm.tool_code";
    public static final String LLM_FINAL_ANSWER = "tracebrain.llm.final_answer";

    // Tool execution
    public static final String TOOL_NAME = "tracebrain.tool.name";
    public static final String TOOL_INPUT = "tracebrain.tool.input";
    public static final String TOOL_OUTPUT = "tracebrain.tool.output";

    public static final String USAGE = "tracebrain.usage";

    public static final String OTEL_STATUS_CODE = "otel.status_code";
    public static final String OTEL_STATUS_DESCRIPTION = "otel.status_description";

    // Trace level
    public static final String SYSTEM_PROMPT = "system_prompt";
    public static final String EPISODE_ID = "tracebrain.episode.id";
    public static final String TRACE_STATUS = "tracebrain.trace.status";
    public static final String TRACE_PRIORITY = "tracebrain.trace.priority";
    public static final String TRACE_ERROR_TYPE = "tracebrain.trace.error_type";
    public static final String TRACE_SIGNAL_REASON = "tracebrain.trace.signal_reason";
    public static final String AI_EVALUATION = "tracebrain.ai_evaluation";

    private AttributeKeys() {
    }
}
