package awsTraceDemo;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;

import java.util.Map;

/**
 * Writes execution tags and programmatic errors onto the current OpenTelemetry span,
 * in the attribute layout Lumigo reads.
 * <p>
 * Tag keys are capped at 50 characters and values at 70; longer ones are truncated rather than
 * rejected. Nothing here throws: a tracing problem must never fail the invocation.
 */
public class OpenTelemetryTraceRecorder implements TraceRecorder {

    static final String EXECUTION_TAG_PREFIX = "lumigo.execution_tags.";
    static final String PROGRAMMATIC_ERROR_EVENT = "Programmatic Error";
    static final int MAX_TAG_KEY_LENGTH = 50;
    static final int MAX_TAG_VALUE_LENGTH = 70;

    private final OperationLog log;

    public OpenTelemetryTraceRecorder(OperationLog log) {
        this.log = log;
    }

    @Override
    public void addExecutionTag(String key, String value) {
        Span span = Span.current();
        String tagKey = truncate(key, MAX_TAG_KEY_LENGTH);
        String tagValue = truncate(String.valueOf(value), MAX_TAG_VALUE_LENGTH);
        span.setAttribute(EXECUTION_TAG_PREFIX + tagKey, tagValue);
        log.log("Added execution tag: " + tagKey + " = " + tagValue);
    }

    @Override
    public void addProgrammaticError(String errorType, String message, Map<String, String> details) {
        Span span = Span.current();
        AttributesBuilder attributes = Attributes.builder()
                .put("lumigo.type", errorType)
                .put("message", String.valueOf(message));
        if (details != null) {
            for (Map.Entry<String, String> detail : details.entrySet()) {
                attributes.put("error." + detail.getKey(), String.valueOf(detail.getValue()));
            }
        }
        span.addEvent(PROGRAMMATIC_ERROR_EVENT, attributes.build());
        log.log("Added programmatic error: " + errorType + " - " + message);
    }

    static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
