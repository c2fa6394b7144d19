package awsTraceDemo;

import java.util.Map;

/**
 * The two tracing primitives the workflows use: execution tags for search and filtering,
 * and programmatic errors for failures that are handled rather than thrown.
 */
public interface TraceRecorder {

    void addExecutionTag(String key, String value);

    void addProgrammaticError(String errorType, String message, Map<String, String> details);
}
