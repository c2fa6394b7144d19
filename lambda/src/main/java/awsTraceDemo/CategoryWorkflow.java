package awsTraceDemo;

import java.util.Map;

/**
 * One independent operation category of the handler.
 */
public interface CategoryWorkflow {

    /**
     * @return key in the event's actions map, e.g. s3_operations
     */
    String category();

    /**
     * @return key of this category's result in the response body, e.g. s3_data
     */
    String resultKey();

    /**
     * @return programmatic error type recorded when {@link #run} throws
     */
    String errorType();

    /**
     * Runs the category. May throw; the caller contains the failure.
     */
    Map<String, Object> run(InvocationContext ctx);
}
