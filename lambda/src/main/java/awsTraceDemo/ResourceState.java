package awsTraceDemo;

/**
 * Lifecycle of an external table or bucket as seen through a describe/head call.
 */
public enum ResourceState {
    NOT_FOUND,
    CREATING,
    ACTIVE,
    ERROR
}
