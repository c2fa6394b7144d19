package awsTraceDemo;

/**
 * Unchecked wrapper for checked exceptions (SQL, IO) raised by an external call.
 */
public class OperationFailedException extends RuntimeException {

    public OperationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
