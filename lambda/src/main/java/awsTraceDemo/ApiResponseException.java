package awsTraceDemo;

/**
 * The API answered, but not with a 2xx status.
 */
public class ApiResponseException extends RuntimeException {

    private final int statusCode;

    public ApiResponseException(String endpoint, int statusCode) {
        super("HTTP " + statusCode + " from " + endpoint);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
