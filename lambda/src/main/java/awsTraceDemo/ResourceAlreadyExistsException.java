package awsTraceDemo;

/**
 * Thrown by a {@link ResourceManager} when the resource it was asked to create is already there.
 */
public class ResourceAlreadyExistsException extends RuntimeException {

    public ResourceAlreadyExistsException(String resourceName, Throwable cause) {
        super("Resource " + resourceName + " already exists", cause);
    }
}
