package awsTraceDemo;

/**
 * The describe and create calls of a service that owns named resources (DynamoDB tables, S3 buckets).
 */
public interface ResourceManager {

    /**
     * @return short service name used in logs, e.g. DynamoDB
     */
    String serviceName();

    /**
     * @return kind of resource in upper case, e.g. TABLE or BUCKET
     */
    String resourceType();

    /**
     * Looks the resource up.
     *
     * @param name resource name
     * @return the observed state, {@link ResourceState#NOT_FOUND} when it does not exist
     */
    ResourceState describe(String name);

    /**
     * Issues the create call. Does not wait for the resource to become usable.
     *
     * @param name resource name
     * @throws ResourceAlreadyExistsException when another creator got there first
     */
    void create(String name);
}
