package awsTraceDemo;

import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.BucketAlreadyOwnedByYouException;
import software.amazon.awssdk.services.s3.model.CreateBucketConfiguration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Bucket lookups and creation through the S3 API. A bucket is usable as soon as HeadBucket finds it.
 */
public class S3BucketManager implements ResourceManager {

    private final S3Client s3;
    private final Region region;

    public S3BucketManager(S3Client s3, Region region) {
        this.s3 = s3;
        this.region = region;
    }

    @Override
    public String serviceName() {
        return "S3";
    }

    @Override
    public String resourceType() {
        return "BUCKET";
    }

    @Override
    public ResourceState describe(String name) {
        try {
            s3.headBucket(HeadBucketRequest.builder().bucket(name).build());
            return ResourceState.ACTIVE;
        } catch (NoSuchBucketException e) {
            return ResourceState.NOT_FOUND;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return ResourceState.NOT_FOUND;
            }
            throw e;
        }
    }

    @Override
    public void create(String name) {
        CreateBucketRequest.Builder request = CreateBucketRequest.builder().bucket(name);
        //us-east-1 is the default location and must not be sent as a constraint
        if (!Region.US_EAST_1.equals(region)) {
            request.createBucketConfiguration(CreateBucketConfiguration.builder()
                    .locationConstraint(region.id())
                    .build());
        }
        try {
            s3.createBucket(request.build());
        } catch (BucketAlreadyOwnedByYouException e) {
            throw new ResourceAlreadyExistsException(name, e);
        }
    }
}
