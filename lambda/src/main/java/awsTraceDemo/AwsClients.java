package awsTraceDemo;

import okhttp3.OkHttpClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;

/**
 * The service clients one handler instance works with. Built once per execution environment
 * and handed to every workflow.
 */
public class AwsClients {

    private final Region region;
    private final S3Client s3;
    private final DynamoDbClient dynamoDb;
    private final DynamoDbEnhancedClient enhancedClient;
    private final SecretsManagerClient secretsManager;
    private final OkHttpClient httpClient;

    public AwsClients(Region region, S3Client s3, DynamoDbClient dynamoDb, SecretsManagerClient secretsManager,
                      OkHttpClient httpClient) {
        this.region = region;
        this.s3 = s3;
        this.dynamoDb = dynamoDb;
        this.enhancedClient = DynamoDbEnhancedClient.builder().dynamoDbClient(dynamoDb).build();
        this.secretsManager = secretsManager;
        this.httpClient = httpClient;
    }

    /**
     * Clients for the configured region. Credentials come from the default provider chain.
     */
    public static AwsClients create(Configuration conf) {
        Region region = conf.getRegion();
        return new AwsClients(region,
                S3Client.builder().region(region).build(),
                DynamoDbClient.builder().region(region).build(),
                SecretsManagerClient.builder().region(region).build(),
                ApiDal.httpClient(conf.getHttpTimeout()));
    }

    public Region getRegion() {
        return region;
    }

    public S3Client getS3() {
        return s3;
    }

    public DynamoDbClient getDynamoDb() {
        return dynamoDb;
    }

    public DynamoDbEnhancedClient getEnhancedClient() {
        return enhancedClient;
    }

    public SecretsManagerClient getSecretsManager() {
        return secretsManager;
    }

    public OkHttpClient getHttpClient() {
        return httpClient;
    }
}
