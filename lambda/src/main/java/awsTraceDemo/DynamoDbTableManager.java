package awsTraceDemo;

import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Table lookups and creation through the DynamoDB control plane.
 * Tables are created with a single string partition key {@code id} and on-demand billing.
 */
public class DynamoDbTableManager implements ResourceManager {

    static final String PARTITION_KEY = "id";

    private final DynamoDbClient ddb;

    public DynamoDbTableManager(DynamoDbClient ddb) {
        this.ddb = ddb;
    }

    @Override
    public String serviceName() {
        return "DynamoDB";
    }

    @Override
    public String resourceType() {
        return "TABLE";
    }

    @Override
    public ResourceState describe(String name) {
        TableStatus status;
        try {
            status = ddb.describeTable(DescribeTableRequest.builder().tableName(name).build()).table().tableStatus();
        } catch (ResourceNotFoundException e) {
            return ResourceState.NOT_FOUND;
        }
        return toResourceState(status);
    }

    static ResourceState toResourceState(TableStatus status) {
        if (status == null) {
            return ResourceState.ERROR;
        }
        switch (status) {
            case ACTIVE:
                return ResourceState.ACTIVE;
            case CREATING:
            case UPDATING:
                return ResourceState.CREATING;
            default:
                // DELETING, ARCHIVED, inaccessible keys ... nothing we can work with
                return ResourceState.ERROR;
        }
    }

    @Override
    public void create(String name) {
        CreateTableRequest request = CreateTableRequest.builder()
                .tableName(name)
                .keySchema(KeySchemaElement.builder().attributeName(PARTITION_KEY).keyType(KeyType.HASH).build())
                .attributeDefinitions(AttributeDefinition.builder()
                        .attributeName(PARTITION_KEY)
                        .attributeType(ScalarAttributeType.S)
                        .build())
                .billingMode(BillingMode.PAY_PER_REQUEST)
                .build();
        try {
            ddb.createTable(request);
        } catch (ResourceInUseException e) {
            throw new ResourceAlreadyExistsException(name, e);
        }
    }
}
