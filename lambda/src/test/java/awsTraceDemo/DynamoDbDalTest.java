package awsTraceDemo;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClientExtension;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbIndex;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.UpdateItemEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class DynamoDbDalTest {

    private static final String TABLE = "example-table-3";

    private InMemoryItemTable table;
    private final List<OperationRecord> records = new ArrayList<>();
    private TestSupport.CapturingLogger logger;
    private DynamoDbDal dal;

    @BeforeEach
    void setUp() {
        table = new InMemoryItemTable(TABLE);
        logger = new TestSupport.CapturingLogger();
        OperationLog log = TestSupport.operationLog(logger);
        OperationExecutor executor = new OperationExecutor(record -> {
            records.add(record);
            log.emit(record);
        }, TestSupport.MutableClock.atEpochSecond(1_700_000_000L));
        dal = new DynamoDbDal(table, null, executor, log);
    }

    private static DynamoDbDal.Item item(String id) {
        DynamoDbDal.Item item = new DynamoDbDal.Item();
        item.setId(id);
        item.setTimestamp("2026-10-19T10:00:00Z");
        item.setData("Sample data for CRUD demonstration");
        item.setStatus("active");
        item.setMetadata("{\"created_by\":\"lambda-function\",\"version\":\"1.0\"}");
        return item;
    }

    @Test
    void shouldCreateThenReadItem() {
        dal.createItem(item("a1"));

        Map<String, Object> read = dal.readItem("a1");

        assertEquals("success", read.get("status"));
        assertEquals(true, read.get("item_found"));
        @SuppressWarnings("unchecked")
        Map<String, String> data = (Map<String, String>) read.get("item_data");
        assertEquals("Sample data for CRUD demonstration", data.get("data"));
    }

    @Test
    void shouldReportMissingItem() {
        Map<String, Object> read = dal.readItem("nope");
        assertEquals("not_found", read.get("status"));
        assertEquals(false, read.get("item_found"));
    }

    @Test
    void shouldUpdateOnlyStatusAndUpdatedAt() {
        dal.createItem(item("a2"));

        Map<String, Object> updated = dal.updateItem("a2", "updated", "2026-10-19T10:00:05Z");

        assertEquals(List.of("id", "data", "timestamp", "status", "updated_at", "metadata"), updated.get("updated_attributes"));
        DynamoDbDal.Item stored = table.items.get("a2");
        assertEquals("updated", stored.getStatus());
        assertEquals("2026-10-19T10:00:05Z", stored.getUpdatedAt());
        assertEquals("Sample data for CRUD demonstration", stored.getData());
    }

    @Test
    void shouldSkipDeleteAndKeepItemReadable() {
        dal.createItem(item("a3"));

        Map<String, Object> deleted = dal.deleteItem("a3");

        assertEquals("skipped", deleted.get("status"));
        assertEquals(DynamoDbDal.DELETE_SKIP_REASON, deleted.get("reason"));
        assertEquals(0, table.deleteItemCalls);
        assertEquals(true, dal.readItem("a3").get("item_found"));
        OperationRecord skip = records.get(1);
        assertEquals("DELETE_ITEM", skip.getOperationKind());
        assertEquals(OperationRecord.Status.SKIPPED, skip.getStatus());
    }

    @Test
    void shouldDeleteTableOnRequest() {
        Map<String, Object> result = dal.deleteTable();
        assertEquals("success", result.get("status"));
        assertTrue(table.deleted);
    }

    @Test
    void shouldReportTableDeleteFailure() {
        table.deleteFailure = ResourceNotFoundException.builder().message("Requested resource not found").build();

        Map<String, Object> result = dal.deleteTable();

        assertEquals("failed", result.get("status"));
        assertEquals("ResourceNotFoundException", result.get("error_type"));
        assertTrue(logger.contains("Delete_Table"));
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    class TableManager {

        @Mock
        private DynamoDbClient ddb;

        private DescribeTableResponse status(TableStatus status) {
            return DescribeTableResponse.builder().table(TableDescription.builder().tableStatus(status).build()).build();
        }

        @Test
        void shouldMapTableStatuses() {
            assertEquals(ResourceState.ACTIVE, DynamoDbTableManager.toResourceState(TableStatus.ACTIVE));
            assertEquals(ResourceState.CREATING, DynamoDbTableManager.toResourceState(TableStatus.CREATING));
            assertEquals(ResourceState.CREATING, DynamoDbTableManager.toResourceState(TableStatus.UPDATING));
            assertEquals(ResourceState.ERROR, DynamoDbTableManager.toResourceState(TableStatus.DELETING));
            assertEquals(ResourceState.ERROR, DynamoDbTableManager.toResourceState(null));
        }

        @Test
        void shouldTreatMissingTableAsNotFound() {
            when(ddb.describeTable(any(DescribeTableRequest.class))).thenThrow(ResourceNotFoundException.builder().build());
            assertEquals(ResourceState.NOT_FOUND, new DynamoDbTableManager(ddb).describe(TABLE));
        }

        @Test
        void shouldCreateOnDemandTableKeyedById() {
            new DynamoDbTableManager(ddb).create(TABLE);

            ArgumentCaptor<CreateTableRequest> request = ArgumentCaptor.forClass(CreateTableRequest.class);
            verify(ddb).createTable(request.capture());
            assertEquals(BillingMode.PAY_PER_REQUEST, request.getValue().billingMode());
            assertEquals("id", request.getValue().keySchema().get(0).attributeName());
            assertEquals(KeyType.HASH, request.getValue().keySchema().get(0).keyType());
        }

        @Test
        void shouldTranslateResourceInUse() {
            when(ddb.createTable(any(CreateTableRequest.class))).thenThrow(ResourceInUseException.builder().message("Table already exists").build());
            assertThrows(ResourceAlreadyExistsException.class, () -> new DynamoDbTableManager(ddb).create(TABLE));
        }

        @Test
        void shouldBecomeReadyAfterCreating() {
            when(ddb.describeTable(any(DescribeTableRequest.class)))
                    .thenThrow(ResourceNotFoundException.builder().build())
                    .thenReturn(status(TableStatus.CREATING))
                    .thenReturn(status(TableStatus.ACTIVE));
            OperationLog log = TestSupport.operationLog(logger);
            OperationExecutor executor = new OperationExecutor(log, TestSupport.MutableClock.atEpochSecond(0));
            ResourceReadiness readiness = new ResourceReadiness(new DynamoDbTableManager(ddb), executor, log,
                    Duration.ofSeconds(60), Duration.ofSeconds(2), millis -> { });

            assertTrue(new DynamoDbDal(table, readiness, executor, log).ensureTableExists());
            verify(ddb).createTable(any(CreateTableRequest.class));
        }
    }

    /**
     * Keeps items in a map. Only the calls the DAL makes are implemented.
     */
    static final class InMemoryItemTable implements DynamoDbTable<DynamoDbDal.Item> {
        private final String name;
        final Map<String, DynamoDbDal.Item> items = new HashMap<>();
        int deleteItemCalls;
        boolean deleted;
        RuntimeException deleteFailure;

        InMemoryItemTable(String name) {
            this.name = name;
        }

        @Override
        public DynamoDbEnhancedClientExtension mapperExtension() {
            return null;
        }

        @Override
        public TableSchema<DynamoDbDal.Item> tableSchema() {
            return TableSchema.fromBean(DynamoDbDal.Item.class);
        }

        @Override
        public String tableName() {
            return name;
        }

        @Override
        public Key keyFrom(DynamoDbDal.Item item) {
            return Key.builder().partitionValue(item.getId()).build();
        }

        @Override
        public DynamoDbIndex<DynamoDbDal.Item> index(String indexName) {
            throw new UnsupportedOperationException("no indexes");
        }

        @Override
        public void putItem(DynamoDbDal.Item item) {
            items.put(item.getId(), copy(item));
        }

        @Override
        public DynamoDbDal.Item getItem(Key key) {
            DynamoDbDal.Item item = items.get(key.partitionKeyValue().s());
            return item != null ? copy(item) : null;
        }

        @Override
        public DynamoDbDal.Item updateItem(UpdateItemEnhancedRequest<DynamoDbDal.Item> request) {
            DynamoDbDal.Item changes = request.item();
            DynamoDbDal.Item stored = items.computeIfAbsent(changes.getId(), id -> {
                DynamoDbDal.Item created = new DynamoDbDal.Item();
                created.setId(id);
                return created;
            });
            if (changes.getStatus() != null) {
                stored.setStatus(changes.getStatus());
            }
            if (changes.getUpdatedAt() != null) {
                stored.setUpdatedAt(changes.getUpdatedAt());
            }
            return copy(stored);
        }

        @Override
        public DynamoDbDal.Item deleteItem(Key key) {
            deleteItemCalls++;
            return items.remove(key.partitionKeyValue().s());
        }

        @Override
        public void deleteTable() {
            if (deleteFailure != null) {
                throw deleteFailure;
            }
            deleted = true;
        }

        private static DynamoDbDal.Item copy(DynamoDbDal.Item item) {
            DynamoDbDal.Item copy = new DynamoDbDal.Item();
            copy.setId(item.getId());
            copy.setData(item.getData());
            copy.setTimestamp(item.getTimestamp());
            copy.setStatus(item.getStatus());
            copy.setUpdatedAt(item.getUpdatedAt());
            copy.setMetadata(item.getMetadata());
            return copy;
        }
    }
}
