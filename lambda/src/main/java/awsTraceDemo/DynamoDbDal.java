package awsTraceDemo;

import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.model.UpdateItemEnhancedRequest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Data access for the key-value store: table readiness and item create / read / update.
 * Item deletion is deliberately not performed so that demo data stays in the table.
 */
public class DynamoDbDal {

    static final String DELETE_SKIP_REASON = "Data preservation requested - keeping items in table";

    private final DynamoDbTable<Item> table;
    private final ResourceReadiness readiness;
    private final OperationExecutor executor;
    private final OperationLog log;

    public DynamoDbDal(DynamoDbTable<Item> table, ResourceReadiness readiness, OperationExecutor executor, OperationLog log) {
        this.table = table;
        this.readiness = readiness;
        this.executor = executor;
        this.log = log;
    }

    /**
     * Maps the named table onto {@link Item} through the enhanced client.
     */
    public static DynamoDbTable<Item> itemTable(DynamoDbEnhancedClient enhancedClient, String tableName) {
        return enhancedClient.table(tableName, TableSchema.fromBean(Item.class));
    }

    public boolean ensureTableExists() {
        return readiness.ensureExists(getTableName());
    }

    /**
     * Puts the item, replacing any item with the same id.
     *
     * @return status, item_id
     */
    public Map<String, Object> createItem(Item item) {
        executor.execute("PUT_ITEM", getTableName(), () -> {
            table.putItem(item);
            return null;
        });
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "success");
        result.put("item_id", item.getId());
        return result;
    }

    /**
     * @return status (success or not_found), item_id, item_found and the item when found
     */
    public Map<String, Object> readItem(String itemId) {
        Item item = executor.execute("GET_ITEM", getTableName(),
                () -> table.getItem(Key.builder().partitionValue(itemId).build()));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", item != null ? "success" : "not_found");
        result.put("item_id", itemId);
        result.put("item_found", item != null);
        if (item != null) {
            result.put("item_data", item.toMap());
        }
        return result;
    }

    /**
     * Sets status and updated_at on an existing item; other attributes are left as they are.
     *
     * @return status, item_id and the names of the attributes the item has after the update
     */
    public Map<String, Object> updateItem(String itemId, String status, String updatedAt) {
        Item changes = new Item();
        changes.setId(itemId);
        changes.setStatus(status);
        changes.setUpdatedAt(updatedAt);
        Item updated = executor.execute("UPDATE_ITEM", getTableName(), () -> table.updateItem(
                UpdateItemEnhancedRequest.builder(Item.class).item(changes).ignoreNulls(true).build()));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "success");
        result.put("item_id", itemId);
        result.put("updated_attributes", updated != null ? new ArrayList<>(updated.toMap().keySet()) : List.of());
        return result;
    }

    /**
     * Records the delete as skipped. The item is not touched.
     *
     * @return status skipped, item_id, reason
     */
    public Map<String, Object> deleteItem(String itemId) {
        executor.skip("DELETE_ITEM", getTableName() + "/" + itemId, DELETE_SKIP_REASON);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "skipped");
        result.put("item_id", itemId);
        result.put("reason", DELETE_SKIP_REASON);
        return result;
    }

    /**
     * Drops the whole table. Failures are reported in the result rather than thrown.
     *
     * @return status (success or failed), table_name, and error details on failure
     */
    public Map<String, Object> deleteTable() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("table_name", getTableName());
        try {
            executor.execute("DELETE_TABLE", getTableName(), () -> {
                table.deleteTable();
                return null;
            });
            result.put("status", "success");
            result.put("message", "Table " + getTableName() + " deleted successfully");
        } catch (RuntimeException e) {
            result.put("status", "failed");
            result.put("error", String.valueOf(e.getMessage()));
            result.put("error_type", e.getClass().getSimpleName());
        }
        log.event("Database_Operations", "Delete_Table", result);
        return result;
    }

    public String getTableName() {
        return table.tableName();
    }

    /**
     * A demo item. The partition key is {@code id}; metadata is a JSON string.
     */
    @DynamoDbBean
    public static class Item {
        private String id;
        private String data;
        private String timestamp;
        private String status;
        private String updatedAt;
        private String metadata;

        @DynamoDbPartitionKey
        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getData() {
            return data;
        }

        public void setData(String data) {
            this.data = data;
        }

        public String getTimestamp() {
            return timestamp;
        }

        public void setTimestamp(String timestamp) {
            this.timestamp = timestamp;
        }

        public String getStatus() {
            return status;
        }

        public void setStatus(String status) {
            this.status = status;
        }

        @DynamoDbAttribute("updated_at")
        public String getUpdatedAt() {
            return updatedAt;
        }

        public void setUpdatedAt(String updatedAt) {
            this.updatedAt = updatedAt;
        }

        public String getMetadata() {
            return metadata;
        }

        public void setMetadata(String metadata) {
            this.metadata = metadata;
        }

        /**
         * Attributes that are set, under their table attribute names.
         */
        public Map<String, String> toMap() {
            Map<String, String> map = new LinkedHashMap<>();
            putIfSet(map, "id", id);
            putIfSet(map, "data", data);
            putIfSet(map, "timestamp", timestamp);
            putIfSet(map, "status", status);
            putIfSet(map, "updated_at", updatedAt);
            putIfSet(map, "metadata", metadata);
            return map;
        }

        private static void putIfSet(Map<String, String> map, String name, String value) {
            if (value != null) {
                map.put(name, value);
            }
        }
    }
}
