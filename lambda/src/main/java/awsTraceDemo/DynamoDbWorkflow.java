package awsTraceDemo;

import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Create, read and update one item in a round-robin table, creating the table first when needed.
 * The closing delete is recorded as skipped and the item stays in the table. With the event action
 * {@code delete_table} the selected table is dropped instead.
 */
public class DynamoDbWorkflow implements CategoryWorkflow {

    static final int OPERATIONS_COUNT = 4;

    @Override
    public String category() {
        return InvocationEvent.DATABASE_OPERATIONS;
    }

    @Override
    public String resultKey() {
        return "db_data";
    }

    @Override
    public String errorType() {
        return "DATABASE_OPERATION_FAILED";
    }

    @Override
    public Map<String, Object> run(InvocationContext ctx) {
        Configuration conf = ctx.getConf();
        String tableName = ResourceSelector.select(conf.getTableBaseName(), conf.getResourceReplicas(), ctx.getClock()).getSelected();
        ctx.getTrace().addExecutionTag("database", "DynamoDB");
        ctx.getTrace().addExecutionTag("database_table", tableName);

        DynamoDbTable<DynamoDbDal.Item> table = DynamoDbDal.itemTable(ctx.getClients().getEnhancedClient(), tableName);
        DynamoDbTableManager tables = new DynamoDbTableManager(ctx.getClients().getDynamoDb());
        DynamoDbDal dal = new DynamoDbDal(table, ctx.readiness(tables), ctx.getExecutor(), ctx.getLog());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("table_used", tableName);

        if (ctx.getEvent().isDeleteTable()) {
            ctx.getTrace().addExecutionTag("dynamodb_action", "delete_table");
            Map<String, Object> deleted = dal.deleteTable();
            result.put("status", deleted.get("status"));
            if (deleted.containsKey("error")) {
                result.put("error", deleted.get("error"));
            }
            return result;
        }

        if (!dal.ensureTableExists()) {
            result.put("status", "table_setup_failed");
            ctx.getTrace().addExecutionTag("dynamodb_skipped", "true");
            return result;
        }

        String itemId = UUID.randomUUID().toString();
        DynamoDbDal.Item item = new DynamoDbDal.Item();
        item.setId(itemId);
        item.setTimestamp(ctx.getClock().instant().toString());
        item.setData("Sample data for CRUD demonstration");
        item.setStatus("active");
        item.setMetadata("{\"created_by\":\"lambda-function\",\"version\":\"1.0\"}");

        dal.createItem(item);
        Map<String, Object> read = dal.readItem(itemId);
        Map<String, Object> updated = dal.updateItem(itemId, "updated", ctx.getClock().instant().toString());
        Map<String, Object> deleted = dal.deleteItem(itemId);

        result.put("operations_count", OPERATIONS_COUNT);
        result.put("item_id", itemId);
        result.put("item_found", read.get("item_found"));
        result.put("updated_attributes", updated.get("updated_attributes"));
        result.put("delete_status", deleted.get("status"));

        ctx.getTrace().addExecutionTag("dynamodb_status", "success");
        ctx.getTrace().addExecutionTag("dynamodb_item_id", itemId);
        ctx.getLog().event("Database_Operations", "Lambda_Handler", result);
        return result;
    }
}
