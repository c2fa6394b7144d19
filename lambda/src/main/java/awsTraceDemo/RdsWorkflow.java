package awsTraceDemo;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A user, product and order lifecycle against PostgreSQL, all under one deadline and one connection.
 * Rows are removed in reverse dependency order so the order's foreign key never blocks the user delete.
 */
public class RdsWorkflow implements CategoryWorkflow {

    @Override
    public String category() {
        return InvocationEvent.RDS_OPERATIONS;
    }

    @Override
    public String resultKey() {
        return "rds_data";
    }

    @Override
    public String errorType() {
        return "RDS_OPERATION_FAILED";
    }

    @Override
    public Map<String, Object> run(InvocationContext ctx) {
        Configuration conf = ctx.getConf();
        Deadline deadline = Deadline.after(conf.getRdsOperationTimeout(), ctx.getClock());
        PostgreSqlDal.ConnectionFactory connections = PostgreSqlDal.connectionFactory(conf, ctx.getClients().getSecretsManager());

        String userId = UUID.randomUUID().toString();
        String productId = UUID.randomUUID().toString();
        String orderId = UUID.randomUUID().toString();
        String shortId = userId.substring(0, 8);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("database", "PostgreSQL");
        result.put("database_name", conf.getRdsDatabaseName());

        try (PostgreSqlDal dal = new PostgreSqlDal(connections, deadline, ctx.getExecutor(), ctx.getLog(), ctx.getTrace())) {
            result.put("simulated", dal.isSimulated());
            result.put("tables_ready", dal.ensureTablesExist());

            List<Map<String, Object>> operations = new ArrayList<>();
            operations.add(dal.createUser(userId, "user_" + shortId, "user_" + shortId + "@example.com"));
            Map<String, Object> read = dal.readUser(userId);
            operations.add(read);

            Map<String, Object> userUpdates = new LinkedHashMap<>();
            userUpdates.put("status", "updated");
            userUpdates.put("email", "updated_" + shortId + "@example.com");
            operations.add(dal.updateUser(userId, userUpdates));

            operations.add(dal.insertProduct(productId, "Product " + shortId, new BigDecimal("49.99"), "Electronics"));
            Map<String, Object> productUpdates = new LinkedHashMap<>();
            productUpdates.put("price", new BigDecimal("39.99"));
            productUpdates.put("status", "discounted");
            operations.add(dal.updateProduct(productId, productUpdates));

            operations.add(dal.insertOrder(orderId, userId, new BigDecimal("79.98")));
            operations.add(dal.updateOrderStatus(orderId, "shipped"));

            operations.add(dal.deleteOrder(orderId));
            operations.add(dal.deleteProduct(productId));
            operations.add(dal.deleteUser(userId));

            result.put("user_id", userId);
            result.put("user_found", read.get("user_found"));
            result.put("operations_count", operations.size());
            result.put("operations", operations);
        }

        ctx.getTrace().addExecutionTag("postgresql_status", "success");
        ctx.getLog().event("RDS_Operations", "Lambda_Handler", result);
        return result;
    }
}
