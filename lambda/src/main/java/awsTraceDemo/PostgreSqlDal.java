package awsTraceDemo;

import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Data access for the relational store: users, products and orders in PostgreSQL.
 * <p>
 * One connection is opened on first use and held until {@link #close()}. Every statement first checks
 * the workflow deadline and carries the time left as its query timeout. Without a configured host the
 * class runs in simulation mode and answers with the same result shapes, flagged {@code simulated}.
 */
public class PostgreSqlDal implements AutoCloseable {

    static final String QUERY_CANCELED = "57014";

    static final Set<String> USER_UPDATE_FIELDS = Set.of("username", "email", "status");
    static final Set<String> PRODUCT_UPDATE_FIELDS = Set.of("name", "price", "category", "status");

    private static final String CREATE_USERS = "CREATE TABLE IF NOT EXISTS users ("
            + " id VARCHAR(255) PRIMARY KEY,"
            + " username VARCHAR(255) NOT NULL,"
            + " email VARCHAR(255) NOT NULL,"
            + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
            + " updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
            + " status VARCHAR(50) DEFAULT 'active')";

    private static final String CREATE_PRODUCTS = "CREATE TABLE IF NOT EXISTS products ("
            + " id VARCHAR(255) PRIMARY KEY,"
            + " name VARCHAR(255) NOT NULL,"
            + " price DECIMAL(10,2) NOT NULL,"
            + " category VARCHAR(100),"
            + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
            + " updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
            + " status VARCHAR(50) DEFAULT 'active')";

    private static final String CREATE_ORDERS = "CREATE TABLE IF NOT EXISTS orders ("
            + " id VARCHAR(255) PRIMARY KEY,"
            + " user_id VARCHAR(255) NOT NULL,"
            + " total_amount DECIMAL(10,2) NOT NULL,"
            + " status VARCHAR(50) DEFAULT 'pending',"
            + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
            + " updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
            + " FOREIGN KEY (user_id) REFERENCES users(id))";

    /**
     * Opens a JDBC connection.
     */
    @FunctionalInterface
    public interface ConnectionFactory {
        Connection open() throws SQLException;
    }

    private final ConnectionFactory connectionFactory;
    private final Deadline deadline;
    private final OperationExecutor executor;
    private final OperationLog log;
    private final TraceRecorder trace;
    private Connection connection;

    /**
     * @param connectionFactory source of the connection, or null for simulation mode
     * @param deadline bound for the whole workflow
     * @param executor records each statement
     * @param log milestone log
     * @param trace execution tags
     */
    public PostgreSqlDal(ConnectionFactory connectionFactory, Deadline deadline, OperationExecutor executor,
                         OperationLog log, TraceRecorder trace) {
        this.connectionFactory = connectionFactory;
        this.deadline = deadline;
        this.executor = executor;
        this.log = log;
        this.trace = trace;
    }

    /**
     * Connection factory for the configured database, or null when no real host is configured.
     * Credentials are resolved when the connection is opened.
     */
    public static ConnectionFactory connectionFactory(Configuration conf, SecretsManagerClient secretsClient) {
        if (!conf.isRdsConfigured()) {
            return null;
        }
        return () -> {
            String[] creds = conf.getRdsCredentials(secretsClient);
            Properties props = new Properties();
            props.setProperty("user", creds[0]);
            if (creds[1] != null) {
                props.setProperty("password", creds[1]);
            }
            props.setProperty("connectTimeout", "5");
            return DriverManager.getConnection(conf.getJdbcUrl(), props);
        };
    }

    public boolean isSimulated() {
        return connectionFactory == null;
    }

    /**
     * Creates users, products and orders when they are missing.
     *
     * @return true when the tables are usable
     */
    public boolean ensureTablesExist() {
        if (isSimulated()) {
            log.log("Simulating table creation, no database host configured");
            return true;
        }
        execute("CREATE_TABLE", "users", CREATE_USERS);
        execute("CREATE_TABLE", "products", CREATE_PRODUCTS);
        execute("CREATE_TABLE", "orders", CREATE_ORDERS);

        Map<String, Object> artifacts = new LinkedHashMap<>();
        artifacts.put("tables", List.of("users", "products", "orders"));
        log.event("RDS_Operations", "PostgreSQL_Schema", artifacts);
        return true;
    }

    /**
     * @param userId new user id
     * @param username user name
     * @param email email address
     * @return affected_rows, user_id, status created, operation INSERT
     */
    public Map<String, Object> createUser(String userId, String username, String email) {
        int affected = 1;
        if (!isSimulated()) {
            tag("INSERT", "users", userId);
            affected = update("INSERT", "users",
                    "INSERT INTO users (id, username, email, status) VALUES (?, ?, ?, ?)",
                    userId, username, email, "active");
        }
        Map<String, Object> result = result(affected, "created", "INSERT");
        result.put("user_id", userId);
        return result;
    }

    /**
     * @return user_found, user_data (null when missing), query_time in seconds, operation SELECT
     */
    public Map<String, Object> readUser(String userId) {
        long started = executor.getClock().millis();
        Map<String, Object> user;
        if (isSimulated()) {
            user = new LinkedHashMap<>();
            user.put("id", userId);
            user.put("username", "user_" + shortId(userId));
            user.put("email", "user_" + shortId(userId) + "@example.com");
            user.put("created_at", executor.getClock().instant().toString());
            user.put("status", "active");
        } else {
            tag("SELECT", "users", userId);
            user = queryOne("SELECT", "users",
                    "SELECT id, username, email, created_at, status FROM users WHERE id = ?", userId);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("user_found", user != null);
        result.put("user_data", user);
        result.put("query_time", (executor.getClock().millis() - started) / 1000.0);
        result.put("operation", "SELECT");
        addSimulatedFlag(result);
        return result;
    }

    /**
     * Updates the whitelisted user columns found in {@code updates}; anything else is ignored.
     *
     * @return affected_rows, updated_fields, status (updated or no_changes), operation UPDATE
     */
    public Map<String, Object> updateUser(String userId, Map<String, Object> updates) {
        if (!isSimulated()) {
            tag("UPDATE", "users", userId);
        }
        return updateWhitelisted("UPDATE", "users", USER_UPDATE_FIELDS, userId, updates);
    }

    /**
     * @return affected_rows, deleted_user_id, status deleted, operation DELETE
     */
    public Map<String, Object> deleteUser(String userId) {
        int affected = 1;
        if (!isSimulated()) {
            tag("DELETE", "users", userId);
            affected = update("DELETE", "users", "DELETE FROM users WHERE id = ?", userId);
        }
        Map<String, Object> result = result(affected, "deleted", "DELETE");
        result.put("deleted_user_id", userId);
        return result;
    }

    public Map<String, Object> insertProduct(String productId, String name, BigDecimal price, String category) {
        int affected = 1;
        if (!isSimulated()) {
            trace.addExecutionTag("postgresql_operation", "INSERT");
            trace.addExecutionTag("postgresql_table", "products");
            trace.addExecutionTag("postgresql_product_id", productId);
            affected = update("INSERT", "products",
                    "INSERT INTO products (id, name, price, category, status) VALUES (?, ?, ?, ?, ?)",
                    productId, name, price, category, "active");
        }
        Map<String, Object> result = result(affected, "created", "INSERT_PRODUCT");
        result.put("product_id", productId);
        return result;
    }

    public Map<String, Object> updateProduct(String productId, Map<String, Object> updates) {
        return updateWhitelisted("UPDATE_PRODUCT", "products", PRODUCT_UPDATE_FIELDS, productId, updates);
    }

    public Map<String, Object> deleteProduct(String productId) {
        int affected = 1;
        if (!isSimulated()) {
            affected = update("DELETE", "products", "DELETE FROM products WHERE id = ?", productId);
        }
        Map<String, Object> result = result(affected, "deleted", "DELETE_PRODUCT");
        result.put("deleted_product_id", productId);
        return result;
    }

    /**
     * Orders reference users, so {@code userId} must exist.
     */
    public Map<String, Object> insertOrder(String orderId, String userId, BigDecimal totalAmount) {
        int affected = 1;
        if (!isSimulated()) {
            affected = update("INSERT", "orders",
                    "INSERT INTO orders (id, user_id, total_amount, status) VALUES (?, ?, ?, ?)",
                    orderId, userId, totalAmount, "pending");
        }
        Map<String, Object> result = result(affected, "created", "INSERT_ORDER");
        result.put("order_id", orderId);
        return result;
    }

    public Map<String, Object> updateOrderStatus(String orderId, String newStatus) {
        int affected = 1;
        if (!isSimulated()) {
            affected = update("UPDATE", "orders",
                    "UPDATE orders SET status = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?", newStatus, orderId);
        }
        Map<String, Object> result = result(affected, "updated", "UPDATE_ORDER_STATUS");
        result.put("updated_fields", List.of("status"));
        return result;
    }

    public Map<String, Object> deleteOrder(String orderId) {
        int affected = 1;
        if (!isSimulated()) {
            affected = update("DELETE", "orders", "DELETE FROM orders WHERE id = ?", orderId);
        }
        Map<String, Object> result = result(affected, "deleted", "DELETE_ORDER");
        result.put("deleted_order_id", orderId);
        return result;
    }

    private Map<String, Object> updateWhitelisted(String operation, String table, Set<String> allowed,
                                                  String id, Map<String, Object> updates) {
        List<String> fields = new ArrayList<>();
        List<Object> values = new ArrayList<>();
        for (Map.Entry<String, Object> update : updates.entrySet()) {
            if (allowed.contains(update.getKey())) {
                fields.add(update.getKey());
                values.add(update.getValue());
            }
        }
        if (fields.isEmpty()) {
            Map<String, Object> result = result(0, "no_changes", operation);
            result.put("updated_fields", List.of());
            return result;
        }

        int affected = 1;
        if (!isSimulated()) {
            StringBuilder sql = new StringBuilder("UPDATE ").append(table).append(" SET ");
            for (String field : fields) {
                //field names come from the whitelist only
                sql.append(field).append(" = ?, ");
            }
            sql.append("updated_at = CURRENT_TIMESTAMP WHERE id = ?");
            values.add(id);
            affected = update("UPDATE", table, sql.toString(), values.toArray());
        }
        Map<String, Object> result = result(affected, "updated", operation);
        result.put("updated_fields", fields);
        return result;
    }

    private void execute(String kind, String table, String sql) {
        statement(kind, table, () -> {
            try (Statement statement = connection().createStatement()) {
                statement.setQueryTimeout(deadline.remainingSecondsAtLeastOne());
                statement.execute(sql);
            }
            return null;
        });
    }

    private int update(String kind, String table, String sql, Object... params) {
        return statement(kind, table, () -> {
            try (PreparedStatement statement = prepare(sql, params)) {
                return statement.executeUpdate();
            }
        });
    }

    private Map<String, Object> queryOne(String kind, String table, String sql, Object... params) {
        return statement(kind, table, () -> {
            try (PreparedStatement statement = prepare(sql, params);
                 ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return null;
                }
                Map<String, Object> row = new LinkedHashMap<>();
                int columns = resultSet.getMetaData().getColumnCount();
                for (int i = 1; i <= columns; i++) {
                    Object value = resultSet.getObject(i);
                    if (value instanceof Timestamp) {
                        value = ((Timestamp) value).toInstant().toString();
                    }
                    row.put(resultSet.getMetaData().getColumnLabel(i), value);
                }
                return row;
            }
        });
    }

    @FunctionalInterface
    private interface SqlCall<T> {
        T call() throws SQLException;
    }

    /**
     * Runs one statement under the deadline. The driver reports an expired query timeout as a
     * cancelled query (SQLState 57014), which is surfaced as {@link OperationTimeoutException}
     * together with any other failure once the deadline has passed.
     */
    private <T> T statement(String kind, String table, SqlCall<T> call) {
        String step = kind + " " + table;
        return executor.execute("SQL_" + kind, table, () -> {
            deadline.check(step);
            try {
                return call.call();
            } catch (SQLException e) {
                if (QUERY_CANCELED.equals(e.getSQLState()) || deadline.isExpired()) {
                    throw new OperationTimeoutException("Operation exceeded " + deadline.getBudget().getSeconds()
                            + "s deadline during " + step, e);
                }
                throw e;
            }
        });
    }

    private PreparedStatement prepare(String sql, Object... params) throws SQLException {
        PreparedStatement statement = connection().prepareStatement(sql);
        try {
            statement.setQueryTimeout(deadline.remainingSecondsAtLeastOne());
            for (int i = 0; i < params.length; i++) {
                statement.setObject(i + 1, params[i]);
            }
        } catch (SQLException e) {
            statement.close();
            throw e;
        }
        return statement;
    }

    private Connection connection() throws SQLException {
        if (connection == null || connection.isClosed()) {
            connection = connectionFactory.open();
        }
        return connection;
    }

    private void tag(String operation, String table, String userId) {
        trace.addExecutionTag("postgresql_operation", operation);
        trace.addExecutionTag("postgresql_table", table);
        trace.addExecutionTag("postgresql_user_id", userId);
    }

    private Map<String, Object> result(int affectedRows, String status, String operation) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("affected_rows", affectedRows);
        result.put("status", status);
        result.put("operation", operation);
        addSimulatedFlag(result);
        return result;
    }

    private void addSimulatedFlag(Map<String, Object> result) {
        if (isSimulated()) {
            result.put("simulated", true);
        }
    }

    private static String shortId(String id) {
        return id.length() > 8 ? id.substring(0, 8) : id;
    }

    /**
     * Closes the connection if one was opened.
     */
    @Override
    public void close() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            throw new RuntimeException(e);
        } finally {
            connection = null;
        }
    }
}
