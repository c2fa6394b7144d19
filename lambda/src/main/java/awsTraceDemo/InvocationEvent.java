package awsTraceDemo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The parsed input event. Every field is optional; a field of the wrong type is rejected with
 * {@link IllegalArgumentException} so the handler can answer 500 instead of guessing.
 */
public final class InvocationEvent {

    public static final String API_OPERATIONS = "api_operations";
    public static final String S3_OPERATIONS = "s3_operations";
    public static final String DATABASE_OPERATIONS = "database_operations";
    public static final String RDS_OPERATIONS = "rds_operations";

    static final List<String> CATEGORIES = List.of(API_OPERATIONS, S3_OPERATIONS, DATABASE_OPERATIONS, RDS_OPERATIONS);

    static final String DELETE_TABLE_ACTION = "delete_table";

    private final boolean hasData;
    private final String data;
    private final Map<String, Boolean> actions;
    private final String action;
    private final Object test;
    private final Object source;
    private final Object timestamp;

    private InvocationEvent(boolean hasData, String data, Map<String, Boolean> actions, String action,
                            Object test, Object source, Object timestamp) {
        this.hasData = hasData;
        this.data = data;
        this.actions = actions;
        this.action = action;
        this.test = test;
        this.source = source;
        this.timestamp = timestamp;
    }

    /**
     * @param event raw Lambda event, null is treated as empty
     * @throws IllegalArgumentException when data, actions or action has the wrong type
     */
    public static InvocationEvent parse(Map<String, Object> event) {
        Map<String, Object> raw = event != null ? event : Collections.emptyMap();

        Object data = raw.get("data");
        if (data != null && !(data instanceof String)) {
            throw new IllegalArgumentException("Event field 'data' must be a string, got " + data.getClass().getSimpleName());
        }

        Object action = raw.get("action");
        if (action != null && !(action instanceof String)) {
            throw new IllegalArgumentException("Event field 'action' must be a string, got " + action.getClass().getSimpleName());
        }

        return new InvocationEvent(raw.containsKey("data"), (String) data, parseActions(raw.get("actions")),
                (String) action, raw.get("test"), raw.get("source"), raw.get("timestamp"));
    }

    private static Map<String, Boolean> parseActions(Object actions) {
        Map<String, Boolean> enabled = new LinkedHashMap<>();
        for (String category : CATEGORIES) {
            enabled.put(category, Boolean.TRUE);
        }
        if (actions == null) {
            return Collections.unmodifiableMap(enabled);
        }
        if (!(actions instanceof Map)) {
            throw new IllegalArgumentException("Event field 'actions' must be an object, got " + actions.getClass().getSimpleName());
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) actions).entrySet()) {
            String category = String.valueOf(entry.getKey());
            if (enabled.containsKey(category)) {
                enabled.put(category, toBoolean(category, entry.getValue()));
            }
        }
        return Collections.unmodifiableMap(enabled);
    }

    private static Boolean toBoolean(String category, Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if ("true".equalsIgnoreCase(String.valueOf(value))) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(String.valueOf(value))) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Action '" + category + "' must be true or false, got " + value);
    }

    public boolean isEnabled(String category) {
        return actions.getOrDefault(category, Boolean.TRUE);
    }

    public boolean isDeleteTable() {
        return DELETE_TABLE_ACTION.equals(action);
    }

    /**
     * @return "Processed: DATA" when data was sent, "No data to process" otherwise
     */
    public String processedResult() {
        return data != null ? "Processed: " + data.toUpperCase(Locale.ROOT) : "No data to process";
    }

    /**
     * Execution tags describing the event: has_data, data_length, is_test, event_source, event_timestamp.
     */
    public Map<String, String> tags() {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("has_data", String.valueOf(hasData));
        if (data != null) {
            tags.put("data_length", String.valueOf(data.length()));
        }
        if (test != null) {
            tags.put("is_test", String.valueOf(test));
        }
        if (source != null) {
            tags.put("event_source", String.valueOf(source));
        }
        if (timestamp != null) {
            tags.put("event_timestamp", String.valueOf(timestamp));
        }
        return tags;
    }

    public String getData() {
        return data;
    }

    public Map<String, Boolean> getActions() {
        return actions;
    }

    public String getAction() {
        return action;
    }
}
