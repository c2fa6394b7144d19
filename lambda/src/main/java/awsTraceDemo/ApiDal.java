package awsTraceDemo;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Data access for the outbound HTTP API: one GET against the selected endpoint.
 */
public class ApiDal {

    private final OkHttpClient client;
    private final String endpoint;
    private final OperationExecutor executor;
    private final OperationLog log;

    public ApiDal(OkHttpClient client, String endpoint, OperationExecutor executor, OperationLog log) {
        this.client = client;
        this.endpoint = endpoint;
        this.executor = executor;
        this.log = log;
    }

    /**
     * HTTP client whose connect, read and whole-call timeouts all equal {@code timeout}.
     */
    public static OkHttpClient httpClient(Duration timeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .callTimeout(timeout)
                .build();
    }

    /**
     * Fetches the endpoint and extracts the post it returns.
     *
     * @return post_id, post_title, endpoint_used, status_code, response_time (seconds)
     * @throws ApiResponseException when the API answers with a non-2xx status
     * @throws OperationFailedException when the call fails at the IO level, including timeouts
     */
    public Map<String, Object> fetchData() {
        Map<String, Object> artifacts = new LinkedHashMap<>();
        artifacts.put("endpoint", endpoint);
        artifacts.put("action", "api_call_start");
        log.event("API_Operations", "External_API", artifacts);

        Map<String, Object> result = executor.execute("HTTP_GET", endpoint, this::get);

        Map<String, Object> done = new LinkedHashMap<>(result);
        done.put("action", "api_call_complete");
        log.event("External_API", "API_Operations", done);
        return result;
    }

    private Map<String, Object> get() throws IOException {
        Request request = new Request.Builder().url(endpoint).get().build();
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new ApiResponseException(endpoint, response.code());
            }
            ResponseBody body = response.body();
            String json = body != null ? body.string() : "";
            JsonObject post;
            try {
                post = JsonParser.parseString(json).getAsJsonObject();
            } catch (JsonParseException | IllegalStateException e) {
                throw new IOException("Response from " + endpoint + " is not a JSON object", e);
            }

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("endpoint_used", endpoint);
            result.put("post_id", value(post.get("id")));
            result.put("post_title", value(post.get("title")));
            result.put("status_code", response.code());
            result.put("response_time", (response.receivedResponseAtMillis() - response.sentRequestAtMillis()) / 1000.0);
            return result;
        }
    }

    private static Object value(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonPrimitive()) {
            JsonPrimitive primitive = element.getAsJsonPrimitive();
            if (primitive.isNumber()) {
                return primitive.getAsLong();
            }
            if (primitive.isBoolean()) {
                return primitive.getAsBoolean();
            }
            return primitive.getAsString();
        }
        return element.toString();
    }

    public String getEndpoint() {
        return endpoint;
    }
}
