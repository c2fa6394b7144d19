package awsTraceDemo;

import org.json.simple.JSONObject;
import org.json.simple.JSONValue;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.ParameterNotFoundException;
import software.amazon.lambda.powertools.parameters.ParamManager;
import software.amazon.lambda.powertools.parameters.SSMProvider;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Settings of the function, read from environment variables with documented defaults.
 * When PARAMETER_PREFIX is set, each setting is looked up first in Systems Manager Parameter Store
 * under {@code <prefix>/<VARIABLE_NAME>} and the environment is only the fallback.
 */
public class Configuration {

    public static final String DEFAULT_TABLE_NAME = "example-table";
    public static final String DEFAULT_BUCKET_NAME = "example-bucket";
    public static final String DEFAULT_API_BASE_URL = "https://jsonplaceholder.typicode.com/posts";

    private final Map<String, String> environment;
    private final SSMProvider ssmProvider;
    private final String parameterPrefix;
    //the provider caches values only, so misses are remembered here
    private final Set<String> missingParameters = ConcurrentHashMap.newKeySet();

    /**
     * Reads the process environment, and Parameter Store when PARAMETER_PREFIX is set.
     */
    public Configuration() {
        this(System.getenv(), null);
    }

    /**
     * @param environment variables to read
     * @param ssmProvider Parameter Store provider, or null to build one on demand when PARAMETER_PREFIX is set
     */
    public Configuration(Map<String, String> environment, SSMProvider ssmProvider) {
        this.environment = environment;
        this.parameterPrefix = blankToNull(environment.get("PARAMETER_PREFIX"));
        if (ssmProvider == null && parameterPrefix != null) {
            //Initialize ssmClient to retrieve parameters from Systems Manager
            SsmClient client = SsmClient.builder().region(getRegion()).build();
            ssmProvider = ParamManager.getSsmProvider(client);
        }
        this.ssmProvider = ssmProvider;
    }

    String get(String name, String defaultValue) {
        if (ssmProvider != null && parameterPrefix != null && !missingParameters.contains(name)) {
            try {
                String value = ssmProvider.get(parameterPrefix + "/" + name);
                if (value != null && !value.isBlank()) {
                    return value;
                }
            } catch (ParameterNotFoundException e) {
                // not kept in Parameter Store, the environment decides from now on
                missingParameters.add(name);
                return fromEnvironment(name, defaultValue);
            }
        }
        return fromEnvironment(name, defaultValue);
    }

    private String fromEnvironment(String name, String defaultValue) {
        String value = blankToNull(environment.get(name));
        return value != null ? value : defaultValue;
    }

    int getInt(String name, int defaultValue) {
        String value = get(name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Setting %s must be an integer, got '%s'", name, value), e);
        }
    }

    public Region getRegion() {
        String region = blankToNull(environment.get("AWS_REGION"));
        return Region.of(region != null ? region : "us-east-1");
    }

    public String getTableBaseName() {
        return get("DYNAMODB_TABLE_NAME", DEFAULT_TABLE_NAME);
    }

    public String getBucketBaseName() {
        return get("S3_BUCKET_NAME", DEFAULT_BUCKET_NAME);
    }

    public int getResourceReplicas() {
        return getInt("RESOURCE_REPLICAS", 3);
    }

    public String getApiBaseUrl() {
        String url = get("API_BASE_URL", DEFAULT_API_BASE_URL);
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public Duration getHttpTimeout() {
        return Duration.ofSeconds(getInt("HTTP_TIMEOUT_SECONDS", 10));
    }

    public Duration getResourceWait() {
        return Duration.ofSeconds(getInt("RESOURCE_WAIT_SECONDS", 60));
    }

    public Duration getResourcePollInterval() {
        return Duration.ofMillis(getInt("RESOURCE_POLL_MILLIS", 2000));
    }

    public String getRdsHost() {
        return get("RDS_HOST", "localhost");
    }

    public int getRdsPort() {
        return getInt("RDS_PORT", 5432);
    }

    public String getRdsDatabaseName() {
        return get("RDS_DATABASE_NAME", "lumigo_test");
    }

    public String getRdsUsername() {
        return get("RDS_USERNAME", "lumigo_admin");
    }

    public String getRdsPassword() {
        return get("RDS_PASSWORD", null);
    }

    public String getRdsSecretName() {
        return get("RDS_SECRET_NAME", null);
    }

    public Duration getRdsOperationTimeout() {
        return Duration.ofSeconds(getInt("RDS_OPERATION_TIMEOUT_SECONDS", 30));
    }

    public Duration getCategoryTimeout() {
        return Duration.ofSeconds(getInt("CATEGORY_TIMEOUT_SECONDS", 120));
    }

    public boolean isRunCategoriesConcurrently() {
        return Boolean.parseBoolean(get("RUN_CATEGORIES_CONCURRENTLY", "false"));
    }

    /**
     * A real database is only used when a host other than localhost is configured.
     */
    public boolean isRdsConfigured() {
        String host = getRdsHost();
        return host != null && !host.isBlank() && !"localhost".equalsIgnoreCase(host);
    }

    public String getJdbcUrl() {
        return "jdbc:postgresql://" + getRdsHost() + ":" + getRdsPort() + "/" + getRdsDatabaseName();
    }

    /**
     * Database credentials. Taken from the Secrets Manager secret named by RDS_SECRET_NAME when set
     * (a JSON document with username and password), otherwise from RDS_USERNAME / RDS_PASSWORD.
     *
     * @param secretsClient client used only when a secret name is configured
     * @return username and password, in that order
     */
    public String[] getRdsCredentials(SecretsManagerClient secretsClient) {
        String secretName = getRdsSecretName();
        if (secretName == null) {
            return new String[]{getRdsUsername(), getRdsPassword()};
        }
        GetSecretValueRequest request = GetSecretValueRequest.builder().secretId(secretName).build();
        GetSecretValueResponse response = secretsClient.getSecretValue(request);
        Object parsed = JSONValue.parse(response.secretString());
        if (!(parsed instanceof JSONObject)) {
            throw new IllegalStateException("Secret " + secretName + " is not a JSON object");
        }
        JSONObject jsonObject = (JSONObject) parsed;
        return new String[]{(String) jsonObject.get("username"), (String) jsonObject.get("password")};
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    @Override
    public String toString() {
        return "Configuration{table=" + getTableBaseName()
                + ", bucket=" + getBucketBaseName()
                + ", replicas=" + getResourceReplicas()
                + ", apiBaseUrl=" + getApiBaseUrl()
                + ", rds=" + getRdsUsername() + "@" + getRdsHost() + ":" + getRdsPort() + "/" + getRdsDatabaseName()
                + ", rdsPassword=" + (getRdsPassword() == null ? "<unset>" : "****")
                + ", parameterPrefix=" + parameterPrefix
                + "}";
    }
}
